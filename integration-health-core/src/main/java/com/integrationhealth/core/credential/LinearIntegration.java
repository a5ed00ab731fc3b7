package com.integrationhealth.core.credential;

public record LinearIntegration(
    String id,
    String workspaceId,
    boolean active,
    String accessToken,
    String accessTokenIv,
    int errorCount,
    long syncCount
) {}
