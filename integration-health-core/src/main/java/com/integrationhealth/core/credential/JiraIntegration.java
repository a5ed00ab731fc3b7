package com.integrationhealth.core.credential;

import java.time.Instant;

public record JiraIntegration(
    String id,
    String workspaceId,
    boolean active,
    String cloudId,
    String accessToken,
    String accessTokenIv,
    Instant tokenExpiresAt,     // Null when the provider issued a non-expiring token
    int errorCount,
    long syncCount
) {}
