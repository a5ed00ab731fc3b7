package com.integrationhealth.core.credential;

import java.time.Instant;

public record IntegrationConnection(
    String id,
    String workspaceId,
    ConnectionProvider provider,
    ConnectionStatus status,
    Instant lastUsedAt
) {}
