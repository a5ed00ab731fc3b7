package com.integrationhealth.core.credential;

public record SlackIntegration(
    String id,
    String workspaceId,
    String status,
    String botToken,        // Encrypted, see CredentialDecryptor
    String botTokenIv,
    int errorCount,
    String lastError,
    long messageCount
) {

    public boolean isActive() {
        return "active".equals(status);
    }
}
