package com.integrationhealth.core.credential;

public record DiscordIntegration(
    String id,
    String workspaceId,
    String status,
    String defaultWebhookUrl,       // Encrypted; the plain URL embeds the webhook token
    String defaultWebhookUrlIv,
    int errorCount,
    long messageCount
) {

    public boolean isActive() {
        return "active".equals(status);
    }
}
