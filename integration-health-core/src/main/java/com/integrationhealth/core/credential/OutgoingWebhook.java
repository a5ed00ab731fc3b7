package com.integrationhealth.core.credential;

public record OutgoingWebhook(
    String id,
    String workspaceId,
    boolean active,
    int consecutiveFailures,
    int maxConsecutiveFailures
) {

    public boolean isFailing() {
        return consecutiveFailures >= maxConsecutiveFailures;
    }
}
