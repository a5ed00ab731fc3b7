package com.integrationhealth.core.probe;

import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.credential.OutgoingWebhook;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates every outgoing webhook of a workspace into one status. A webhook is failing once its consecutive
 * delivery failures reach its configured maximum; more than half of the active webhooks failing is unhealthy.
 */
public class WebhookAggregateProber implements IntegrationProber<List<OutgoingWebhook>> {

    private final IntegrationCredentialStore credentialStore;

    public WebhookAggregateProber(IntegrationCredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    @Override
    public IntegrationType type() {
        return IntegrationType.WEBHOOKS;
    }

    @Override
    public Optional<List<OutgoingWebhook>> loadConfiguration(String workspaceId) {
        List<OutgoingWebhook> webhooks = credentialStore.findWebhooks(workspaceId);
        return webhooks.isEmpty() ? Optional.empty() : Optional.of(webhooks);
    }

    /**
     * The first webhook stands in for the group.
     */
    @Override
    public String integrationId(List<OutgoingWebhook> webhooks) {
        return webhooks.get(0).id();
    }

    @Override
    public ProbeResult probe(List<OutgoingWebhook> webhooks) {
        List<OutgoingWebhook> active = webhooks.stream().filter(OutgoingWebhook::active).toList();
        if (active.isEmpty()) {
            return ProbeResult.disconnected(0, "No active webhooks", null);
        }

        int total = active.size();
        int failing = (int) active.stream().filter(OutgoingWebhook::isFailing).count();
        Map<String, Object> details = Map.of("activeWebhooks", total, "failingWebhooks", failing);

        if (failing == 0) {
            return ProbeResult.healthy(0, details);
        }
        String error = failing + "/" + total + " webhooks failing";
        if (failing > total / 2.0) {
            return ProbeResult.unhealthy(0, error, details);
        }
        return ProbeResult.degraded(0, error, details);
    }
}
