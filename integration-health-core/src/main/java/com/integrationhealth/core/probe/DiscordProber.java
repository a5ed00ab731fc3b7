package com.integrationhealth.core.probe;

import com.integrationhealth.core.credential.CredentialDecryptor;
import com.integrationhealth.core.credential.DiscordIntegration;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.logging.ProbeErrorSanitizer;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Issues a GET against the decrypted default webhook URL; Discord answers 200 for a live webhook.
 */
public class DiscordProber implements IntegrationProber<DiscordIntegration> {

    private final IntegrationCredentialStore credentialStore;
    private final CredentialDecryptor decryptor;
    private final RestTemplate restTemplate;
    private final Clock clock;

    public DiscordProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                         RestTemplate restTemplate, Clock clock) {
        this.credentialStore = credentialStore;
        this.decryptor = decryptor;
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public IntegrationType type() {
        return IntegrationType.DISCORD;
    }

    @Override
    public Optional<DiscordIntegration> loadConfiguration(String workspaceId) {
        return credentialStore.findDiscordIntegration(workspaceId);
    }

    @Override
    public String integrationId(DiscordIntegration discord) {
        return discord.id();
    }

    @Override
    public ProbeResult probe(DiscordIntegration discord) {
        long start = clock.millis();
        if (!discord.isActive()) {
            return ProbeResult.disconnected(clock.millis() - start, "Discord status: " + discord.status(), null);
        }

        String webhookUrl = decryptor.decrypt(discord.workspaceId(), discord.defaultWebhookUrl(),
            discord.defaultWebhookUrlIv());

        int statusCode;
        try {
            ResponseEntity<Void> response =
                restTemplate.exchange(URI.create(webhookUrl), HttpMethod.GET, HttpEntity.EMPTY, Void.class);
            statusCode = response.getStatusCode().value();
        } catch (RestClientException | IllegalArgumentException e) {
            return ProbeResult.unhealthy(clock.millis() - start, ProbeErrorSanitizer.sanitize(e));
        }
        long responseTimeMs = clock.millis() - start;

        if (statusCode == 200) {
            if (discord.errorCount() > 0) {
                return ProbeResult.degraded(responseTimeMs, null,
                    Map.of("webhookValid", true, "errorCount", discord.errorCount()));
            }
            return ProbeResult.healthy(responseTimeMs, Map.of("webhookValid", true, "messageCount", discord.messageCount()));
        }
        return ProbeResult.unhealthy(responseTimeMs, "Discord webhook returned " + statusCode,
            Map.of("webhookValid", false));
    }
}
