package com.integrationhealth.core.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.integrationhealth.core.credential.CredentialDecryptor;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.credential.SlackIntegration;
import com.integrationhealth.core.logging.ProbeErrorSanitizer;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies the bot token with Slack's {@code auth.test}.
 */
public class SlackProber implements IntegrationProber<SlackIntegration> {

    private final IntegrationCredentialStore credentialStore;
    private final CredentialDecryptor decryptor;
    private final RestTemplate restTemplate;
    private final String authTestUrl;
    private final Clock clock;

    public SlackProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                       RestTemplate restTemplate, String slackApiUrl, Clock clock) {
        this.credentialStore = credentialStore;
        this.decryptor = decryptor;
        this.restTemplate = restTemplate;
        this.authTestUrl = slackApiUrl + "/auth.test";
        this.clock = clock;
    }

    @Override
    public IntegrationType type() {
        return IntegrationType.SLACK;
    }

    @Override
    public Optional<SlackIntegration> loadConfiguration(String workspaceId) {
        return credentialStore.findSlackIntegration(workspaceId);
    }

    @Override
    public String integrationId(SlackIntegration slack) {
        return slack.id();
    }

    @Override
    public ProbeResult probe(SlackIntegration slack) {
        long start = clock.millis();
        if (!slack.isActive()) {
            return ProbeResult.disconnected(clock.millis() - start, "Slack status: " + slack.status(), null);
        }

        String token = decryptor.decrypt(slack.workspaceId(), slack.botToken(), slack.botTokenIv());
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);

        JsonNode body;
        try {
            ResponseEntity<JsonNode> response =
                restTemplate.exchange(authTestUrl, HttpMethod.POST, new HttpEntity<>(headers), JsonNode.class);
            body = response.getBody();
        } catch (RestClientException e) {
            return ProbeResult.unhealthy(clock.millis() - start, ProbeErrorSanitizer.sanitize(e));
        }
        long responseTimeMs = clock.millis() - start;

        if (body != null && body.path("ok").asBoolean(false)) {
            if (slack.errorCount() > 0) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("tokenValid", true);
                details.put("errorCount", slack.errorCount());
                if (slack.lastError() != null) {
                    details.put("lastError", slack.lastError());
                }
                return ProbeResult.degraded(responseTimeMs, null, details);
            }
            return ProbeResult.healthy(responseTimeMs, Map.of("tokenValid", true, "messageCount", slack.messageCount()));
        }

        String error = body != null ? body.path("error").asText("Slack auth.test failed") : "Slack auth.test failed";
        return ProbeResult.unhealthy(responseTimeMs, error, Map.of("tokenValid", false));
    }
}
