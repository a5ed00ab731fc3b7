package com.integrationhealth.core.probe;

import com.integrationhealth.core.credential.CredentialDecryptor;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.credential.JiraIntegration;
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
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Checks token expiry locally, then calls the Jira Cloud {@code myself} endpoint.
 * An already expired token is reported without a network call.
 */
public class JiraProber implements IntegrationProber<JiraIntegration> {

    private final IntegrationCredentialStore credentialStore;
    private final CredentialDecryptor decryptor;
    private final RestTemplate restTemplate;
    private final String myselfUrlTemplate;
    private final Duration expiryWarning;
    private final Clock clock;

    public JiraProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                      RestTemplate restTemplate, String jiraApiUrl, Duration expiryWarning, Clock clock) {
        this.credentialStore = credentialStore;
        this.decryptor = decryptor;
        this.restTemplate = restTemplate;
        this.myselfUrlTemplate = jiraApiUrl + "/{cloudId}/rest/api/3/myself";
        this.expiryWarning = expiryWarning;
        this.clock = clock;
    }

    @Override
    public IntegrationType type() {
        return IntegrationType.JIRA;
    }

    @Override
    public Optional<JiraIntegration> loadConfiguration(String workspaceId) {
        return credentialStore.findJiraIntegration(workspaceId);
    }

    @Override
    public String integrationId(JiraIntegration jira) {
        return jira.id();
    }

    @Override
    public ProbeResult probe(JiraIntegration jira) {
        long start = clock.millis();
        if (!jira.active()) {
            return ProbeResult.disconnected(clock.millis() - start, "Jira integration inactive", null);
        }

        Instant now = clock.instant();
        Instant expiresAt = jira.tokenExpiresAt();
        boolean expired = expiresAt != null && !expiresAt.isAfter(now);
        boolean expiringSoon = expiresAt != null && expiresAt.isBefore(now.plus(expiryWarning));

        if (expired) {
            return ProbeResult.unhealthy(clock.millis() - start, "Jira token expired", Map.of("tokenExpired", true));
        }

        String token = decryptor.decrypt(jira.workspaceId(), jira.accessToken(), jira.accessTokenIv());
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);

        int statusCode;
        try {
            ResponseEntity<Void> response = restTemplate.exchange(myselfUrlTemplate, HttpMethod.GET,
                new HttpEntity<>(headers), Void.class, jira.cloudId());
            statusCode = response.getStatusCode().value();
        } catch (RestClientException e) {
            return ProbeResult.unhealthy(clock.millis() - start, ProbeErrorSanitizer.sanitize(e));
        }
        long responseTimeMs = clock.millis() - start;

        if (statusCode != 200) {
            return ProbeResult.unhealthy(responseTimeMs, "Jira API returned " + statusCode, Map.of("tokenValid", false));
        }
        if (expiringSoon) {
            return ProbeResult.degraded(responseTimeMs, "Jira token expiring within " + expiryWarning.toHours() + " hours",
                Map.of("tokenValid", true, "tokenExpiringSoon", true));
        }
        if (jira.errorCount() > 0) {
            return ProbeResult.degraded(responseTimeMs, null, Map.of("tokenValid", true, "errorCount", jira.errorCount()));
        }
        return ProbeResult.healthy(responseTimeMs, Map.of("tokenValid", true, "syncCount", jira.syncCount()));
    }
}
