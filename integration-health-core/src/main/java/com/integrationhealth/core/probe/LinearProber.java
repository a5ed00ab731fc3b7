package com.integrationhealth.core.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.integrationhealth.core.credential.CredentialDecryptor;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.credential.LinearIntegration;
import com.integrationhealth.core.logging.ProbeErrorSanitizer;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the token owner with a minimal GraphQL {@code viewer} query.
 */
public class LinearProber implements IntegrationProber<LinearIntegration> {

    private static final Map<String, String> VIEWER_QUERY = Map.of("query", "{ viewer { id } }");

    private final IntegrationCredentialStore credentialStore;
    private final CredentialDecryptor decryptor;
    private final RestTemplate restTemplate;
    private final String graphqlUrl;
    private final Clock clock;

    public LinearProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                        RestTemplate restTemplate, String graphqlUrl, Clock clock) {
        this.credentialStore = credentialStore;
        this.decryptor = decryptor;
        this.restTemplate = restTemplate;
        this.graphqlUrl = graphqlUrl;
        this.clock = clock;
    }

    @Override
    public IntegrationType type() {
        return IntegrationType.LINEAR;
    }

    @Override
    public Optional<LinearIntegration> loadConfiguration(String workspaceId) {
        return credentialStore.findLinearIntegration(workspaceId);
    }

    @Override
    public String integrationId(LinearIntegration linear) {
        return linear.id();
    }

    @Override
    public ProbeResult probe(LinearIntegration linear) {
        long start = clock.millis();
        if (!linear.active()) {
            return ProbeResult.disconnected(clock.millis() - start, "Linear integration inactive", null);
        }

        String token = decryptor.decrypt(linear.workspaceId(), linear.accessToken(), linear.accessTokenIv());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        // Linear personal and OAuth tokens are sent without a scheme
        headers.set(HttpHeaders.AUTHORIZATION, token);

        JsonNode body;
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(graphqlUrl, HttpMethod.POST,
                new HttpEntity<>(VIEWER_QUERY, headers), JsonNode.class);
            body = response.getBody();
        } catch (RestClientException e) {
            return ProbeResult.unhealthy(clock.millis() - start, ProbeErrorSanitizer.sanitize(e));
        }
        long responseTimeMs = clock.millis() - start;

        String viewerId = body == null ? "" : body.path("data").path("viewer").path("id").asText("");
        if (!viewerId.isEmpty()) {
            if (linear.errorCount() > 0) {
                return ProbeResult.degraded(responseTimeMs, null,
                    Map.of("tokenValid", true, "errorCount", linear.errorCount()));
            }
            return ProbeResult.healthy(responseTimeMs, Map.of("tokenValid", true, "syncCount", linear.syncCount()));
        }
        return ProbeResult.unhealthy(responseTimeMs, "Linear token validation failed", Map.of("tokenValid", false));
    }
}
