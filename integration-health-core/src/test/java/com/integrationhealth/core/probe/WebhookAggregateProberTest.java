package com.integrationhealth.core.probe;

import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.credential.OutgoingWebhook;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.ProbeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookAggregateProberTest {

    @Mock
    private IntegrationCredentialStore credentialStore;
    
    private WebhookAggregateProber prober;

    @BeforeEach
    void setUp() {
        prober = new WebhookAggregateProber(credentialStore);
    }

    private static OutgoingWebhook healthy(String id) {
        return new OutgoingWebhook(id, "ws-1", true, 0, 5);
    }

    private static OutgoingWebhook failing(String id) {
        return new OutgoingWebhook(id, "ws-1", true, 5, 5);
    }

    @Test
    void testAllHealthy() {
        ProbeResult result = prober.probe(List.of(healthy("a"), healthy("b")));
        
        assertEquals(HealthStatus.HEALTHY, result.status());
        assertEquals(2, result.details().get("activeWebhooks"));
        assertEquals(0, result.details().get("failingWebhooks"));
    }

    @Test
    void testOneOfThreeFailingIsDegraded() {
        ProbeResult result = prober.probe(List.of(healthy("a"), healthy("b"), failing("c")));
        
        assertEquals(HealthStatus.DEGRADED, result.status());
        assertEquals("1/3 webhooks failing", result.error());
    }

    @Test
    void testTwoOfThreeFailingIsUnhealthy() {
        ProbeResult result = prober.probe(List.of(healthy("a"), failing("b"), failing("c")));
        
        assertEquals(HealthStatus.UNHEALTHY, result.status());
        assertEquals("2/3 webhooks failing", result.error());
    }

    @Test
    void testExactlyHalfFailingIsDegraded() {
        assertEquals(HealthStatus.DEGRADED, prober.probe(List.of(healthy("a"), failing("b"))).status());
    }

    @Test
    void testInactiveWebhooksIgnored() {
        OutgoingWebhook inactive = new OutgoingWebhook("z", "ws-1", false, 9, 5);
        
        ProbeResult onlyInactive = prober.probe(List.of(inactive));
        ProbeResult mixed = prober.probe(List.of(inactive, healthy("a")));
        
        assertEquals(HealthStatus.DISCONNECTED, onlyInactive.status());
        assertEquals("No active webhooks", onlyInactive.error());
        assertEquals(HealthStatus.HEALTHY, mixed.status());
    }

    @Test
    void testNoWebhooksMeansNotConnected() {
        when(credentialStore.findWebhooks("ws-1")).thenReturn(List.of());
        
        assertTrue(prober.loadConfiguration("ws-1").isEmpty());
    }

    @Test
    void testFirstWebhookIdentifiesGroup() {
        assertEquals("a", prober.integrationId(List.of(healthy("a"), healthy("b"))));
    }
}
