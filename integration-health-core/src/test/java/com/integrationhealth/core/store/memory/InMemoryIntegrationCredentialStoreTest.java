package com.integrationhealth.core.store.memory;

import com.integrationhealth.core.credential.ConnectionProvider;
import com.integrationhealth.core.credential.ConnectionStatus;
import com.integrationhealth.core.credential.IntegrationConnection;
import com.integrationhealth.core.credential.OutgoingWebhook;
import com.integrationhealth.core.credential.SlackIntegration;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryIntegrationCredentialStoreTest {

    @Test
    void testWorkspaceDiscoveryUnionsAllSources() {
        InMemoryIntegrationCredentialStore store = new InMemoryIntegrationCredentialStore();
        store.put(new SlackIntegration("s1", "ws-1", "active", "tag:cipher", "iv", 0, null, 10));
        store.put(new IntegrationConnection("c1", "ws-2", ConnectionProvider.VERCEL, ConnectionStatus.ACTIVE, Instant.now()));
        store.put(new OutgoingWebhook("w1", "ws-3", true, 0, 5));
        store.put(new OutgoingWebhook("w2", "ws-3", true, 5, 5));

        assertEquals(Set.of("ws-1", "ws-2", "ws-3"), store.findWorkspaceIdsWithIntegrations());
        assertEquals(2, store.findWebhooks("ws-3").size());
        assertTrue(store.findConnection("ws-2", ConnectionProvider.VERCEL).isPresent());
        assertTrue(store.findConnection("ws-2", ConnectionProvider.GITHUB).isEmpty());
        assertTrue(store.findSlackIntegration("ws-2").isEmpty());
    }
}
