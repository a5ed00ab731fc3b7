package com.integrationhealth.core.store.memory;

import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryHealthRecordStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryHealthRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthRecordStore();
    }

    @Test
    void testOneRecordPerWorkspaceAndType() {
        store.save(new HealthRecord("ws-1", IntegrationType.SLACK, "a", HealthStatus.HEALTHY, NOW));
        store.save(new HealthRecord("ws-1", IntegrationType.SLACK, "a", HealthStatus.UNHEALTHY, NOW));

        List<HealthRecord> records = store.findAllByWorkspace("ws-1");
        assertEquals(1, records.size());
        assertEquals(HealthStatus.UNHEALTHY, records.get(0).getStatus());
    }

    @Test
    void testReturnedRecordsAreCopies() {
        store.save(new HealthRecord("ws-1", IntegrationType.JIRA, "j", HealthStatus.HEALTHY, NOW));

        HealthRecord found = store.findByWorkspaceAndType("ws-1", IntegrationType.JIRA).orElseThrow();
        found.setStatus(HealthStatus.DISCONNECTED);
        found.getHealthDetails().put("mutated", true);

        HealthRecord again = store.findByWorkspaceAndType("ws-1", IntegrationType.JIRA).orElseThrow();
        assertEquals(HealthStatus.HEALTHY, again.getStatus());
        assertTrue(again.getHealthDetails().isEmpty());
    }

    @Test
    void testFindAllOrderedByType() {
        store.save(new HealthRecord("ws-1", IntegrationType.WEBHOOKS, null, HealthStatus.HEALTHY, NOW));
        store.save(new HealthRecord("ws-1", IntegrationType.SLACK, null, HealthStatus.HEALTHY, NOW));
        store.save(new HealthRecord("ws-2", IntegrationType.LINEAR, null, HealthStatus.HEALTHY, NOW));

        List<HealthRecord> records = store.findAllByWorkspace("ws-1");
        assertEquals(List.of(IntegrationType.SLACK, IntegrationType.WEBHOOKS),
            records.stream().map(HealthRecord::getIntegrationType).toList());
    }

    @Test
    void testCountByStatus() {
        store.save(new HealthRecord("ws-1", IntegrationType.SLACK, null, HealthStatus.HEALTHY, NOW));
        store.save(new HealthRecord("ws-2", IntegrationType.SLACK, null, HealthStatus.HEALTHY, NOW));
        store.save(new HealthRecord("ws-2", IntegrationType.JIRA, null, HealthStatus.DEGRADED, NOW));

        Map<HealthStatus, Long> counts = store.countByStatus();
        assertEquals(2L, counts.get(HealthStatus.HEALTHY));
        assertEquals(1L, counts.get(HealthStatus.DEGRADED));
        assertNull(counts.get(HealthStatus.UNHEALTHY));
    }
}
