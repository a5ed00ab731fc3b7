package com.integrationhealth.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthSummaryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static HealthRecord record(IntegrationType type, HealthStatus status) {
        return new HealthRecord("ws-1", type, null, status, NOW);
    }

    @Test
    void testEmptyWorkspaceIsHealthyWithAllBucketsZero() {
        HealthSummary summary = HealthSummary.of(List.of());
        
        assertEquals(HealthStatus.HEALTHY, summary.overall());
        assertEquals(List.of("healthy", "degraded", "unhealthy", "disconnected"), List.copyOf(summary.counts().keySet()));
        assertTrue(summary.counts().values().stream().allMatch(count -> count == 0L));
    }

    @Test
    void testDegradedWinsOverHealthy() {
        HealthSummary summary = HealthSummary.of(List.of(
            record(IntegrationType.SLACK, HealthStatus.HEALTHY),
            record(IntegrationType.JIRA, HealthStatus.DEGRADED)));
        
        assertEquals(HealthStatus.DEGRADED, summary.overall());
        assertEquals(1L, summary.count(HealthStatus.HEALTHY));
        assertEquals(1L, summary.count(HealthStatus.DEGRADED));
    }

    @Test
    void testUnhealthyWinsOverEverything() {
        HealthSummary summary = HealthSummary.of(List.of(
            record(IntegrationType.SLACK, HealthStatus.HEALTHY),
            record(IntegrationType.DISCORD, HealthStatus.DEGRADED),
            record(IntegrationType.LINEAR, HealthStatus.UNHEALTHY),
            record(IntegrationType.GITHUB, HealthStatus.DISCONNECTED)));
        
        assertEquals(HealthStatus.UNHEALTHY, summary.overall());
        assertEquals(4L, summary.counts().values().stream().mapToLong(Long::longValue).sum());
    }

    @Test
    void testDisconnectedNeverRaisesOverall() {
        HealthSummary summary = HealthSummary.of(List.of(
            record(IntegrationType.SLACK, HealthStatus.DISCONNECTED),
            record(IntegrationType.VERCEL, HealthStatus.DISCONNECTED)));
        
        assertEquals(HealthStatus.HEALTHY, summary.overall());
        assertEquals(2L, summary.count(HealthStatus.DISCONNECTED));
    }
}
