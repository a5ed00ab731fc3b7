package com.integrationhealth.core.service;

import com.integrationhealth.core.alert.HealthAlertService;
import com.integrationhealth.core.config.IntegrationHealthProperties;
import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;
import com.integrationhealth.core.store.HealthHistoryStore;
import com.integrationhealth.core.store.memory.InMemoryHealthHistoryStore;
import com.integrationhealth.core.store.memory.InMemoryHealthRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthRecorderServiceTest {

    private static final String WORKSPACE = "7f1c2d3e-0000-4000-8000-000000000001";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private HealthAlertService alertService;

    private InMemoryHealthRecordStore recordStore;
    private InMemoryHealthHistoryStore historyStore;
    private HealthRecorderService recorder;

    @BeforeEach
    void setUp() {
        recordStore = new InMemoryHealthRecordStore();
        historyStore = new InMemoryHealthHistoryStore();
        recorder = newRecorder(historyStore, IntegrationHealthProperties.defaults().history());
    }

    private HealthRecorderService newRecorder(HealthHistoryStore history, IntegrationHealthProperties.HistoryConfig config) {
        return new HealthRecorderService(recordStore, history, alertService, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testFirstRecordHasNoPreviousStatus() {
        HealthRecord saved = recorder.recordProbeResult(WORKSPACE, IntegrationType.SLACK, "slack-1",
            ProbeResult.healthy(42, Map.of("teamName", "Acme")));

        assertEquals(HealthStatus.HEALTHY, saved.getStatus());
        assertEquals("slack-1", saved.getIntegrationId());
        assertEquals(42L, saved.getResponseTimeMs());
        assertEquals(NOW, saved.getLastSuccessAt());
        assertEquals(NOW, saved.getCheckedAt());
        assertEquals("Acme", saved.getHealthDetails().get("teamName"));
        assertEquals(100.0, saved.getUptime30d());
        verify(alertService).evaluateAsync(same(saved), isNull());
    }

    @Test
    void testConsecutiveFailuresAccumulateAndReset() {
        recorder.recordProbeResult(WORKSPACE, IntegrationType.JIRA, "jira-1", ProbeResult.unhealthy(10, "HTTP 500"));
        HealthRecord second = recorder.recordProbeResult(WORKSPACE, IntegrationType.JIRA, "jira-1",
            ProbeResult.unhealthy(12, "HTTP 503"));

        assertEquals(2, second.getConsecutiveFailures());
        assertEquals("HTTP 503", second.getLastErrorMessage());
        assertEquals(NOW, second.getLastErrorAt());
        verify(alertService).evaluateAsync(same(second), eq(HealthStatus.UNHEALTHY));

        HealthRecord recovered = recorder.recordProbeResult(WORKSPACE, IntegrationType.JIRA, "jira-1",
            ProbeResult.healthy(8, null));

        assertEquals(0, recovered.getConsecutiveFailures());
        assertEquals(HealthStatus.HEALTHY, recovered.getStatus());
        assertEquals("HTTP 503", recovered.getLastErrorMessage());
    }

    @Test
    void testDegradedCountsAsSuccess() {
        recorder.recordProbeResult(WORKSPACE, IntegrationType.GITHUB, "gh-1", ProbeResult.unhealthy(0, "Token expired"));
        HealthRecord degraded = recorder.recordProbeResult(WORKSPACE, IntegrationType.GITHUB, "gh-1",
            ProbeResult.degraded(0, "No activity in 8 days", null));

        assertEquals(0, degraded.getConsecutiveFailures());
        assertEquals(NOW, degraded.getLastSuccessAt());
        assertEquals(50.0, degraded.getUptime30d());
    }

    @Test
    void testErrorCountOnlyIncludesErrorWindow() {
        historyStore.append(WORKSPACE, IntegrationType.LINEAR,
            new HistoryEntry(NOW.minus(Duration.ofHours(25)), HealthStatus.UNHEALTHY, 0, "old failure"));
        historyStore.append(WORKSPACE, IntegrationType.LINEAR,
            new HistoryEntry(NOW.minus(Duration.ofHours(2)), HealthStatus.UNHEALTHY, 0, "recent failure"));

        HealthRecord saved = recorder.recordProbeResult(WORKSPACE, IntegrationType.LINEAR, "linear-1",
            ProbeResult.unhealthy(5, "Invalid API key"));

        assertEquals(2, saved.getErrorCount24h());
        assertEquals(0.0, saved.getUptime30d());
    }

    @Test
    void testUptimeFromRetainedHistory() {
        for (int i = 1; i <= 3; i++) {
            historyStore.append(WORKSPACE, IntegrationType.DISCORD,
                new HistoryEntry(NOW.minus(Duration.ofHours(i)), HealthStatus.HEALTHY, 20, null));
        }
        historyStore.append(WORKSPACE, IntegrationType.DISCORD,
            new HistoryEntry(NOW.minus(Duration.ofDays(31)), HealthStatus.UNHEALTHY, 0, "expired"));

        HealthRecord saved = recorder.recordProbeResult(WORKSPACE, IntegrationType.DISCORD, "discord-1",
            ProbeResult.unhealthy(30, "HTTP 404"));

        assertEquals(75.0, saved.getUptime30d());
        assertEquals(4, historyStore.findSince(WORKSPACE, IntegrationType.DISCORD, Instant.EPOCH).size());
        assertEquals(75.0, recorder.calculateUptime30d(WORKSPACE, IntegrationType.DISCORD));
    }

    @Test
    void testUptimeRoundsToTwoDecimals() {
        List<HistoryEntry> entries = List.of(
            new HistoryEntry(NOW, HealthStatus.HEALTHY, 1, null),
            new HistoryEntry(NOW, HealthStatus.DEGRADED, 1, null),
            new HistoryEntry(NOW, HealthStatus.DISCONNECTED, 0, "inactive"));

        assertEquals(66.67, HealthRecorderService.uptime(entries));
        assertEquals(100.0, HealthRecorderService.uptime(List.of()));
    }

    @Test
    void testHistoryFailureStillSavesRecord() {
        HealthHistoryStore failingHistory = mock(HealthHistoryStore.class);
        doThrow(new IllegalStateException("redis down")).when(failingHistory).append(any(), any(), any());
        when(failingHistory.findSince(any(), any(), any())).thenThrow(new IllegalStateException("redis down"));
        recorder = newRecorder(failingHistory, IntegrationHealthProperties.defaults().history());

        HealthRecord saved = recorder.recordProbeResult(WORKSPACE, IntegrationType.VERCEL, "vercel-1",
            ProbeResult.unhealthy(0, "Connection revoked"));

        assertEquals(1, saved.getConsecutiveFailures());
        assertEquals(0, saved.getErrorCount24h());
        assertEquals(100.0, saved.getUptime30d());
        assertTrue(recordStore.findByWorkspaceAndType(WORKSPACE, IntegrationType.VERCEL).isPresent());
        verify(alertService).evaluateAsync(same(saved), isNull());
    }

    @Test
    void testNullIntegrationIdKeepsStoredReference() {
        recorder.recordProbeResult(WORKSPACE, IntegrationType.SUPABASE, "supabase-1", ProbeResult.healthy(0, null));

        HealthRecord saved = recorder.recordProbeResult(WORKSPACE, IntegrationType.SUPABASE, null,
            ProbeResult.unhealthy(0, "Failed to load configuration"));

        assertEquals("supabase-1", saved.getIntegrationId());
    }

    @Test
    void testHistoryTrimmedToMaxEntries() {
        recorder = newRecorder(historyStore, new IntegrationHealthProperties.HistoryConfig(null, 2, null, null, 0));

        for (int i = 0; i < 3; i++) {
            recorder.recordProbeResult(WORKSPACE, IntegrationType.RAILWAY, "railway-1", ProbeResult.healthy(0, null));
        }

        assertEquals(2, historyStore.findSince(WORKSPACE, IntegrationType.RAILWAY, Instant.EPOCH).size());
    }
}
