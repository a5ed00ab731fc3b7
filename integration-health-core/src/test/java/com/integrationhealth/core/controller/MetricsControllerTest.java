package com.integrationhealth.core.controller;

import com.integrationhealth.core.metrics.ProbeMetrics;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.scheduler.HealthCheckScheduler;
import com.integrationhealth.core.store.HealthRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsControllerTest {

    @Mock
    private ProbeMetrics probeMetrics;
    
    @Mock
    private HealthCheckScheduler scheduler;
    
    @Mock
    private HealthRecordStore recordStore;
    
    private MetricsController metricsController;

    @BeforeEach
    void setUp() {
        metricsController = new MetricsController(probeMetrics, scheduler, recordStore);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetProbeMetrics() {
        when(probeMetrics.getTotalProbeCount()).thenReturn(40L);
        when(probeMetrics.getTimeoutCount()).thenReturn(2L);
        when(probeMetrics.getMeanLatencyMs()).thenReturn(123.456);
        when(probeMetrics.getProbeCount(any(HealthStatus.class))).thenReturn(0L);
        when(probeMetrics.getProbeCount(HealthStatus.HEALTHY)).thenReturn(35L);
        
        Map<String, Object> response = metricsController.getProbeMetrics();
        
        assertEquals(40L, response.get("totalProbes"));
        assertEquals(2L, response.get("timeouts"));
        assertEquals("123.46", response.get("meanLatencyMs"));
        Map<String, Object> byStatus = (Map<String, Object>) response.get("byStatus");
        assertEquals(35L, byStatus.get("healthy"));
        assertEquals(0L, byStatus.get("unhealthy"));
        assertNotNull(response.get("timestamp"));
    }

    @Test
    void testGetSchedulerMetrics() {
        Instant completed = Instant.parse("2024-05-01T12:00:00Z");
        when(scheduler.getStatus()).thenReturn(
            new HealthCheckScheduler.SchedulerStatus(true, 300_000L, null, completed, 12, 1));
        when(scheduler.isRunning()).thenReturn(false);
        
        Map<String, Object> response = metricsController.getSchedulerMetrics();
        
        assertEquals(true, response.get("enabled"));
        assertEquals(false, response.get("running"));
        assertEquals(300_000L, response.get("intervalMs"));
        assertEquals("never", response.get("lastCycleStartedAt"));
        assertEquals("2024-05-01T12:00:00Z", response.get("lastCycleCompletedAt"));
        assertEquals(12, response.get("lastCycleWorkspaces"));
        assertEquals(1, response.get("lastCycleFailures"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetSummary() {
        when(scheduler.isEnabled()).thenReturn(true);
        when(probeMetrics.getTotalProbeCount()).thenReturn(100L);
        when(probeMetrics.getTimeoutCount()).thenReturn(3L);
        when(recordStore.countByStatus()).thenReturn(Map.of(HealthStatus.HEALTHY, 7L, HealthStatus.UNHEALTHY, 2L));
        
        Map<String, Object> response = metricsController.getSummary();
        
        assertEquals("running", response.get("status"));
        assertEquals(100L, response.get("totalProbes"));
        assertEquals(3L, response.get("timeouts"));
        Map<String, Object> records = (Map<String, Object>) response.get("records");
        assertEquals(7L, records.get("healthy"));
        assertEquals(2L, records.get("unhealthy"));
        assertEquals(0L, records.get("disconnected"));
    }

    @Test
    void testSummaryWhenSchedulerDisabled() {
        when(scheduler.isEnabled()).thenReturn(false);
        when(recordStore.countByStatus()).thenReturn(Map.of());
        
        assertEquals("scheduler-disabled", metricsController.getSummary().get("status"));
    }
}
