package com.integrationhealth.core.metrics;

import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProbeMetricsTest {

    private MeterRegistry meterRegistry;
    private ProbeMetrics probeMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        probeMetrics = new ProbeMetrics(meterRegistry);
    }

    @Test
    void testRecordProbe() {
        probeMetrics.recordProbe(IntegrationType.SLACK, HealthStatus.HEALTHY, 100);
        probeMetrics.recordProbe(IntegrationType.SLACK, HealthStatus.UNHEALTHY, 300);
        probeMetrics.recordProbe(IntegrationType.JIRA, HealthStatus.HEALTHY, 200);
        
        assertEquals(3, probeMetrics.getTotalProbeCount());
        assertEquals(2, probeMetrics.getProbeCount(HealthStatus.HEALTHY));
        assertEquals(1, probeMetrics.getProbeCount(HealthStatus.UNHEALTHY));
        assertEquals(200.0, probeMetrics.getMeanLatencyMs());
        assertEquals(300.0, probeMetrics.getMaxLatencyMs());
        assertEquals(1.0, meterRegistry.get("integration_health.probes")
            .tag("type", "slack").tag("status", "healthy").counter().count());
    }

    @Test
    void testMeanLatencyWithoutProbes() {
        assertEquals(0.0, probeMetrics.getMeanLatencyMs());
        assertEquals(0, probeMetrics.getProbeCount(HealthStatus.DISCONNECTED));
    }

    @Test
    void testRecordTimeout() {
        probeMetrics.recordTimeout(IntegrationType.LINEAR);
        probeMetrics.recordTimeout(IntegrationType.LINEAR);
        
        assertEquals(2, probeMetrics.getTimeoutCount());
        assertEquals(2.0, meterRegistry.get("integration_health.probe.timeouts").counter().count());
    }

    @Test
    void testRecordSchedulerCycle() {
        probeMetrics.recordSchedulerCycle(0);
        probeMetrics.recordSchedulerCycle(3);
        
        assertEquals(2.0, meterRegistry.get("integration_health.scheduler.cycles").counter().count());
        assertEquals(3.0, meterRegistry.get("integration_health.scheduler.workspace_failures").counter().count());
    }
}
