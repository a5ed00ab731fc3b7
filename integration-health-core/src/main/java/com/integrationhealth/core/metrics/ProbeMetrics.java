package com.integrationhealth.core.metrics;

import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class ProbeMetrics {
    
    private static final Logger logger = LoggerFactory.getLogger(ProbeMetrics.class);
    private static final long SLOW_PROBE_MS = 5_000;
    
    private final MeterRegistry meterRegistry;
    private final Counter probeTimeouts;
    private final Counter schedulerCycles;
    private final Counter schedulerWorkspaceFailures;
    private final Timer probeLatencyTimer;
    
    private final Map<HealthStatus, AtomicLong> probesByStatus = new EnumMap<>(HealthStatus.class);
    private final AtomicLong timeoutCount = new AtomicLong(0);
    private final AtomicLong totalLatencyMs = new AtomicLong(0);
    private final AtomicLong totalProbeCount = new AtomicLong(0);
    
    public ProbeMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (HealthStatus status : HealthStatus.values()) {
            probesByStatus.put(status, new AtomicLong(0));
        }
        
        this.probeTimeouts = Counter.builder("integration_health.probe.timeouts")
                .description("Probes abandoned after exceeding the probe timeout")
                .register(meterRegistry);
                
        this.schedulerCycles = Counter.builder("integration_health.scheduler.cycles")
                .description("Completed scheduled health check cycles")
                .register(meterRegistry);
                
        this.schedulerWorkspaceFailures = Counter.builder("integration_health.scheduler.workspace_failures")
                .description("Workspaces whose health check failed within a scheduled cycle")
                .register(meterRegistry);
                
        this.probeLatencyTimer = Timer.builder("integration_health.probe.latency")
                .description("Wall-clock latency of a single probe")
                .register(meterRegistry);
    }
    
    public void recordProbe(IntegrationType type, HealthStatus status, long latencyMs) {
        totalProbeCount.incrementAndGet();
        totalLatencyMs.addAndGet(latencyMs);
        probesByStatus.get(status).incrementAndGet();
        
        Counter.builder("integration_health.probes")
                .description("Probe outcomes by integration type and status")
                .tag("type", type.value())
                .tag("status", status.value())
                .register(meterRegistry)
                .increment();
        probeLatencyTimer.record(Duration.ofMillis(latencyMs));
        
        if (latencyMs > SLOW_PROBE_MS) {
            logger.warn("SLOW PROBE: {} took {}ms", type.value(), latencyMs);
        }
    }
    
    public void recordTimeout(IntegrationType type) {
        timeoutCount.incrementAndGet();
        probeTimeouts.increment();
        logger.debug("Probe timeout recorded for {}", type.value());
    }
    
    public void recordSchedulerCycle(int workspaceFailures) {
        schedulerCycles.increment();
        if (workspaceFailures > 0) {
            schedulerWorkspaceFailures.increment(workspaceFailures);
        }
    }
    
    public long getProbeCount(HealthStatus status) {
        return probesByStatus.get(status).get();
    }
    
    public long getTotalProbeCount() {
        return totalProbeCount.get();
    }
    
    public long getTimeoutCount() {
        return timeoutCount.get();
    }
    
    public double getMeanLatencyMs() {
        long total = getTotalProbeCount();
        if (total == 0) return 0.0;
        return (double) totalLatencyMs.get() / total;
    }
    
    public double getMaxLatencyMs() {
        return probeLatencyTimer.max(TimeUnit.MILLISECONDS);
    }
}
