package com.integrationhealth.core.controller;

import com.integrationhealth.core.metrics.ProbeMetrics;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.scheduler.HealthCheckScheduler;
import com.integrationhealth.core.store.HealthRecordStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
public class MetricsController {
    
    private final ProbeMetrics probeMetrics;
    private final HealthCheckScheduler scheduler;
    private final HealthRecordStore recordStore;
    
    public MetricsController(ProbeMetrics probeMetrics, HealthCheckScheduler scheduler, HealthRecordStore recordStore) {
        this.probeMetrics = probeMetrics;
        this.scheduler = scheduler;
        this.recordStore = recordStore;
    }
    
    @GetMapping("/probes")
    public Map<String, Object> getProbeMetrics() {
        Map<String, Object> byStatus = new LinkedHashMap<>();
        for (HealthStatus status : HealthStatus.values()) {
            byStatus.put(status.value(), probeMetrics.getProbeCount(status));
        }
        
        return Map.of(
            "totalProbes", probeMetrics.getTotalProbeCount(),
            "byStatus", byStatus,
            "timeouts", probeMetrics.getTimeoutCount(),
            "meanLatencyMs", String.format("%.2f", probeMetrics.getMeanLatencyMs()),
            "timestamp", System.currentTimeMillis()
        );
    }
    
    @GetMapping("/scheduler")
    public Map<String, Object> getSchedulerMetrics() {
        HealthCheckScheduler.SchedulerStatus status = scheduler.getStatus();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("enabled", status.enabled());
        metrics.put("running", scheduler.isRunning());
        metrics.put("intervalMs", status.intervalMs());
        metrics.put("lastCycleStartedAt", format(status.lastCycleStartedAt()));
        metrics.put("lastCycleCompletedAt", format(status.lastCycleCompletedAt()));
        metrics.put("lastCycleWorkspaces", status.lastCycleWorkspaces());
        metrics.put("lastCycleFailures", status.lastCycleFailures());
        return metrics;
    }
    
    @GetMapping("/summary")
    public Map<String, Object> getSummary() {
        Map<String, Object> records = new LinkedHashMap<>();
        Map<HealthStatus, Long> counts = recordStore.countByStatus();
        for (HealthStatus status : HealthStatus.values()) {
            records.put(status.value(), counts.getOrDefault(status, 0L));
        }
        
        return Map.of(
            "status", scheduler.isEnabled() ? "running" : "scheduler-disabled",
            "totalProbes", probeMetrics.getTotalProbeCount(),
            "timeouts", probeMetrics.getTimeoutCount(),
            "records", records
        );
    }
    
    private static String format(Instant instant) {
        return instant != null ? instant.toString() : "never";
    }
}
