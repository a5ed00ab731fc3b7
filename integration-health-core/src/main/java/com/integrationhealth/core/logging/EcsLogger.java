package com.integrationhealth.core.logging;

import com.integrationhealth.core.alert.HealthAlert;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public class EcsLogger {

    private static final Logger logger = LoggerFactory.getLogger(EcsLogger.class);
    private static final Logger alertLogger = LoggerFactory.getLogger("com.integrationhealth.core.alert");

    /**
     * Log a probe outcome with ECS structured fields. The error text must already be sanitized.
     */
    public void logProbeOutcome(String workspaceId, IntegrationType type, HealthStatus status,
                                long durationMs, String error) {
        try {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("event.dataset", "integration_health.probe");
            fields.put("event.action", "probe");
            fields.put("event.category", "network");
            fields.put("event.type", status.isSuccess() ? "info" : "error");
            fields.put("event.duration", String.valueOf(durationMs * 1_000_000));
            fields.put("event.outcome", status.isSuccess() ? "success" : "failure");
            fields.put("workspace.id", workspaceId);
            fields.put("integration.type", type.value());
            fields.put("integration.status", status.value());
            fields.put("trace.id", getOrCreateTraceId());
            setEcsFields(fields);

            if (error != null) {
                MDC.put("error.message", error);
            }

            if (status.isSuccess()) {
                logger.debug("Probe {} for workspace {}: {} in {}ms", type.value(), workspaceId, status.value(), durationMs);
            } else {
                logger.info("Probe {} for workspace {}: {} in {}ms - {}", type.value(), workspaceId, status.value(),
                    durationMs, error);
            }

        } finally {
            clearMDC();
        }
    }

    /**
     * Log completion of a scheduler cycle
     */
    public void logSchedulerCycle(int workspaces, int failures, long durationMs) {
        try {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("event.dataset", "integration_health.scheduler");
            fields.put("event.action", "cycle");
            fields.put("event.category", "process");
            fields.put("event.type", failures == 0 ? "info" : "error");
            fields.put("event.duration", String.valueOf(durationMs * 1_000_000));
            fields.put("event.outcome", failures == 0 ? "success" : "failure");
            fields.put("scheduler.workspaces", String.valueOf(workspaces));
            fields.put("scheduler.failures", String.valueOf(failures));
            fields.put("trace.id", getOrCreateTraceId());
            setEcsFields(fields);

            logger.info("Health check cycle finished: {} workspaces, {} failed, {}ms", workspaces, failures, durationMs);

        } finally {
            clearMDC();
        }
    }

    public void logAlert(HealthAlert alert) {
        try {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("event.id", UUID.randomUUID().toString());
            fields.put("event.dataset", "integration_health.alert");
            fields.put("event.action", alert.level().name().toLowerCase());
            fields.put("event.category", "process");
            fields.put("event.type", alert.level() == HealthAlert.Level.RECOVERY ? "info" : "error");
            fields.put("workspace.id", alert.workspaceId());
            fields.put("integration.type", alert.integrationType().value());
            fields.put("integration.status", alert.status().value());
            fields.put("integration.consecutive_failures", String.valueOf(alert.consecutiveFailures()));
            fields.put("trace.id", getOrCreateTraceId());
            setEcsFields(fields);

            switch (alert.level()) {
                case CRITICAL -> alertLogger.error("CRITICAL: {}", alert.message());
                case WARNING -> alertLogger.warn("WARNING: {}", alert.message());
                case RECOVERY -> alertLogger.info("RECOVERED: {}", alert.message());
            }

        } finally {
            clearMDC();
        }
    }

    private void setEcsFields(Map<String, String> fields) {
        MDC.put("@timestamp", Instant.now().toString());

        MDC.put("service.name", "integration-health");
        MDC.put("service.environment", System.getenv().getOrDefault("ENVIRONMENT", "local"));

        fields.forEach((key, value) -> {
            if (value != null) {
                MDC.put(key, value);
            }
        });
    }

    private String getOrCreateTraceId() {
        String traceId = MDC.get("trace.id");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }
        return traceId;
    }

    private void clearMDC() {
        MDC.clear();
    }
}
