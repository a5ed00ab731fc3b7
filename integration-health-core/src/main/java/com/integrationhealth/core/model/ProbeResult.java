package com.integrationhealth.core.model;

import java.util.Map;

/**
 * Outcome of a single probe. Produced by a prober, consumed by the recorder, never persisted as-is.
 */
public record ProbeResult(
    HealthStatus status,
    long responseTimeMs,
    String error,
    Map<String, Object> details
) {

    public ProbeResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ProbeResult healthy(long responseTimeMs, Map<String, Object> details) {
        return new ProbeResult(HealthStatus.HEALTHY, responseTimeMs, null, details);
    }

    public static ProbeResult degraded(long responseTimeMs, String error, Map<String, Object> details) {
        return new ProbeResult(HealthStatus.DEGRADED, responseTimeMs, error, details);
    }

    public static ProbeResult unhealthy(long responseTimeMs, String error, Map<String, Object> details) {
        return new ProbeResult(HealthStatus.UNHEALTHY, responseTimeMs, error, details);
    }

    public static ProbeResult unhealthy(long responseTimeMs, String error) {
        return unhealthy(responseTimeMs, error, null);
    }

    public static ProbeResult disconnected(long responseTimeMs, String error, Map<String, Object> details) {
        return new ProbeResult(HealthStatus.DISCONNECTED, responseTimeMs, error, details);
    }

    public ProbeResult withError(String sanitizedError, Map<String, Object> sanitizedDetails) {
        return new ProbeResult(status, responseTimeMs, sanitizedError, sanitizedDetails);
    }
}
