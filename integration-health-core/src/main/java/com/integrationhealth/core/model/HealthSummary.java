package com.integrationhealth.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record HealthSummary(
    HealthStatus overall,
    Map<String, Long> counts
) {

    /**
     * Buckets every record by status. Overall is unhealthy if any record is unhealthy, else degraded if any is
     * degraded, else healthy. Disconnected records are counted but never raise the overall severity.
     */
    public static HealthSummary of(Collection<HealthRecord> records) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (HealthStatus status : HealthStatus.values()) {
            counts.put(status.value(), 0L);
        }
        for (HealthRecord record : records) {
            if (record.getStatus() != null) {
                counts.merge(record.getStatus().value(), 1L, Long::sum);
            }
        }

        HealthStatus overall = HealthStatus.HEALTHY;
        if (counts.get(HealthStatus.UNHEALTHY.value()) > 0) {
            overall = HealthStatus.UNHEALTHY;
        } else if (counts.get(HealthStatus.DEGRADED.value()) > 0) {
            overall = HealthStatus.DEGRADED;
        }
        return new HealthSummary(overall, Collections.unmodifiableMap(counts));
    }

    public long count(HealthStatus status) {
        return counts.getOrDefault(status.value(), 0L);
    }
}
