package com.integrationhealth.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One immutable point of the per-integration health time series.
 * Serialized as {@code {timestamp, status, responseTimeMs, error?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntry(
    Instant timestamp,
    HealthStatus status,
    long responseTimeMs,
    String error
) {

    public static HistoryEntry of(Instant timestamp, ProbeResult result) {
        return new HistoryEntry(timestamp, result.status(), result.responseTimeMs(), result.error());
    }

    @JsonIgnore
    public boolean isFailure() {
        return status != null && status.isFailure();
    }
}
