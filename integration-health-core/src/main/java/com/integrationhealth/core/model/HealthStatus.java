package com.integrationhealth.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {
    HEALTHY,        // Probe succeeded with no recent errors
    DEGRADED,       // Probe succeeded but the integration shows warning signs
    UNHEALTHY,      // Probe failed, timed out or credentials were rejected
    DISCONNECTED;   // Integration exists but is not active

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static HealthStatus fromValue(String value) {
        return HealthStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isSuccess() {
        return this == HEALTHY || this == DEGRADED;
    }

    public boolean isFailure() {
        return !isSuccess();
    }
}
