package com.integrationhealth.core.alert;

import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;

import java.time.Instant;

public record HealthAlert(
    String workspaceId,
    IntegrationType integrationType,
    Level level,
    HealthStatus status,
    int consecutiveFailures,
    String message,
    Instant occurredAt
) {

    public enum Level {
        WARNING,    // Failure streak reached the warning threshold
        CRITICAL,   // Failure streak reached the critical threshold
        RECOVERY    // Back to healthy after being unhealthy or degraded
    }
}
