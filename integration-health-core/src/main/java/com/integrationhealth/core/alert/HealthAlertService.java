package com.integrationhealth.core.alert;

import com.integrationhealth.core.config.IntegrationHealthProperties;
import com.integrationhealth.core.logging.EcsLogger;
import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Edge-triggered alerting on a record's failure streak.
 * <p>
 * A warning fires when {@code consecutiveFailures} lands exactly on the warning threshold, an escalation when it
 * lands exactly on the critical threshold, and a recovery when the status moves from unhealthy or degraded to
 * healthy. Evaluation runs on its own executor after the record has been saved, so a slow or failing delivery never
 * reaches the recording path.
 */
public class HealthAlertService {

    private static final Logger logger = LoggerFactory.getLogger(HealthAlertService.class);

    private final IntegrationHealthProperties.AlertConfig config;
    private final EcsLogger ecsLogger;
    private final AlertPublisherService publisher;
    private final Executor alertExecutor;
    private final Clock clock;

    /**
     * @param publisher may be null when alert publication is disabled
     */
    public HealthAlertService(IntegrationHealthProperties.AlertConfig config, EcsLogger ecsLogger,
                              AlertPublisherService publisher, Executor alertExecutor, Clock clock) {
        this.config = config;
        this.ecsLogger = ecsLogger;
        this.publisher = publisher;
        this.alertExecutor = alertExecutor;
        this.clock = clock;
    }

    public void evaluateAsync(HealthRecord record, HealthStatus previousStatus) {
        HealthRecord snapshot = record.copy();
        try {
            alertExecutor.execute(() -> {
                try {
                    evaluate(snapshot, previousStatus).forEach(this::deliver);
                } catch (RuntimeException e) {
                    logger.warn("Alert handling failed for {} in workspace {}: {}",
                        snapshot.getIntegrationType().value(), snapshot.getWorkspaceId(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Alert evaluation rejected for {} in workspace {}",
                snapshot.getIntegrationType().value(), snapshot.getWorkspaceId());
        }
    }

    public List<HealthAlert> evaluate(HealthRecord record, HealthStatus previousStatus) {
        List<HealthAlert> alerts = new ArrayList<>();
        String type = record.getIntegrationType().value();
        int failures = record.getConsecutiveFailures();

        if (failures == config.warningThreshold()) {
            alerts.add(alert(record, HealthAlert.Level.WARNING,
                "Integration " + type + " is unhealthy for workspace " + record.getWorkspaceId()));
        }
        if (failures == config.criticalThreshold()) {
            alerts.add(alert(record, HealthAlert.Level.CRITICAL,
                "Integration " + type + " has been unhealthy for " + failures
                    + " consecutive checks for workspace " + record.getWorkspaceId()));
        }
        if ((previousStatus == HealthStatus.UNHEALTHY || previousStatus == HealthStatus.DEGRADED)
                && record.getStatus() == HealthStatus.HEALTHY) {
            alerts.add(alert(record, HealthAlert.Level.RECOVERY,
                "Integration " + type + " has recovered for workspace " + record.getWorkspaceId()));
        }
        return alerts;
    }

    private void deliver(HealthAlert alert) {
        ecsLogger.logAlert(alert);
        if (publisher != null) {
            publisher.publish(alert).whenComplete((result, throwable) -> {
                if (throwable != null) {
                    logger.warn("Failed to publish {} alert for workspace {}: {}",
                        alert.level(), alert.workspaceId(), throwable.getMessage());
                }
            });
        }
    }

    private HealthAlert alert(HealthRecord record, HealthAlert.Level level, String message) {
        return new HealthAlert(record.getWorkspaceId(), record.getIntegrationType(), level, record.getStatus(),
            record.getConsecutiveFailures(), message, clock.instant());
    }
}
