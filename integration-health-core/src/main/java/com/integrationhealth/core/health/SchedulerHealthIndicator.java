package com.integrationhealth.core.health;

import com.integrationhealth.core.scheduler.HealthCheckScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * DOWN when the scheduler is enabled but has not completed a cycle within two intervals (plus the initial delay
 * before the first one).
 */
public class SchedulerHealthIndicator implements HealthIndicator {

    private final HealthCheckScheduler scheduler;
    private final Duration initialDelay;
    private final Clock clock;
    private final Instant createdAt;

    public SchedulerHealthIndicator(HealthCheckScheduler scheduler, Duration initialDelay, Clock clock) {
        this.scheduler = scheduler;
        this.initialDelay = initialDelay;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    @Override
    public Health health() {
        HealthCheckScheduler.SchedulerStatus status = scheduler.getStatus();
        if (!status.enabled()) {
            return Health.up().withDetail("scheduler", "disabled").build();
        }

        Duration maxAge = Duration.ofMillis(status.intervalMs() * 2);
        Instant now = clock.instant();
        Instant lastCompleted = status.lastCycleCompletedAt();
        Instant reference = lastCompleted != null ? lastCompleted : createdAt.plus(initialDelay);

        Health.Builder builder = now.isAfter(reference.plus(maxAge)) ? Health.down() : Health.up();
        builder.withDetail("intervalMs", status.intervalMs())
            .withDetail("lastCycleWorkspaces", status.lastCycleWorkspaces())
            .withDetail("lastCycleFailures", status.lastCycleFailures());
        if (lastCompleted != null) {
            builder.withDetail("lastCycleCompletedAt", lastCompleted.toString());
        }
        return builder.build();
    }
}
