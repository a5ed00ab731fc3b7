package com.integrationhealth.core.scheduler;

import com.integrationhealth.core.config.IntegrationHealthProperties;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.logging.EcsLogger;
import com.integrationhealth.core.logging.ProbeErrorSanitizer;
import com.integrationhealth.core.metrics.ProbeMetrics;
import com.integrationhealth.core.service.ProbeDispatcherService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic driver of workspace health checks. Owns its timer thread: started with the application context when
 * enabled and stopped on shutdown. Cycles never overlap.
 */
public class HealthCheckScheduler {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheckScheduler.class);

    private final IntegrationCredentialStore credentialStore;
    private final ProbeDispatcherService dispatcher;
    private final ProbeMetrics probeMetrics;
    private final EcsLogger ecsLogger;
    private final IntegrationHealthProperties.SchedulerConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService timer;

    private volatile Instant lastCycleStartedAt;
    private volatile Instant lastCycleCompletedAt;
    private volatile int lastCycleWorkspaces;
    private volatile int lastCycleFailures;

    public HealthCheckScheduler(IntegrationCredentialStore credentialStore, ProbeDispatcherService dispatcher,
                                ProbeMetrics probeMetrics, EcsLogger ecsLogger,
                                IntegrationHealthProperties.SchedulerConfig config, Clock clock) {
        this.credentialStore = credentialStore;
        this.dispatcher = dispatcher;
        this.probeMetrics = probeMetrics;
        this.ecsLogger = ecsLogger;
        this.config = config;
        this.clock = clock;
    }

    @PostConstruct
    public synchronized void start() {
        if (!config.enabled()) {
            logger.info("Integration health scheduler disabled");
            return;
        }
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-check-scheduler");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(
            this::runScheduledCycle,
            config.initialDelay().toMillis(),
            config.interval().toMillis(),
            TimeUnit.MILLISECONDS
        );
        logger.info("Integration health scheduler started: interval={}, initialDelay={}",
            config.interval(), config.initialDelay());
    }

    @PreDestroy
    public synchronized void stop() {
        if (timer == null) {
            return;
        }
        logger.info("Stopping integration health scheduler...");
        timer.shutdown();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timer = null;
    }

    /**
     * Timer entry point. A throwable escaping a fixed-rate task cancels all later runs, so nothing may leave here.
     */
    void runScheduledCycle() {
        try {
            runCycle();
        } catch (Throwable t) {
            logger.error("Health check cycle aborted, retrying at next interval: {}: {}", t.getClass().getName(),
                ProbeErrorSanitizer.sanitize(t));
        }
    }

    /**
     * Runs one cycle: discovers every workspace with a connected integration and checks them one after another.
     * A failing workspace is logged and skipped. Returns without doing anything if a cycle is already running.
     */
    public void runCycle() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Previous health check cycle still running, skipping");
            return;
        }
        try {
            Instant started = clock.instant();
            long startNanos = System.nanoTime();
            lastCycleStartedAt = started;

            Set<String> workspaceIds;
            try {
                workspaceIds = credentialStore.findWorkspaceIdsWithIntegrations();
            } catch (RuntimeException e) {
                logger.error("Workspace discovery failed, skipping cycle: {}", ProbeErrorSanitizer.sanitize(e));
                return;
            }

            int failures = 0;
            for (String workspaceId : workspaceIds) {
                try {
                    dispatcher.checkWorkspaceHealth(workspaceId);
                } catch (RuntimeException e) {
                    failures++;
                    logger.error("Health check failed for workspace {}: {}", workspaceId, ProbeErrorSanitizer.sanitize(e));
                }
            }

            lastCycleWorkspaces = workspaceIds.size();
            lastCycleFailures = failures;
            lastCycleCompletedAt = clock.instant();
            probeMetrics.recordSchedulerCycle(failures);
            ecsLogger.logSchedulerCycle(workspaceIds.size(), failures,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        } finally {
            running.set(false);
        }
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatus getStatus() {
        return new SchedulerStatus(
            config.enabled(),
            config.interval().toMillis(),
            lastCycleStartedAt,
            lastCycleCompletedAt,
            lastCycleWorkspaces,
            lastCycleFailures
        );
    }

    public record SchedulerStatus(
        boolean enabled,
        long intervalMs,
        Instant lastCycleStartedAt,
        Instant lastCycleCompletedAt,
        int lastCycleWorkspaces,
        int lastCycleFailures
    ) {}
}
