package com.integrationhealth.core.service;

import com.integrationhealth.core.logging.EcsLogger;
import com.integrationhealth.core.logging.ProbeErrorSanitizer;
import com.integrationhealth.core.metrics.ProbeMetrics;
import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;
import com.integrationhealth.core.probe.IntegrationProber;
import com.integrationhealth.core.probe.ProberRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves which integrations a workspace has connected, runs their probes under a timeout and hands every outcome
 * to the recorder.
 * <p>
 * Probe and configuration failures never escape a single dispatch: they are recorded as unhealthy results with a
 * sanitized message so the remaining types of the workspace are still probed.
 */
public class ProbeDispatcherService {

    private static final Logger logger = LoggerFactory.getLogger(ProbeDispatcherService.class);

    static final String PROBE_TIMEOUT = "Probe timeout";

    private final ProberRegistry proberRegistry;
    private final HealthRecorderService recorder;
    private final ProbeMetrics probeMetrics;
    private final EcsLogger ecsLogger;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService probeExecutor;
    private final long probeTimeoutMs;

    public ProbeDispatcherService(ProberRegistry proberRegistry, HealthRecorderService recorder,
                                  ProbeMetrics probeMetrics, EcsLogger ecsLogger,
                                  ExecutorService dispatchExecutor, ExecutorService probeExecutor,
                                  Duration probeTimeout) {
        this.proberRegistry = proberRegistry;
        this.recorder = recorder;
        this.probeMetrics = probeMetrics;
        this.ecsLogger = ecsLogger;
        this.dispatchExecutor = dispatchExecutor;
        this.probeExecutor = probeExecutor;
        this.probeTimeoutMs = probeTimeout.toMillis();
    }

    /**
     * Probes and records a single integration type.
     *
     * @return the updated record, or empty when the workspace has not connected this type
     */
    public Optional<HealthRecord> checkIntegration(String workspaceId, IntegrationType type) {
        return dispatch(workspaceId, proberRegistry.get(type));
    }

    /**
     * Probes all integration types of a workspace concurrently. A failing type is logged and left out of the result;
     * it never cancels the others.
     */
    public List<HealthRecord> checkWorkspaceHealth(String workspaceId) {
        List<CompletableFuture<Optional<HealthRecord>>> futures = Arrays.stream(IntegrationType.values())
            .map(type -> CompletableFuture
                .supplyAsync(() -> checkIntegration(workspaceId, type), dispatchExecutor)
                .exceptionally(throwable -> {
                    logger.warn("Health check of {} failed for workspace {}: {}", type.value(), workspaceId,
                        ProbeErrorSanitizer.sanitize(throwable));
                    return Optional.empty();
                }))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return futures.stream()
            .map(CompletableFuture::join)
            .flatMap(Optional::stream)
            .toList();
    }

    private <C> Optional<HealthRecord> dispatch(String workspaceId, IntegrationProber<C> prober) {
        IntegrationType type = prober.type();

        Optional<C> configuration;
        try {
            configuration = prober.loadConfiguration(workspaceId);
        } catch (RuntimeException e) {
            String error = ProbeErrorSanitizer.sanitize(e);
            logger.warn("Failed to load {} configuration for workspace {}: {}", type.value(), workspaceId, error);
            return Optional.of(record(workspaceId, type, null, ProbeResult.unhealthy(0, error)));
        }

        if (configuration.isEmpty()) {
            logger.debug("{} not connected for workspace {}", type.value(), workspaceId);
            return Optional.empty();
        }

        C config = configuration.get();
        ProbeResult result = runWithTimeout(prober, config);
        return Optional.of(record(workspaceId, type, prober.integrationId(config), result));
    }

    private <C> ProbeResult runWithTimeout(IntegrationProber<C> prober, C config) {
        long start = System.nanoTime();
        Future<ProbeResult> future;
        try {
            future = probeExecutor.submit(() -> prober.probe(config));
        } catch (RejectedExecutionException e) {
            return ProbeResult.unhealthy(0, "Probe rejected: executor saturated");
        }

        try {
            return future.get(probeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Blocking socket reads ignore the interrupt; the HTTP client timeouts bound them
            future.cancel(true);
            probeMetrics.recordTimeout(prober.type());
            return ProbeResult.unhealthy(probeTimeoutMs, PROBE_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String error = ProbeErrorSanitizer.sanitize(cause);
            logger.debug("{} threw {}: {}", prober.getProberName(), cause.getClass().getSimpleName(), error);
            return ProbeResult.unhealthy(elapsedMs(start), error);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeResult.unhealthy(elapsedMs(start), "Probe interrupted");
        }
    }

    private HealthRecord record(String workspaceId, IntegrationType type, String integrationId, ProbeResult raw) {
        ProbeResult result = raw.withError(
            ProbeErrorSanitizer.sanitize(raw.error()),
            ProbeErrorSanitizer.sanitizeDetails(raw.details()));

        probeMetrics.recordProbe(type, result.status(), result.responseTimeMs());
        ecsLogger.logProbeOutcome(workspaceId, type, result.status(), result.responseTimeMs(), result.error());

        return recorder.recordProbeResult(workspaceId, type, integrationId, result);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
