package com.integrationhealth.core.service;

import com.integrationhealth.core.exception.HealthRecordNotFoundException;
import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.HealthSummary;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.RetryResult;
import com.integrationhealth.core.store.HealthHistoryStore;
import com.integrationhealth.core.store.HealthRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read and operator-command surface over recorded integration health.
 */
public class IntegrationHealthService {

    private static final Logger logger = LoggerFactory.getLogger(IntegrationHealthService.class);

    private final HealthRecordStore recordStore;
    private final HealthHistoryStore historyStore;
    private final ProbeDispatcherService dispatcher;
    private final int maxHistoryLimit;
    private final Clock clock;

    public IntegrationHealthService(HealthRecordStore recordStore, HealthHistoryStore historyStore,
                                    ProbeDispatcherService dispatcher, int maxHistoryLimit, Clock clock) {
        this.recordStore = recordStore;
        this.historyStore = historyStore;
        this.dispatcher = dispatcher;
        this.maxHistoryLimit = maxHistoryLimit;
        this.clock = clock;
    }

    public List<HealthRecord> getAllHealth(String workspaceId) {
        return recordStore.findAllByWorkspace(workspaceId);
    }

    public Optional<HealthRecord> findHealth(String workspaceId, IntegrationType type) {
        return recordStore.findByWorkspaceAndType(workspaceId, type);
    }

    /**
     * @throws HealthRecordNotFoundException when the type has never been probed for the workspace
     */
    public HealthRecord getHealth(String workspaceId, IntegrationType type) {
        return findHealth(workspaceId, type)
            .orElseThrow(() -> new HealthRecordNotFoundException(workspaceId, type));
    }

    public HealthSummary getHealthSummary(String workspaceId) {
        return HealthSummary.of(recordStore.findAllByWorkspace(workspaceId));
    }

    /**
     * Most recent history entries first. A missing or non-positive limit means the maximum; larger limits are
     * clamped to it. An unreadable history store yields an empty list.
     */
    public List<HistoryEntry> getHealthHistory(String workspaceId, IntegrationType type, Integer limit) {
        int effectiveLimit = limit == null || limit <= 0 ? maxHistoryLimit : Math.min(limit, maxHistoryLimit);
        try {
            return historyStore.findLatest(workspaceId, type, effectiveLimit);
        } catch (RuntimeException e) {
            logger.warn("Failed to read health history for {} in workspace {}: {}", type.value(), workspaceId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Runs one probe-and-record cycle now. When the integration is no longer connected, an existing record is marked
     * disconnected; otherwise a transient disconnected record is returned without being stored.
     */
    public HealthRecord forceHealthCheck(String workspaceId, IntegrationType type) {
        Optional<HealthRecord> checked = dispatcher.checkIntegration(workspaceId, type);
        if (checked.isPresent()) {
            return checked.get();
        }

        Instant now = clock.instant();
        Optional<HealthRecord> existing = recordStore.findByWorkspaceAndType(workspaceId, type);
        if (existing.isPresent()) {
            HealthRecord record = existing.get();
            record.setStatus(HealthStatus.DISCONNECTED);
            record.setCheckedAt(now);
            record.setUpdatedAt(now);
            logger.info("{} no longer connected for workspace {}, marking disconnected", type.value(), workspaceId);
            return recordStore.save(record);
        }
        return new HealthRecord(workspaceId, type, null, HealthStatus.DISCONNECTED, now);
    }

    /**
     * Re-probes an integration once unless it is already healthy or was never probed.
     */
    public RetryResult retryFailed(String workspaceId, IntegrationType type) {
        Optional<HealthRecord> existing = recordStore.findByWorkspaceAndType(workspaceId, type);
        if (existing.isEmpty() || existing.get().getStatus() == HealthStatus.HEALTHY) {
            return RetryResult.none();
        }

        logger.info("Retrying {} health check for workspace {} (status {})",
            type.value(), workspaceId, existing.get().getStatus().value());
        dispatcher.checkIntegration(workspaceId, type);
        return RetryResult.once();
    }
}
