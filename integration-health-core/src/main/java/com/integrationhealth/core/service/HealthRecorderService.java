package com.integrationhealth.core.service;

import com.integrationhealth.core.alert.HealthAlertService;
import com.integrationhealth.core.config.IntegrationHealthProperties;
import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;
import com.integrationhealth.core.store.HealthHistoryStore;
import com.integrationhealth.core.store.HealthRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owns every write to health records and history.
 * <p>
 * History failures are logged and skipped: the current-state record is always saved, with the derived counters
 * left at their previous values when history could not be read.
 */
public class HealthRecorderService {

    private static final Logger logger = LoggerFactory.getLogger(HealthRecorderService.class);

    private final HealthRecordStore recordStore;
    private final HealthHistoryStore historyStore;
    private final HealthAlertService alertService;
    private final IntegrationHealthProperties.HistoryConfig historyConfig;
    private final Clock clock;

    public HealthRecorderService(HealthRecordStore recordStore, HealthHistoryStore historyStore,
                                 HealthAlertService alertService, IntegrationHealthProperties.HistoryConfig historyConfig,
                                 Clock clock) {
        this.recordStore = recordStore;
        this.historyStore = historyStore;
        this.alertService = alertService;
        this.historyConfig = historyConfig;
        this.clock = clock;
    }

    public HealthRecord recordProbeResult(String workspaceId, IntegrationType type, String integrationId,
                                          ProbeResult result) {
        Instant now = clock.instant();
        HealthStatus status = result.status();

        Optional<HealthRecord> existing = recordStore.findByWorkspaceAndType(workspaceId, type);
        HealthStatus previousStatus = existing.map(HealthRecord::getStatus).orElse(null);
        HealthRecord record = existing.orElseGet(() -> new HealthRecord(workspaceId, type, integrationId, status, now));

        record.setStatus(status);
        record.setResponseTimeMs(result.responseTimeMs());
        record.setHealthDetails(result.details());
        record.setCheckedAt(now);
        if (integrationId != null) {
            record.setIntegrationId(integrationId);
        }

        if (status.isSuccess()) {
            record.setLastSuccessAt(now);
            record.setConsecutiveFailures(0);
        } else {
            record.setLastErrorAt(now);
            record.setLastErrorMessage(result.error());
            record.incrementConsecutiveFailures();
        }

        updateHistory(record, HistoryEntry.of(now, result), now);

        record.setUpdatedAt(now);
        HealthRecord saved = recordStore.save(record);

        alertService.evaluateAsync(saved, previousStatus);
        return saved;
    }

    /**
     * Share of healthy or degraded entries within the retention window, as a percentage rounded to two decimals.
     * No history counts as fully available.
     */
    public double calculateUptime30d(String workspaceId, IntegrationType type) {
        Instant from = clock.instant().minus(historyConfig.retention());
        try {
            return uptime(historyStore.findSince(workspaceId, type, from));
        } catch (RuntimeException e) {
            logger.warn("Failed to calculate uptime for {} in workspace {}: {}", type.value(), workspaceId, e.getMessage());
            return 100.0;
        }
    }

    static double uptime(List<HistoryEntry> entries) {
        if (entries.isEmpty()) {
            return 100.0;
        }
        long available = entries.stream().filter(entry -> !entry.isFailure()).count();
        return BigDecimal.valueOf(available * 100.0 / entries.size())
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();
    }

    private void updateHistory(HealthRecord record, HistoryEntry entry, Instant now) {
        String workspaceId = record.getWorkspaceId();
        IntegrationType type = record.getIntegrationType();

        try {
            historyStore.append(workspaceId, type, entry);
        } catch (RuntimeException e) {
            logger.warn("Failed to append health history for {} in workspace {}: {}", type.value(), workspaceId, e.getMessage());
        }

        try {
            List<HistoryEntry> window = historyStore.findSince(workspaceId, type, now.minus(historyConfig.retention()));
            Instant errorWindowStart = now.minus(historyConfig.errorWindow());
            int errors = (int) window.stream()
                .filter(e -> !e.timestamp().isBefore(errorWindowStart))
                .filter(HistoryEntry::isFailure)
                .count();
            record.setErrorCount24h(errors);
            record.setUptime30d(uptime(window));
        } catch (RuntimeException e) {
            logger.warn("Failed to read health history for {} in workspace {}: {}", type.value(), workspaceId, e.getMessage());
        }

        try {
            long pruned = historyStore.removeOlderThan(workspaceId, type, now.minus(historyConfig.retention()));
            pruned += historyStore.trimToSize(workspaceId, type, historyConfig.maxEntries());
            if (pruned > 0) {
                logger.debug("Pruned {} history entries for {} in workspace {}", pruned, type.value(), workspaceId);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to prune health history for {} in workspace {}: {}", type.value(), workspaceId, e.getMessage());
        }
    }
}
