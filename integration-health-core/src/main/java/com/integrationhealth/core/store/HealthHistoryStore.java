package com.integrationhealth.core.store;

import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;

import java.time.Instant;
import java.util.List;

/**
 * Time-ordered series of probe outcomes, one series per (workspace, integration type).
 * Entries are scored by their timestamp in epoch millis.
 */
public interface HealthHistoryStore {

    void append(String workspaceId, IntegrationType type, HistoryEntry entry);

    /**
     * Entries with a timestamp at or after {@code from}, oldest first.
     */
    List<HistoryEntry> findSince(String workspaceId, IntegrationType type, Instant from);

    /**
     * The {@code limit} most recent entries, newest first.
     */
    List<HistoryEntry> findLatest(String workspaceId, IntegrationType type, int limit);

    /**
     * @return number of removed entries
     */
    long removeOlderThan(String workspaceId, IntegrationType type, Instant cutoff);

    /**
     * Drops the oldest entries until at most {@code maxEntries} remain.
     *
     * @return number of removed entries
     */
    long trimToSize(String workspaceId, IntegrationType type, int maxEntries);
}
