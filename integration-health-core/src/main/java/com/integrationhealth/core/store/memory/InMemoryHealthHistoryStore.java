package com.integrationhealth.core.store.memory;

import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.store.HealthHistoryStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local history store. Each series is kept sorted by timestamp, mirroring sorted-set scoring.
 */
public class InMemoryHealthHistoryStore implements HealthHistoryStore {

    private static final Comparator<HistoryEntry> BY_TIMESTAMP = Comparator.comparing(HistoryEntry::timestamp);

    private final Map<String, List<HistoryEntry>> series = new ConcurrentHashMap<>();

    @Override
    public void append(String workspaceId, IntegrationType type, HistoryEntry entry) {
        List<HistoryEntry> entries = series.computeIfAbsent(key(workspaceId, type), k -> new ArrayList<>());
        synchronized (entries) {
            int index = entries.size();
            while (index > 0 && entries.get(index - 1).timestamp().isAfter(entry.timestamp())) {
                index--;
            }
            entries.add(index, entry);
        }
    }

    @Override
    public List<HistoryEntry> findSince(String workspaceId, IntegrationType type, Instant from) {
        List<HistoryEntry> entries = series.get(key(workspaceId, type));
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return entries.stream()
                .filter(entry -> !entry.timestamp().isBefore(from))
                .sorted(BY_TIMESTAMP)
                .toList();
        }
    }

    @Override
    public List<HistoryEntry> findLatest(String workspaceId, IntegrationType type, int limit) {
        List<HistoryEntry> entries = series.get(key(workspaceId, type));
        if (entries == null || limit <= 0) {
            return List.of();
        }
        synchronized (entries) {
            List<HistoryEntry> latest = new ArrayList<>(limit);
            for (int i = entries.size() - 1; i >= 0 && latest.size() < limit; i--) {
                latest.add(entries.get(i));
            }
            return latest;
        }
    }

    @Override
    public long removeOlderThan(String workspaceId, IntegrationType type, Instant cutoff) {
        List<HistoryEntry> entries = series.get(key(workspaceId, type));
        if (entries == null) {
            return 0;
        }
        synchronized (entries) {
            int before = entries.size();
            entries.removeIf(entry -> entry.timestamp().isBefore(cutoff));
            return before - entries.size();
        }
    }

    @Override
    public long trimToSize(String workspaceId, IntegrationType type, int maxEntries) {
        List<HistoryEntry> entries = series.get(key(workspaceId, type));
        if (entries == null) {
            return 0;
        }
        synchronized (entries) {
            int excess = entries.size() - maxEntries;
            if (excess <= 0) {
                return 0;
            }
            entries.subList(0, excess).clear();
            return excess;
        }
    }

    private static String key(String workspaceId, IntegrationType type) {
        return workspaceId + ":" + type.value();
    }
}
