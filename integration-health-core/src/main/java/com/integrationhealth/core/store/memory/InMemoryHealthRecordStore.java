package com.integrationhealth.core.store.memory;

import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.store.HealthRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local record store used when no persistence adapter is on the classpath.
 */
public class InMemoryHealthRecordStore implements HealthRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryHealthRecordStore.class);

    private final Map<Key, HealthRecord> records = new ConcurrentHashMap<>();

    public InMemoryHealthRecordStore() {
        logger.warn("Using in-memory health record store; records are lost on restart");
    }

    @Override
    public Optional<HealthRecord> findByWorkspaceAndType(String workspaceId, IntegrationType type) {
        return Optional.ofNullable(records.get(new Key(workspaceId, type))).map(HealthRecord::copy);
    }

    @Override
    public List<HealthRecord> findAllByWorkspace(String workspaceId) {
        return records.values().stream()
            .filter(record -> record.getWorkspaceId().equals(workspaceId))
            .sorted(Comparator.comparing(HealthRecord::getIntegrationType))
            .map(HealthRecord::copy)
            .toList();
    }

    @Override
    public HealthRecord save(HealthRecord record) {
        records.put(new Key(record.getWorkspaceId(), record.getIntegrationType()), record.copy());
        return record;
    }

    @Override
    public Map<HealthStatus, Long> countByStatus() {
        Map<HealthStatus, Long> counts = new EnumMap<>(HealthStatus.class);
        for (HealthRecord record : records.values()) {
            counts.merge(record.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    private record Key(String workspaceId, IntegrationType type) {}
}
