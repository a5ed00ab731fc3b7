package com.integrationhealth.core.store;

import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface HealthRecordStore {
    
    Optional<HealthRecord> findByWorkspaceAndType(String workspaceId, IntegrationType type);
    
    List<HealthRecord> findAllByWorkspace(String workspaceId);
    
    /**
     * Inserts or replaces the record keyed by (workspaceId, integrationType).
     */
    HealthRecord save(HealthRecord record);
    
    Map<HealthStatus, Long> countByStatus();
}
