package com.integrationhealth.mongo.store;

import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;

import java.time.Instant;

/**
 * Stored shape of a {@link HistoryEntry}, flattened with its series key so one collection holds every series.
 */
public class HealthHistoryDocument {
    
    private String id;
    private String workspaceId;
    private IntegrationType integrationType;
    private Instant timestamp;
    private HealthStatus status;
    private long responseTimeMs;
    private String error;
    
    public HealthHistoryDocument() {}
    
    static HealthHistoryDocument of(String workspaceId, IntegrationType type, HistoryEntry entry) {
        HealthHistoryDocument document = new HealthHistoryDocument();
        document.workspaceId = workspaceId;
        document.integrationType = type;
        document.timestamp = entry.timestamp();
        document.status = entry.status();
        document.responseTimeMs = entry.responseTimeMs();
        document.error = entry.error();
        return document;
    }
    
    HistoryEntry toEntry() {
        return new HistoryEntry(timestamp, status, responseTimeMs, error);
    }
    
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    
    public String getWorkspaceId() { return workspaceId; }
    public void setWorkspaceId(String workspaceId) { this.workspaceId = workspaceId; }
    
    public IntegrationType getIntegrationType() { return integrationType; }
    public void setIntegrationType(IntegrationType integrationType) { this.integrationType = integrationType; }
    
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    
    public HealthStatus getStatus() { return status; }
    public void setStatus(HealthStatus status) { this.status = status; }
    
    public long getResponseTimeMs() { return responseTimeMs; }
    public void setResponseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; }
    
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
}
