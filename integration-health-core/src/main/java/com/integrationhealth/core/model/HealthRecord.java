package com.integrationhealth.core.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public class HealthRecord {

    // Identity, unique per (workspaceId, integrationType)
    private String id;
    private String workspaceId;
    private IntegrationType integrationType;
    private String integrationId;           // Opaque reference to the provider connection

    // Current state
    private HealthStatus status;
    private Instant lastSuccessAt;
    private Instant lastErrorAt;
    private String lastErrorMessage;
    private Long responseTimeMs;            // Latency of the last probe
    private Map<String, Object> healthDetails = new HashMap<>();
    private Instant checkedAt;

    // Derived from history on every probe
    private int errorCount24h;
    private double uptime30d = 100.0;
    private int consecutiveFailures;

    private Instant createdAt;
    private Instant updatedAt;

    public HealthRecord() {}

    public HealthRecord(String workspaceId, IntegrationType integrationType, String integrationId,
                        HealthStatus status, Instant checkedAt) {
        this.id = UUID.randomUUID().toString();
        this.workspaceId = workspaceId;
        this.integrationType = integrationType;
        this.integrationId = integrationId;
        this.status = status;
        this.checkedAt = checkedAt;
        this.createdAt = checkedAt;
        this.updatedAt = checkedAt;
    }

    public HealthRecord copy() {
        HealthRecord copy = new HealthRecord();
        copy.id = id;
        copy.workspaceId = workspaceId;
        copy.integrationType = integrationType;
        copy.integrationId = integrationId;
        copy.status = status;
        copy.lastSuccessAt = lastSuccessAt;
        copy.lastErrorAt = lastErrorAt;
        copy.lastErrorMessage = lastErrorMessage;
        copy.responseTimeMs = responseTimeMs;
        copy.healthDetails = healthDetails == null ? new HashMap<>() : new HashMap<>(healthDetails);
        copy.checkedAt = checkedAt;
        copy.errorCount24h = errorCount24h;
        copy.uptime30d = uptime30d;
        copy.consecutiveFailures = consecutiveFailures;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getWorkspaceId() { return workspaceId; }
    public void setWorkspaceId(String workspaceId) { this.workspaceId = workspaceId; }

    public IntegrationType getIntegrationType() { return integrationType; }
    public void setIntegrationType(IntegrationType integrationType) { this.integrationType = integrationType; }

    public String getIntegrationId() { return integrationId; }
    public void setIntegrationId(String integrationId) { this.integrationId = integrationId; }

    public HealthStatus getStatus() { return status; }
    public void setStatus(HealthStatus status) { this.status = status; }

    public Instant getLastSuccessAt() { return lastSuccessAt; }
    public void setLastSuccessAt(Instant lastSuccessAt) { this.lastSuccessAt = lastSuccessAt; }

    public Instant getLastErrorAt() { return lastErrorAt; }
    public void setLastErrorAt(Instant lastErrorAt) { this.lastErrorAt = lastErrorAt; }

    public String getLastErrorMessage() { return lastErrorMessage; }
    public void setLastErrorMessage(String lastErrorMessage) { this.lastErrorMessage = lastErrorMessage; }

    public Long getResponseTimeMs() { return responseTimeMs; }
    public void setResponseTimeMs(Long responseTimeMs) { this.responseTimeMs = responseTimeMs; }

    public Map<String, Object> getHealthDetails() { return healthDetails; }
    public void setHealthDetails(Map<String, Object> healthDetails) {
        this.healthDetails = healthDetails == null ? new HashMap<>() : new HashMap<>(healthDetails);
    }

    public Instant getCheckedAt() { return checkedAt; }
    public void setCheckedAt(Instant checkedAt) { this.checkedAt = checkedAt; }

    public int getErrorCount24h() { return errorCount24h; }
    public void setErrorCount24h(int errorCount24h) { this.errorCount24h = errorCount24h; }

    public double getUptime30d() { return uptime30d; }
    public void setUptime30d(double uptime30d) { this.uptime30d = uptime30d; }

    public int getConsecutiveFailures() { return consecutiveFailures; }
    public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }

    public void incrementConsecutiveFailures() {
        this.consecutiveFailures++;
    }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HealthRecord that = (HealthRecord) o;
        return Objects.equals(workspaceId, that.workspaceId) && integrationType == that.integrationType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(workspaceId, integrationType);
    }

    @Override
    public String toString() {
        return "HealthRecord{" +
                "workspaceId='" + workspaceId + '\'' +
                ", integrationType=" + integrationType +
                ", status=" + status +
                ", consecutiveFailures=" + consecutiveFailures +
                ", checkedAt=" + checkedAt +
                '}';
    }
}
