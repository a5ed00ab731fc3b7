package com.integrationhealth.postgres.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.integrationhealth.core.exception.HealthStoreException;
import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.store.HealthRecordStore;
import static com.integrationhealth.postgres.store.PostgresHealthQueries.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "integration-health.store.records", havingValue = "postgres", matchIfMissing = true)
public class PostgresHealthRecordStore implements HealthRecordStore {
    
    private static final Logger logger = LoggerFactory.getLogger(PostgresHealthRecordStore.class);
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};
    
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    
    public PostgresHealthRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public Optional<HealthRecord> findByWorkspaceAndType(String workspaceId, IntegrationType type) {
        try {
            List<HealthRecord> records = jdbcTemplate.query(SELECT_BY_WORKSPACE_AND_TYPE,
                (rs, rowNum) -> mapRow(rs), workspaceId, type.value());
            return records.stream().findFirst();
        } catch (Exception e) {
            logger.error("Failed to load health record for workspace {} type {}", workspaceId, type.value(), e);
            throw new HealthStoreException("Health record lookup failed", e);
        }
    }
    
    @Override
    public List<HealthRecord> findAllByWorkspace(String workspaceId) {
        try {
            return jdbcTemplate.query(SELECT_BY_WORKSPACE, (rs, rowNum) -> mapRow(rs), workspaceId);
        } catch (Exception e) {
            logger.error("Failed to load health records for workspace {}", workspaceId, e);
            throw new HealthStoreException("Health record lookup failed", e);
        }
    }
    
    @Override
    public HealthRecord save(HealthRecord record) {
        try {
            jdbcTemplate.update(UPSERT_HEALTH_CHECK,
                record.getId(),
                record.getWorkspaceId(),
                record.getIntegrationType().value(),
                record.getIntegrationId(),
                record.getStatus().value(),
                toTimestamp(record.getLastSuccessAt()),
                toTimestamp(record.getLastErrorAt()),
                record.getLastErrorMessage(),
                record.getErrorCount24h(),
                record.getUptime30d(),
                record.getResponseTimeMs(),
                record.getConsecutiveFailures(),
                writeDetails(record.getHealthDetails()),
                toTimestamp(record.getCheckedAt()),
                toTimestamp(record.getCreatedAt()),
                toTimestamp(record.getUpdatedAt()));
            
            logger.debug("Upserted health record for workspace {} type {} with status {}",
                record.getWorkspaceId(), record.getIntegrationType().value(), record.getStatus().value());
            return record;
            
        } catch (Exception e) {
            logger.error("Failed to save health record for workspace {} type {}",
                record.getWorkspaceId(), record.getIntegrationType(), e);
            throw new HealthStoreException("Health record save failed", e);
        }
    }
    
    @Override
    public Map<HealthStatus, Long> countByStatus() {
        Map<HealthStatus, Long> counts = new EnumMap<>(HealthStatus.class);
        try {
            jdbcTemplate.query(COUNT_GROUP_BY_STATUS, (RowCallbackHandler) rs -> {
                counts.put(HealthStatus.fromValue(rs.getString("status")), rs.getLong("total"));
            });
            return counts;
        } catch (Exception e) {
            logger.error("Failed to count health records by status", e);
            return Map.of();
        }
    }
    
    private HealthRecord mapRow(ResultSet rs) throws SQLException {
        HealthRecord record = new HealthRecord();
        record.setId(rs.getString("id"));
        record.setWorkspaceId(rs.getString("workspace_id"));
        record.setIntegrationType(IntegrationType.fromValue(rs.getString("integration_type")));
        record.setIntegrationId(rs.getString("integration_id"));
        record.setStatus(HealthStatus.fromValue(rs.getString("status")));
        record.setLastSuccessAt(toInstant(rs.getTimestamp("last_success_at")));
        record.setLastErrorAt(toInstant(rs.getTimestamp("last_error_at")));
        record.setLastErrorMessage(rs.getString("last_error_message"));
        record.setErrorCount24h(rs.getInt("error_count_24h"));
        record.setUptime30d(rs.getDouble("uptime_30d"));
        
        long responseTime = rs.getLong("response_time_ms");
        if (!rs.wasNull()) {
            record.setResponseTimeMs(responseTime);
        }
        
        record.setConsecutiveFailures(rs.getInt("consecutive_failures"));
        record.setHealthDetails(readDetails(rs.getString("health_details")));
        record.setCheckedAt(toInstant(rs.getTimestamp("checked_at")));
        record.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        record.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        return record;
    }
    
    private String writeDetails(Map<String, Object> details) throws JsonProcessingException {
        return objectMapper.writeValueAsString(details == null ? Map.of() : details);
    }
    
    private Map<String, Object> readDetails(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable health_details column", e);
        }
    }
    
    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
    
    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
