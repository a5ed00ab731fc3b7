package com.integrationhealth.mongo.store;

import com.integrationhealth.core.exception.HealthStoreException;
import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.store.HealthRecordStore;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "integration-health.store.records", havingValue = "mongo")
public class MongoHealthRecordStore implements HealthRecordStore {
    
    private static final Logger logger = LoggerFactory.getLogger(MongoHealthRecordStore.class);
    static final String COLLECTION_NAME = "integration_health_checks";
    private final MongoTemplate mongoTemplate;
    public MongoHealthRecordStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }
    
    @Override
    public Optional<HealthRecord> findByWorkspaceAndType(String workspaceId, IntegrationType type) {
        try {
            return Optional.ofNullable(mongoTemplate.findOne(byWorkspaceAndType(workspaceId, type),
                HealthRecord.class, COLLECTION_NAME));
        } catch (Exception e) {
            logger.error("Failed to load health record for workspace {} type {}", workspaceId, type.value(), e);
            throw new HealthStoreException("Health record lookup failed", e);
        }
    }
    
    @Override
    public List<HealthRecord> findAllByWorkspace(String workspaceId) {
        try {
            Query query = new Query(Criteria.where("workspaceId").is(workspaceId))
                .with(Sort.by(Sort.Direction.ASC, "integrationType"));
            return mongoTemplate.find(query, HealthRecord.class, COLLECTION_NAME);
        } catch (Exception e) {
            logger.error("Failed to load health records for workspace {}", workspaceId, e);
            throw new HealthStoreException("Health record lookup failed", e);
        }
    }
    
    @Override
    public HealthRecord save(HealthRecord record) {
        try {
            // Keep the stored _id so the (workspaceId, integrationType) pair stays a single document
            HealthRecord existing = mongoTemplate.findOne(
                byWorkspaceAndType(record.getWorkspaceId(), record.getIntegrationType()),
                HealthRecord.class, COLLECTION_NAME);
            if (existing != null && !existing.getId().equals(record.getId())) {
                record.setId(existing.getId());
                record.setCreatedAt(existing.getCreatedAt());
            }
            HealthRecord saved = mongoTemplate.save(record, COLLECTION_NAME);
            logger.debug("Saved health record for workspace {} type {} with status {}",
                record.getWorkspaceId(), record.getIntegrationType().value(), record.getStatus().value());
            return saved;
        } catch (Exception e) {
            logger.error("Failed to save health record for workspace {} type {}",
                record.getWorkspaceId(), record.getIntegrationType(), e);
            throw new HealthStoreException("Health record save failed", e);
        }
    }
    
    @Override
    public Map<HealthStatus, Long> countByStatus() {
        try {
            Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group("status").count().as("total"));
            Map<HealthStatus, Long> counts = new EnumMap<>(HealthStatus.class);
            for (Document bucket : mongoTemplate.aggregate(aggregation, COLLECTION_NAME, Document.class)) {
                Object status = bucket.get("_id");
                Number total = bucket.get("total", Number.class);
                if (status != null && total != null) {
                    counts.put(HealthStatus.valueOf(status.toString()), total.longValue());
                }
            }
            return counts;
        } catch (Exception e) {
            logger.error("Failed to count health records by status", e);
            return Map.of();
        }
    }
    
    private static Query byWorkspaceAndType(String workspaceId, IntegrationType type) {
        return new Query(Criteria.where("workspaceId").is(workspaceId).and("integrationType").is(type));
    }
}
