package com.integrationhealth.mongo.store;

import com.integrationhealth.core.exception.HealthStoreException;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.store.HealthHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
@ConditionalOnProperty(name = "integration-health.store.history", havingValue = "mongo")
public class MongoHealthHistoryStore implements HealthHistoryStore {
    
    private static final Logger logger = LoggerFactory.getLogger(MongoHealthHistoryStore.class);
    static final String COLLECTION_NAME = "integration_health_history";
    private final MongoTemplate mongoTemplate;
    public MongoHealthHistoryStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }
    
    @Override
    public void append(String workspaceId, IntegrationType type, HistoryEntry entry) {
        try {
            mongoTemplate.insert(HealthHistoryDocument.of(workspaceId, type, entry), COLLECTION_NAME);
        } catch (Exception e) {
            logger.error("Failed to append history for workspace {} type {}", workspaceId, type.value(), e);
            throw new HealthStoreException("History append failed", e);
        }
    }
    
    @Override
    public List<HistoryEntry> findSince(String workspaceId, IntegrationType type, Instant from) {
        try {
            Query query = new Query(series(workspaceId, type).and("timestamp").gte(from))
                .with(Sort.by(Sort.Direction.ASC, "timestamp"));
            return toEntries(mongoTemplate.find(query, HealthHistoryDocument.class, COLLECTION_NAME));
        } catch (Exception e) {
            logger.error("Failed to read history for workspace {} type {}", workspaceId, type.value(), e);
            throw new HealthStoreException("History read failed", e);
        }
    }
    
    @Override
    public List<HistoryEntry> findLatest(String workspaceId, IntegrationType type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            Query query = new Query(series(workspaceId, type))
                .with(Sort.by(Sort.Direction.DESC, "timestamp"))
                .limit(limit);
            return toEntries(mongoTemplate.find(query, HealthHistoryDocument.class, COLLECTION_NAME));
        } catch (Exception e) {
            logger.error("Failed to read latest history for workspace {} type {}", workspaceId, type.value(), e);
            throw new HealthStoreException("History read failed", e);
        }
    }
    
    @Override
    public long removeOlderThan(String workspaceId, IntegrationType type, Instant cutoff) {
        try {
            Query query = new Query(series(workspaceId, type).and("timestamp").lt(cutoff));
            return mongoTemplate.remove(query, COLLECTION_NAME).getDeletedCount();
        } catch (Exception e) {
            logger.error("Failed to prune history for workspace {} type {}", workspaceId, type.value(), e);
            throw new HealthStoreException("History prune failed", e);
        }
    }
    
    @Override
    public long trimToSize(String workspaceId, IntegrationType type, int maxEntries) {
        try {
            long size = mongoTemplate.count(new Query(series(workspaceId, type)), COLLECTION_NAME);
            if (size <= maxEntries) {
                return 0L;
            }
            Query oldest = new Query(series(workspaceId, type))
                .with(Sort.by(Sort.Direction.ASC, "timestamp"))
                .limit((int) (size - maxEntries));
            oldest.fields().include("_id");
            List<String> ids = mongoTemplate.find(oldest, HealthHistoryDocument.class, COLLECTION_NAME).stream()
                .map(HealthHistoryDocument::getId)
                .toList();
            long removed = mongoTemplate.remove(new Query(Criteria.where("_id").in(ids)), COLLECTION_NAME)
                .getDeletedCount();
            logger.debug("Trimmed {} oldest history entries for workspace {} type {}", removed, workspaceId, type.value());
            return removed;
        } catch (Exception e) {
            logger.error("Failed to trim history for workspace {} type {}", workspaceId, type.value(), e);
            throw new HealthStoreException("History trim failed", e);
        }
    }
    
    private static Criteria series(String workspaceId, IntegrationType type) {
        return Criteria.where("workspaceId").is(workspaceId).and("integrationType").is(type);
    }
    
    private static List<HistoryEntry> toEntries(List<HealthHistoryDocument> documents) {
        return documents.stream().map(HealthHistoryDocument::toEntry).toList();
    }
}
