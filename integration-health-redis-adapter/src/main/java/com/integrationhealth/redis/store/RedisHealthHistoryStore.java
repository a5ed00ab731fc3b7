package com.integrationhealth.redis.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.integrationhealth.core.config.IntegrationHealthProperties;
import com.integrationhealth.core.exception.HealthStoreException;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.store.HealthHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * One sorted set per (workspace, integration type), member = entry JSON, score = epoch millis of the probe.
 */
@Repository
@ConditionalOnProperty(name = "integration-health.store.history", havingValue = "redis", matchIfMissing = true)
public class RedisHealthHistoryStore implements HealthHistoryStore {
    
    private static final Logger logger = LoggerFactory.getLogger(RedisHealthHistoryStore.class);
    
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration retention;
    
    public RedisHealthHistoryStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                   IntegrationHealthProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.history().keyPrefix();
        this.retention = properties.history().retention();
    }
    
    String key(String workspaceId, IntegrationType type) {
        return keyPrefix + ":" + workspaceId + ":" + type.value();
    }
    
    @Override
    public void append(String workspaceId, IntegrationType type, HistoryEntry entry) {
        String key = key(workspaceId, type);
        try {
            String member = objectMapper.writeValueAsString(entry);
            zSet().add(key, member, entry.timestamp().toEpochMilli());
            // Idle series disappear once nothing has been written for a full retention window
            redisTemplate.expire(key, retention);
        } catch (JsonProcessingException e) {
            throw new HealthStoreException("History entry could not be serialized", e);
        } catch (RuntimeException e) {
            logger.error("Failed to append history entry to {}", key, e);
            throw new HealthStoreException("History append failed", e);
        }
    }
    
    @Override
    public List<HistoryEntry> findSince(String workspaceId, IntegrationType type, Instant from) {
        String key = key(workspaceId, type);
        try {
            Set<String> members = zSet().rangeByScore(key, from.toEpochMilli(), Double.POSITIVE_INFINITY);
            return parse(key, members);
        } catch (RuntimeException e) {
            logger.error("Failed to read history from {}", key, e);
            throw new HealthStoreException("History read failed", e);
        }
    }
    
    @Override
    public List<HistoryEntry> findLatest(String workspaceId, IntegrationType type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String key = key(workspaceId, type);
        try {
            Set<String> members = zSet().reverseRange(key, 0, limit - 1L);
            return parse(key, members);
        } catch (RuntimeException e) {
            logger.error("Failed to read latest history from {}", key, e);
            throw new HealthStoreException("History read failed", e);
        }
    }
    
    @Override
    public long removeOlderThan(String workspaceId, IntegrationType type, Instant cutoff) {
        String key = key(workspaceId, type);
        try {
            Long removed = zSet().removeRangeByScore(key, Double.NEGATIVE_INFINITY, cutoff.toEpochMilli() - 1);
            return removed != null ? removed : 0L;
        } catch (RuntimeException e) {
            logger.error("Failed to prune history in {}", key, e);
            throw new HealthStoreException("History prune failed", e);
        }
    }
    
    @Override
    public long trimToSize(String workspaceId, IntegrationType type, int maxEntries) {
        String key = key(workspaceId, type);
        try {
            Long size = zSet().size(key);
            if (size == null || size <= maxEntries) {
                return 0L;
            }
            long excess = size - maxEntries;
            Long removed = zSet().removeRange(key, 0, excess - 1);
            logger.debug("Trimmed {} oldest history entries from {}", removed, key);
            return removed != null ? removed : 0L;
        } catch (RuntimeException e) {
            logger.error("Failed to trim history in {}", key, e);
            throw new HealthStoreException("History trim failed", e);
        }
    }
    
    private ZSetOperations<String, String> zSet() {
        return redisTemplate.opsForZSet();
    }
    
    private List<HistoryEntry> parse(String key, Collection<String> members) {
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<HistoryEntry> entries = new ArrayList<>(members.size());
        for (String member : members) {
            try {
                entries.add(objectMapper.readValue(member, HistoryEntry.class));
            } catch (JsonProcessingException e) {
                logger.warn("Skipping unreadable history entry in {}: {}", key, e.getOriginalMessage());
            }
        }
        return entries;
    }
}
