package com.integrationhealth.mongo.store;

import com.integrationhealth.core.exception.HealthStoreException;
import com.integrationhealth.core.model.HealthStatus;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.mongodb.client.result.DeleteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoHealthHistoryStoreTest {

    private static final String COLLECTION = "integration_health_history";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private MongoTemplate mongoTemplate;
    
    @Mock
    private DeleteResult deleteResult;
    
    private MongoHealthHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new MongoHealthHistoryStore(mongoTemplate);
    }

    @Test
    void testAppendFlattensSeriesKey() {
        store.append("ws-1", IntegrationType.DISCORD, new HistoryEntry(NOW, HealthStatus.UNHEALTHY, 300L, "boom"));
        
        ArgumentCaptor<HealthHistoryDocument> captor = ArgumentCaptor.forClass(HealthHistoryDocument.class);
        verify(mongoTemplate).insert(captor.capture(), eq(COLLECTION));
        assertEquals("ws-1", captor.getValue().getWorkspaceId());
        assertEquals(IntegrationType.DISCORD, captor.getValue().getIntegrationType());
        assertEquals("boom", captor.getValue().getError());
    }

    @Test
    void testFindLatestSortsNewestFirstWithLimit() {
        HealthHistoryDocument document = HealthHistoryDocument.of("ws-1", IntegrationType.DISCORD,
            new HistoryEntry(NOW, HealthStatus.HEALTHY, 40L, null));
        when(mongoTemplate.find(any(Query.class), eq(HealthHistoryDocument.class), eq(COLLECTION)))
            .thenReturn(List.of(document));
        
        List<HistoryEntry> entries = store.findLatest("ws-1", IntegrationType.DISCORD, 5);
        
        assertEquals(1, entries.size());
        assertEquals(NOW, entries.get(0).timestamp());
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(HealthHistoryDocument.class), eq(COLLECTION));
        assertEquals(5, query.getValue().getLimit());
        assertEquals(-1, query.getValue().getSortObject().getInteger("timestamp"));
    }

    @Test
    void testRemoveOlderThanReturnsDeletedCount() {
        when(mongoTemplate.remove(any(Query.class), eq(COLLECTION))).thenReturn(deleteResult);
        when(deleteResult.getDeletedCount()).thenReturn(7L);
        
        assertEquals(7L, store.removeOlderThan("ws-1", IntegrationType.DISCORD, NOW));
    }

    @Test
    void testTrimToSizeRemovesOldestExcess() {
        HealthHistoryDocument oldest = new HealthHistoryDocument();
        oldest.setId("h-1");
        when(mongoTemplate.count(any(Query.class), eq(COLLECTION))).thenReturn(11L);
        when(mongoTemplate.find(any(Query.class), eq(HealthHistoryDocument.class), eq(COLLECTION)))
            .thenReturn(List.of(oldest));
        when(mongoTemplate.remove(any(Query.class), eq(COLLECTION))).thenReturn(deleteResult);
        when(deleteResult.getDeletedCount()).thenReturn(1L);
        
        assertEquals(1L, store.trimToSize("ws-1", IntegrationType.DISCORD, 10));
    }

    @Test
    void testTrimToSizeNoopUnderLimit() {
        when(mongoTemplate.count(any(Query.class), eq(COLLECTION))).thenReturn(3L);
        
        assertEquals(0L, store.trimToSize("ws-1", IntegrationType.DISCORD, 10));
        verify(mongoTemplate, never()).remove(any(Query.class), anyString());
    }

    @Test
    void testReadFailureIsWrapped() {
        when(mongoTemplate.find(any(Query.class), eq(HealthHistoryDocument.class), eq(COLLECTION)))
            .thenThrow(new RuntimeException("timeout"));
        
        assertThrows(HealthStoreException.class, () -> store.findSince("ws-1", IntegrationType.DISCORD, NOW));
    }
}
