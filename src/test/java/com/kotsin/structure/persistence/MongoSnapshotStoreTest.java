package com.kotsin.structure.persistence;

import com.kotsin.structure.config.ExecutionConfig;
import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.exception.TransientPersistenceException;
import com.kotsin.structure.retry.RetryHandler;
import com.kotsin.structure.wyckoff.model.Regime;
import com.kotsin.structure.wyckoff.model.RegimeState;
import com.kotsin.structure.wyckoff.model.WyckoffEvent;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("MongoSnapshotStore")
class MongoSnapshotStoreTest {

    private static final Instant TIME = Instant.parse("2024-06-14T20:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoSnapshotStore store;

    @BeforeEach
    void setUp() {
        ExecutionConfig config = new ExecutionConfig();
        config.getRetry().setMaxAttempts(2);
        config.getRetry().setInitialDelayMs(1);
        config.getRetry().setMaxDelayMs(1);
        mongoTemplate = mock(MongoTemplate.class);
        store = new MongoSnapshotStore(mongoTemplate, new RetryHandler(config), config);
    }

    // ========== Upsert ==========

    @Test
    @DisplayName("Upsert is keyed on symbol and time and sets only the owned fields")
    void testUpsert_OwnedFieldsOnly() {
        store.upsert(snapshot());

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).upsert(query.capture(), update.capture(), eq("daily_snapshots"));

        Document filter = query.getValue().getQueryObject();
        assertEquals("SPY", filter.get("symbol"));
        assertEquals(Date.from(TIME), filter.get("time"));

        Document updateObject = update.getValue().getUpdateObject();
        assertEquals(1, updateObject.size(), "only $set is used");
        Document set = (Document) updateObject.get("$set");
        assertEquals(Set.of("dealer_metrics", "wyckoff_events", "wyckoff_regime",
                "wyckoff_summary", "model_version"), set.keySet());
        assertEquals("structure-core-v1", set.get("model_version"));
    }

    @Test
    @DisplayName("Nested values are converted to plain maps with snake_case keys")
    void testToUpdate_Conversion() {
        Document set = (Document) MongoSnapshotStore.toUpdate(snapshot()).getUpdateObject().get("$set");

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> events = (List<Map<String, Object>>) set.get("wyckoff_events");
        assertEquals(1, events.size());
        assertEquals("SC", events.get(0).get("type"));
        assertEquals("2024-06-14", events.get(0).get("date"));
        assertEquals("Accumulation", events.get(0).get("regime_after"));

        @SuppressWarnings("unchecked")
        Map<String, Object> regime = (Map<String, Object>) set.get("wyckoff_regime");
        assertEquals("Accumulation", regime.get("current_regime"));
        assertEquals("2024-06-14", regime.get("as_of"));
        assertNull(set.get("dealer_metrics"));
    }

    @Test
    @DisplayName("Equal records produce equal updates")
    void testToUpdate_Deterministic() {
        assertEquals(MongoSnapshotStore.toUpdate(snapshot()).getUpdateObject(),
                MongoSnapshotStore.toUpdate(snapshot()).getUpdateObject());
    }

    // ========== Error mapping ==========

    @Test
    @DisplayName("Transient failure is retried and then succeeds")
    void testUpsert_RetriedOnce() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq("daily_snapshots")))
                .thenThrow(new QueryTimeoutException("slow"))
                .thenReturn(null);

        assertDoesNotThrow(() -> store.upsert(snapshot()));
        verify(mongoTemplate, times(2)).upsert(any(Query.class), any(Update.class), eq("daily_snapshots"));
    }

    @Test
    @DisplayName("Exhausted retries become a transient persistence failure")
    void testUpsert_Exhausted() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq("daily_snapshots")))
                .thenThrow(new QueryTimeoutException("slow"));

        assertThrows(TransientPersistenceException.class, () -> store.upsert(snapshot()));
    }

    @Test
    @DisplayName("Non-retryable write error is a transient persistence failure for the symbol")
    void testUpsert_NonRetryable() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq("daily_snapshots")))
                .thenThrow(new DataIntegrityViolationException("bad document"));

        assertThrows(TransientPersistenceException.class, () -> store.upsert(snapshot()));
        verify(mongoTemplate, times(1)).upsert(any(Query.class), any(Update.class), eq("daily_snapshots"));
    }

    @Test
    @DisplayName("Unreachable store is systemic")
    void testUpsert_Unreachable() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq("daily_snapshots")))
                .thenThrow(new DataAccessResourceFailureException("no primary"));

        assertThrows(SystemicException.class, () -> store.upsert(snapshot()));
    }

    @Test
    @DisplayName("Unreachable store after retries is systemic")
    void testUpsert_UnreachableAfterRetries() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq("daily_snapshots")))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(SystemicException.class, () -> store.upsert(snapshot()));
        verify(mongoTemplate, times(2)).upsert(any(Query.class), any(Update.class), eq("daily_snapshots"));
    }

    private static SnapshotRecord snapshot() {
        LocalDate date = LocalDate.of(2024, 6, 14);
        WyckoffEvent sc = WyckoffEvent.builder()
                .symbol("SPY")
                .date(date)
                .type(WyckoffEventType.SC)
                .confidence(0.8)
                .score(22.4)
                .priceLevel(101.0)
                .regimeAfter(Regime.ACCUMULATION)
                .build();
        RegimeState state = RegimeState.initial("SPY").withEvent(sc).withAsOf(date);
        return SnapshotRecord.builder()
                .symbol("SPY")
                .time(TIME)
                .tradingDate(date)
                .wyckoffEvents(List.of(sc))
                .regimeState(state)
                .modelVersion("structure-core-v1")
                .build();
    }
}
