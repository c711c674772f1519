package com.kotsin.structure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.kotsin.structure.config.ExecutionConfig;
import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.exception.TransientPersistenceException;
import com.kotsin.structure.retry.RetryHandler;
import com.kotsin.structure.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * MongoSnapshotStore - upserts the owned fields of a daily snapshot document.
 *
 * Document key: {symbol, time}. Owned fields, written with $set only:
 * - dealer_metrics
 * - wyckoff_events
 * - wyckoff_regime
 * - wyckoff_summary
 * - model_version
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoSnapshotStore implements SnapshotStore {

    static final String FIELD_DEALER_METRICS = "dealer_metrics";
    static final String FIELD_WYCKOFF_EVENTS = "wyckoff_events";
    static final String FIELD_WYCKOFF_REGIME = "wyckoff_regime";
    static final String FIELD_WYCKOFF_SUMMARY = "wyckoff_summary";
    static final String FIELD_MODEL_VERSION = "model_version";

    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE = new TypeReference<>() {};

    private final MongoTemplate mongoTemplate;
    private final RetryHandler retryHandler;
    private final ExecutionConfig executionConfig;

    @Override
    public void upsert(SnapshotRecord record) {
        String collection = executionConfig.getCollections().getSnapshots();
        Query query = Query.query(Criteria.where("symbol").is(record.getSymbol())
                .and("time").is(Date.from(record.getTime())));
        Update update = toUpdate(record);

        String operation = "snapshot-upsert:" + record.getSymbol();
        try {
            retryHandler.executeWithRetry(() -> mongoTemplate.upsert(query, update, collection), operation);
            log.debug("[SNAPSHOT-STORE] Upserted {} @ {} into {}", record.getSymbol(), record.getTime(), collection);
        } catch (DataAccessResourceFailureException e) {
            throw unreachable(record, e);
        } catch (RetryHandler.RetryExhaustedException e) {
            if (e.getCause() instanceof DataAccessResourceFailureException) {
                throw unreachable(record, e);
            }
            log.warn("[SNAPSHOT-STORE] Upsert of {} @ {} failed after {} attempts: {}",
                    record.getSymbol(), record.getTime(), e.getAttempts(), e.getMessage());
            throw new TransientPersistenceException("Snapshot upsert failed for " + record.getSymbol(), e);
        } catch (RuntimeException e) {
            log.warn("[SNAPSHOT-STORE] Upsert of {} @ {} failed: {}", record.getSymbol(), record.getTime(), e.getMessage());
            throw new TransientPersistenceException("Snapshot upsert failed for " + record.getSymbol(), e);
        }
    }

    /**
     * $set of the owned fields. Values go through the canonical JSON mapping so
     * equal records always produce equal documents.
     */
    static Update toUpdate(SnapshotRecord record) {
        return new Update()
                .set(FIELD_DEALER_METRICS, record.getDealerMetrics() == null ? null : JsonUtils.toMap(record.getDealerMetrics()))
                .set(FIELD_WYCKOFF_EVENTS, JsonUtils.mapper().convertValue(
                        record.getWyckoffEvents() == null ? List.of() : record.getWyckoffEvents(), LIST_TYPE))
                .set(FIELD_WYCKOFF_REGIME, record.getRegimeState() == null ? null : JsonUtils.toMap(record.getRegimeState()))
                .set(FIELD_WYCKOFF_SUMMARY, record.getWyckoffSummary() == null ? null : JsonUtils.toMap(record.getWyckoffSummary()))
                .set(FIELD_MODEL_VERSION, record.getModelVersion());
    }

    private SystemicException unreachable(SnapshotRecord record, Exception e) {
        log.error("[SNAPSHOT-STORE] Store unreachable while writing {}: {}", record.getSymbol(), e.getMessage());
        return new SystemicException("Snapshot store unreachable", e);
    }
}
