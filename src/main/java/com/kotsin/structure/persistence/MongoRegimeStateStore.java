package com.kotsin.structure.persistence;

import com.kotsin.structure.config.ExecutionConfig;
import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.exception.TransientPersistenceException;
import com.kotsin.structure.retry.RetryHandler;
import com.kotsin.structure.util.JsonUtils;
import com.kotsin.structure.wyckoff.model.RegimeState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * MongoRegimeStateStore - versioned Wyckoff regime state.
 *
 * One document per (symbol, as_of) with _id "SYMBOL_yyyy-MM-dd". as_of is
 * stored as an ISO date string, so string ordering is date ordering.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoRegimeStateStore implements RegimeStateStore {

    private final MongoTemplate mongoTemplate;
    private final RetryHandler retryHandler;
    private final ExecutionConfig executionConfig;

    @Override
    public Optional<RegimeState> findLatestBefore(String symbol, LocalDate date) {
        Query query = Query.query(Criteria.where("symbol").is(symbol).and("as_of").lt(date.toString()))
                .with(Sort.by(Sort.Direction.DESC, "as_of"))
                .limit(1);
        try {
            Document doc = mongoTemplate.findOne(query, Document.class, collection());
            if (doc == null) {
                log.debug("[REGIME-STORE] No state for {} before {}", symbol, date);
                return Optional.empty();
            }
            doc.remove("_id");
            return Optional.of(JsonUtils.fromMap(doc, RegimeState.class));
        } catch (DataAccessResourceFailureException e) {
            log.error("[REGIME-STORE] Store unreachable while reading {}: {}", symbol, e.getMessage());
            throw new SystemicException("Regime state store unreachable", e);
        }
    }

    @Override
    public void save(RegimeState state) {
        if (state.getAsOf() == null) {
            throw new IllegalArgumentException("Regime state for " + state.getSymbol() + " has no as_of date");
        }
        String id = documentId(state.getSymbol(), state.getAsOf());
        Update update = new Update();
        Map<String, Object> fields = JsonUtils.toMap(state);
        fields.forEach(update::set);

        try {
            retryHandler.executeWithRetry(
                    () -> mongoTemplate.upsert(Query.query(Criteria.where("_id").is(id)), update, collection()),
                    "regime-save:" + state.getSymbol());
            log.debug("[REGIME-STORE] Saved {} regime={} events={}",
                    id, state.getCurrentRegime(), state.getEventHistory().size());
        } catch (DataAccessResourceFailureException e) {
            log.error("[REGIME-STORE] Store unreachable while writing {}: {}", id, e.getMessage());
            throw new SystemicException("Regime state store unreachable", e);
        } catch (RetryHandler.RetryExhaustedException e) {
            if (e.getCause() instanceof DataAccessResourceFailureException) {
                log.error("[REGIME-STORE] Store unreachable while writing {}: {}", id, e.getMessage());
                throw new SystemicException("Regime state store unreachable", e);
            }
            throw new TransientPersistenceException("Regime state save failed for " + id, e);
        } catch (RuntimeException e) {
            log.warn("[REGIME-STORE] Save of {} failed: {}", id, e.getMessage());
            throw new TransientPersistenceException("Regime state save failed for " + id, e);
        }
    }

    static String documentId(String symbol, LocalDate asOf) {
        return symbol + "_" + asOf;
    }

    private String collection() {
        return executionConfig.getCollections().getRegimeState();
    }
}
