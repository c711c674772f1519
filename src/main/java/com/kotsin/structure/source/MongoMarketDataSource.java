package com.kotsin.structure.source;

import com.kotsin.structure.config.ExecutionConfig;
import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.options.model.OptionChainSnapshot;
import com.kotsin.structure.options.model.OptionContract;
import com.kotsin.structure.options.model.OptionType;
import com.kotsin.structure.wyckoff.model.OhlcvBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoMarketDataSource - reads bars, option chains and upstream snapshot fields.
 *
 * Collections (names from {@code execution.collections.*}):
 * - ohlcv:          {symbol, date (UTC midnight), open, high, low, close, volume}
 * - options_chains: {symbol, time, expiration_date, strike_price, option_type (C/P),
 *                    bid, ask, volume, open_interest, implied_volatility, delta, gamma}
 * - daily_snapshots: price_metrics and volatility_metrics.iv_rank written by upstream jobs
 * - symbols:        {symbol, active}
 *
 * OHLCV rows without a date or with a missing or non-positive price are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoMarketDataSource implements MarketDataSource {

    private final MongoTemplate mongoTemplate;
    private final ExecutionConfig executionConfig;

    @Override
    public List<String> activeSymbols() {
        return read("activeSymbols", () -> {
            Query query = Query.query(Criteria.where("active").is(true));
            query.fields().include("symbol");
            List<String> symbols = new ArrayList<>();
            for (Document doc : mongoTemplate.find(query, Document.class, collections().getSymbols())) {
                String symbol = doc.getString("symbol");
                if (symbol != null && !symbol.isBlank()) {
                    symbols.add(symbol);
                }
            }
            return symbols;
        });
    }

    @Override
    public List<OhlcvBar> loadBars(String symbol, LocalDate from, LocalDate to) {
        return read("loadBars:" + symbol, () -> {
            Query query = Query.query(Criteria.where("symbol").is(symbol)
                            .and("date").gte(toDate(from)).lte(toDate(to)))
                    .with(Sort.by(Sort.Direction.ASC, "date"));

            List<OhlcvBar> bars = new ArrayList<>();
            for (Document doc : mongoTemplate.find(query, Document.class, collections().getOhlcv())) {
                Date date = doc.getDate("date");
                if (date == null) {
                    log.warn("[SOURCE] {} skipping ohlcv row without date: {}", symbol, doc.get("_id"));
                    continue;
                }
                Double open = positiveNumber(doc, "open");
                Double high = positiveNumber(doc, "high");
                Double low = positiveNumber(doc, "low");
                Double close = positiveNumber(doc, "close");
                if (open == null || high == null || low == null || close == null) {
                    log.warn("[SOURCE] {} skipping ohlcv row {} with missing or non-positive prices",
                            symbol, doc.get("_id"));
                    continue;
                }
                bars.add(OhlcvBar.builder()
                        .date(date.toInstant().atZone(ZoneOffset.UTC).toLocalDate())
                        .open(open)
                        .high(high)
                        .low(low)
                        .close(close)
                        .volume((long) number(doc, "volume", 0.0))
                        .build());
            }
            return bars;
        });
    }

    @Override
    public OptionChainSnapshot loadOptionChain(String symbol, Instant snapshotTime, LocalDate tradingDate) {
        return read("loadOptionChain:" + symbol, () -> {
            String collection = collections().getOptionsChains();

            Query latest = Query.query(Criteria.where("symbol").is(symbol).and("time").lte(Date.from(snapshotTime)))
                    .with(Sort.by(Sort.Direction.DESC, "time"))
                    .limit(1);
            latest.fields().include("time");
            Document head = mongoTemplate.findOne(latest, Document.class, collection);
            if (head == null || head.getDate("time") == null) {
                return OptionChainSnapshot.empty(symbol, snapshotTime, tradingDate);
            }
            Date optionsTime = head.getDate("time");

            Query rows = Query.query(Criteria.where("symbol").is(symbol).and("time").is(optionsTime))
                    .with(Sort.by(Sort.Direction.ASC, "expiration_date", "strike_price", "option_type"));

            OptionChainSnapshot.OptionChainSnapshotBuilder builder = OptionChainSnapshot.builder()
                    .symbol(symbol)
                    .snapshotTime(snapshotTime)
                    .optionsTime(optionsTime.toInstant())
                    .tradingDate(tradingDate)
                    .ivRank(loadIvRank(symbol, snapshotTime));

            for (Document doc : mongoTemplate.find(rows, Document.class, collection)) {
                Date expiry = doc.getDate("expiration_date");
                builder.contract(OptionContract.builder()
                        .strike(number(doc, "strike_price", 0.0))
                        .expiry(expiry == null ? null : expiry.toInstant().atZone(ZoneOffset.UTC).toLocalDate())
                        .type(OptionType.fromCode(doc.getString("option_type")))
                        .gamma(nullableNumber(doc, "gamma"))
                        .delta(nullableNumber(doc, "delta"))
                        .impliedVolatility(nullableNumber(doc, "implied_volatility"))
                        .openInterest((long) number(doc, "open_interest", 0.0))
                        .volume((long) number(doc, "volume", 0.0))
                        .bid(nullableNumber(doc, "bid"))
                        .ask(nullableNumber(doc, "ask"))
                        .build());
            }
            return builder.build();
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> loadPriceMetrics(String symbol, Instant snapshotTime) {
        return read("loadPriceMetrics:" + symbol, () -> {
            Document doc = findSnapshot(symbol, snapshotTime, "price_metrics");
            Object metrics = doc == null ? null : doc.get("price_metrics");
            return metrics instanceof Map ? (Map<String, Object>) metrics : Map.of();
        });
    }

    @Override
    public Optional<Instant> latestOptionsTime() {
        return read("latestOptionsTime", () -> {
            Query query = new Query().with(Sort.by(Sort.Direction.DESC, "time")).limit(1);
            query.fields().include("time");
            Document doc = mongoTemplate.findOne(query, Document.class, collections().getOptionsChains());
            return Optional.ofNullable(doc == null ? null : doc.getDate("time")).map(Date::toInstant);
        });
    }

    private Double loadIvRank(String symbol, Instant snapshotTime) {
        Document doc = findSnapshot(symbol, snapshotTime, "volatility_metrics");
        Object metrics = doc == null ? null : doc.get("volatility_metrics");
        if (metrics instanceof Document) {
            return nullableNumber((Document) metrics, "iv_rank");
        }
        return null;
    }

    private Document findSnapshot(String symbol, Instant snapshotTime, String field) {
        Query query = Query.query(Criteria.where("symbol").is(symbol).and("time").is(Date.from(snapshotTime)));
        query.fields().include(field);
        return mongoTemplate.findOne(query, Document.class, collections().getSnapshots());
    }

    private <T> T read(String operation, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (DataAccessResourceFailureException e) {
            log.error("[SOURCE] Store unreachable during {}: {}", operation, e.getMessage());
            throw new SystemicException("Market data store unreachable during " + operation, e);
        }
    }

    private ExecutionConfig.CollectionsConfig collections() {
        return executionConfig.getCollections();
    }

    static Date toDate(LocalDate date) {
        return Date.from(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    private static double number(Document doc, String key, double defaultValue) {
        Double value = nullableNumber(doc, key);
        return value != null ? value : defaultValue;
    }

    private static Double positiveNumber(Document doc, String key) {
        Double value = nullableNumber(doc, key);
        return value != null && value > 0 ? value : null;
    }

    private static Double nullableNumber(Document doc, String key) {
        Object value = doc.get(key);
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
        }
        return null;
    }
}
