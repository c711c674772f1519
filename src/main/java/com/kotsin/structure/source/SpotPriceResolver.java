package com.kotsin.structure.source;

import com.kotsin.structure.options.model.SpotResolution;
import com.kotsin.structure.util.MathUtils;
import com.kotsin.structure.wyckoff.model.OhlcvBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves the spot price used for dealer metrics.
 *
 * Order: explicit override, then the upstream price metric of the snapshot
 * record (keys close, spot, price, last; nested objects may carry close, price
 * or spot), then the OHLCV close of the trading date. The attempted steps are
 * kept so the output records how the spot was found.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpotPriceResolver {

    static final String SOURCE_OVERRIDE = "override";
    static final String SOURCE_PRICE_METRICS = "price_metrics";
    static final String SOURCE_OHLCV = "ohlcv";

    private static final List<String> PRICE_METRIC_KEYS = List.of("close", "spot", "price", "last");
    private static final List<String> NESTED_KEYS = List.of("close", "price", "spot");

    private final MarketDataSource dataSource;

    public SpotResolution resolve(String symbol, Instant snapshotTime, LocalDate tradingDate,
                                  List<OhlcvBar> bars, Double spotOverride) {
        List<String> attempted = new ArrayList<>();

        if (spotOverride != null) {
            attempted.add(SOURCE_OVERRIDE);
            if (MathUtils.isValidNumber(spotOverride) && spotOverride > 0) {
                return new SpotResolution(spotOverride, SOURCE_OVERRIDE, SpotResolution.Strategy.OVERRIDE, attempted);
            }
            log.warn("[SPOT] {} ignoring invalid spot override {}", symbol, spotOverride);
        }

        attempted.add(SOURCE_PRICE_METRICS);
        Map<String, Object> metrics = dataSource.loadPriceMetrics(symbol, snapshotTime);
        if (metrics != null) {
            for (String key : PRICE_METRIC_KEYS) {
                Double value = extract(metrics.get(key));
                if (value != null) {
                    return new SpotResolution(value, SOURCE_PRICE_METRICS + "." + key,
                            SpotResolution.Strategy.PRICE_METRICS, attempted);
                }
            }
        }

        attempted.add(SOURCE_OHLCV);
        if (tradingDate != null && bars != null) {
            for (int i = bars.size() - 1; i >= 0; i--) {
                OhlcvBar bar = bars.get(i);
                if (tradingDate.equals(bar.getDate())) {
                    if (bar.getClose() > 0) {
                        return new SpotResolution(bar.getClose(), SOURCE_OHLCV,
                                SpotResolution.Strategy.OHLCV_FALLBACK, attempted);
                    }
                    break;
                }
            }
        }

        log.debug("[SPOT] {} unresolved for {}, attempted {}", symbol, snapshotTime, attempted);
        return SpotResolution.unresolved(attempted);
    }

    @SuppressWarnings("unchecked")
    private static Double extract(Object value) {
        if (value instanceof Map) {
            Map<String, Object> nested = (Map<String, Object>) value;
            for (String key : NESTED_KEYS) {
                Double candidate = toPositive(nested.get(key));
                if (candidate != null) {
                    return candidate;
                }
            }
            return null;
        }
        return toPositive(value);
    }

    private static Double toPositive(Object value) {
        Double number = null;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                number = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return MathUtils.isValidNumber(number) && number > 0 ? number : null;
    }
}
