package com.kotsin.structure.options.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Outcome of spot price resolution: explicit override, then the upstream price
 * metric, then the OHLCV close of the trading date.
 *
 * @param price             resolved spot, null when every source failed
 * @param source            e.g. "override", "price_metrics.close", "ohlcv"
 * @param strategy          which step succeeded, null when unresolved
 * @param attemptedSources  steps tried, in order
 */
public record SpotResolution(Double price, String source, Strategy strategy, List<String> attemptedSources) {

    public SpotResolution {
        attemptedSources = attemptedSources == null ? List.of() : List.copyOf(attemptedSources);
    }

    public static SpotResolution unresolved(List<String> attemptedSources) {
        return new SpotResolution(null, null, null, attemptedSources);
    }

    @JsonIgnore
    public boolean isResolved() {
        return price != null && price > 0 && !price.isNaN() && !price.isInfinite();
    }

    public enum Strategy {
        OVERRIDE("override"),
        PRICE_METRICS("price_metrics"),
        OHLCV_FALLBACK("ohlcv_fallback");

        private final String value;

        Strategy(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
