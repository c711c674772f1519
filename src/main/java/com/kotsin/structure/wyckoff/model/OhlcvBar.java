package com.kotsin.structure.wyckoff.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Daily OHLCV bar. Immutable, supplied by the OHLCV store.
 */
@Value
@Builder
public class OhlcvBar {

    LocalDate date;
    double open;
    double high;
    double low;
    double close;
    long volume;

    public double range() {
        return high - low;
    }

    /**
     * Where the close sits in the bar range: 0 = low, 1 = high, 0.5 for a zero range.
     */
    public double closeLocation() {
        double range = range();
        if (range <= 0) {
            return 0.5;
        }
        return (close - low) / range;
    }
}
