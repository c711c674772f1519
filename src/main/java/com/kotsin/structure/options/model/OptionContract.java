package com.kotsin.structure.options.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One option contract of a chain snapshot, as supplied by the options store.
 * Greeks and quotes are nullable; the filter decides what is usable.
 */
@Value
@Builder
public class OptionContract {

    double strike;
    LocalDate expiry;
    OptionType type;

    Double gamma;
    Double delta;
    Double impliedVolatility;

    long openInterest;
    long volume;

    Double bid;
    Double ask;

    public boolean isCall() {
        return type == OptionType.CALL;
    }
}
