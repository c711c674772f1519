package com.kotsin.structure.dealer.model;

/**
 * How far the computation got for a symbol, independent of the quality status.
 */
public enum ProcessingStatus {
    SUCCESS,
    FAIL_MISSING_SPOT,
    FAIL_SPOT_RESOLUTION,
    FAIL_NO_OPTIONS,
    FAIL_NO_ELIGIBLE_OPTIONS
}
