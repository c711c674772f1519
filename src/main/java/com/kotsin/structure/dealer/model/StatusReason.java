package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the classifier picked a status. INVALID reasons are checked in declaration order.
 */
public enum StatusReason {
    FULL_THRESHOLDS_MET("full_thresholds_met"),
    LIMITED_THRESHOLDS_MET("limited_thresholds_met"),
    NO_ELIGIBLE_OPTIONS("no_eligible_options"),
    MISSING_GEX_TOTAL("missing_gex_total"),
    MISSING_GEX_NET("missing_gex_net"),
    MISSING_SPOT("missing_spot"),
    ALL_CONTRACTS_FILTERED("all_contracts_filtered"),
    NO_OPTIONS_AVAILABLE("no_options_available"),
    CRITERIA_NOT_MET("criteria_not_met");

    private final String value;

    StatusReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
