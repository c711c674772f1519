package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DealerPosition {
    LONG_GAMMA("long_gamma"),
    SHORT_GAMMA("short_gamma"),
    NEUTRAL("neutral"),
    UNKNOWN("unknown");

    private final String value;

    DealerPosition(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
