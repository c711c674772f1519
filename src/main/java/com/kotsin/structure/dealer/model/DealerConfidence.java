package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DealerConfidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    INVALID("invalid");

    private final String value;

    DealerConfidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
