package com.kotsin.structure.execution.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionMode {
    EVENT("event"),
    BATCH("batch");

    private final String label;

    ExecutionMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
