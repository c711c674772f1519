package com.kotsin.structure.wyckoff.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wyckoff market phase. Unknown until the first structural event.
 */
public enum Regime {
    UNKNOWN("Unknown"),
    ACCUMULATION("Accumulation"),
    MARKUP("Markup"),
    DISTRIBUTION("Distribution"),
    MARKDOWN("Markdown");

    private final String label;

    Regime(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
