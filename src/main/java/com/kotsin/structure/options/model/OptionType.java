package com.kotsin.structure.options.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OptionType {
    CALL("call"),
    PUT("put");

    private final String value;

    OptionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts "C"/"P", "CALL"/"PUT" in any case; null for anything else.
     */
    public static OptionType fromCode(String code) {
        if (code == null) {
            return null;
        }
        switch (code.trim().toUpperCase()) {
            case "C":
            case "CALL":
                return CALL;
            case "P":
            case "PUT":
                return PUT;
            default:
                return null;
        }
    }
}
