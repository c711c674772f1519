package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed gamma exposure aggregated at one strike.
 */
public record StrikeExposure(
        @JsonProperty("strike") double strike,
        @JsonProperty("gex") Double gex) {
}
