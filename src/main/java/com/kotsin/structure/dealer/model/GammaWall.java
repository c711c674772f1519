package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Strike with concentrated open interest on one side of the chain.
 */
public record GammaWall(
        @JsonProperty("strike") double strike,
        @JsonProperty("open_interest") long openInterest,
        @JsonProperty("volume") long volume) {
}
