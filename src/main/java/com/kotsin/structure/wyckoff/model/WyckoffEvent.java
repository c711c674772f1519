package com.kotsin.structure.wyckoff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class WyckoffEvent {

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("type")
    WyckoffEventType type;

    /**
     * score / max score, in [0, 1]
     */
    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("score")
    double score;

    @JsonProperty("price_level")
    double priceLevel;

    @JsonProperty("volume_context")
    VolumeContext volumeContext;

    @JsonProperty("regime_after")
    Regime regimeAfter;
}
