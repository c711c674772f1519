package com.kotsin.structure.wyckoff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class RegimeTransition {

    @JsonProperty("from")
    Regime from;

    @JsonProperty("to")
    Regime to;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("trigger_event")
    WyckoffEventType triggerEvent;
}
