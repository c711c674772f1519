package com.kotsin.structure.wyckoff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-date view of the structure written next to the dealer metrics.
 */
@Value
@Builder
@Jacksonized
public class WyckoffSummary {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("regime")
    Regime regime;

    /**
     * Event types detected on the snapshot date, in detection order
     */
    @JsonProperty("events_detected")
    List<WyckoffEventType> eventsDetected;

    /**
     * Highest scoring event on the snapshot date, or null
     */
    @JsonProperty("primary_event")
    WyckoffEventType primaryEvent;

    /**
     * Buying climax score of the snapshot bar, 0..max climax weight; null without enough history
     */
    @JsonProperty("bc_score")
    Double bcScore;

    /**
     * Score of a spring completed on the snapshot bar, 0 when none; null without enough history
     */
    @JsonProperty("spring_score")
    Double springScore;

    /**
     * Canonical sequences completed within the sequence window ending on the snapshot date
     */
    @JsonProperty("sequences")
    List<WyckoffSequence> sequences;
}
