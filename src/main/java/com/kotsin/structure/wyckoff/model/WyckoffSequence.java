package com.kotsin.structure.wyckoff.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Completed canonical event sequence.
 */
public record WyckoffSequence(
        @JsonProperty("sequence_id") String sequenceId,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("end_date") LocalDate endDate,
        @JsonProperty("events") List<WyckoffEventType> events) {
}
