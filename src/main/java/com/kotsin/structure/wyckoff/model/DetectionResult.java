package com.kotsin.structure.wyckoff.model;

import java.util.List;

/**
 * Output of one detector pass: events emitted in this pass, in date order, and the resulting state.
 */
public record DetectionResult(List<WyckoffEvent> events, RegimeState newState) {

    public DetectionResult {
        events = List.copyOf(events);
    }
}
