package com.kotsin.structure.wyckoff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The only state carried across invocations for a symbol.
 *
 * Immutable: every change produces a new value. {@code asOf} is the trading
 * date the state was computed for and keys the stored version.
 * {@code evaluatedThrough} is the last bar the detector actually saw; the next
 * invocation only evaluates bars after it, so a bar ingested late is still
 * evaluated once it shows up.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RegimeState {

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("current_regime")
    @Builder.Default
    Regime currentRegime = Regime.UNKNOWN;

    @JsonProperty("event_history")
    @Builder.Default
    List<WyckoffEvent> eventHistory = List.of();

    @JsonProperty("transitions")
    @Builder.Default
    List<RegimeTransition> transitions = List.of();

    @JsonProperty("last_event_date")
    LocalDate lastEventDate;

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("evaluated_through")
    LocalDate evaluatedThrough;

    public static RegimeState initial(String symbol) {
        return RegimeState.builder().symbol(symbol).build();
    }

    /**
     * Events of the current continuous regime span, oldest first.
     */
    public List<WyckoffEvent> currentSpan() {
        if (currentRegime == Regime.UNKNOWN || eventHistory.isEmpty()) {
            return List.of();
        }
        int start = eventHistory.size();
        while (start > 0 && eventHistory.get(start - 1).getRegimeAfter() == currentRegime) {
            start--;
        }
        return eventHistory.subList(start, eventHistory.size());
    }

    /**
     * Most recent event of the given type in the current span, or null.
     */
    public WyckoffEvent lastInSpan(WyckoffEventType type) {
        List<WyckoffEvent> span = currentSpan();
        for (int i = span.size() - 1; i >= 0; i--) {
            if (span.get(i).getType() == type) {
                return span.get(i);
            }
        }
        return null;
    }

    public boolean spanContains(WyckoffEventType type) {
        return lastInSpan(type) != null;
    }

    /**
     * New state with the event appended and, when the regime changes, the transition recorded.
     */
    public RegimeState withEvent(WyckoffEvent event) {
        List<WyckoffEvent> history = new ArrayList<>(eventHistory);
        history.add(event);

        List<RegimeTransition> newTransitions = transitions;
        Regime next = event.getRegimeAfter();
        if (next != currentRegime) {
            newTransitions = new ArrayList<>(transitions);
            newTransitions.add(RegimeTransition.builder()
                    .from(currentRegime)
                    .to(next)
                    .date(event.getDate())
                    .triggerEvent(event.getType())
                    .build());
            newTransitions = List.copyOf(newTransitions);
        }

        return toBuilder()
                .currentRegime(next)
                .eventHistory(List.copyOf(history))
                .transitions(newTransitions)
                .lastEventDate(event.getDate())
                .build();
    }

    public RegimeState withAsOf(LocalDate date) {
        return toBuilder().asOf(date).build();
    }

    public RegimeState withEvaluatedThrough(LocalDate date) {
        return toBuilder().evaluatedThrough(date).build();
    }

    /**
     * Last bar date already evaluated. Versions written before evaluated_through
     * existed fall back to as_of.
     */
    public LocalDate lastEvaluatedDate() {
        return evaluatedThrough != null ? evaluatedThrough : asOf;
    }
}
