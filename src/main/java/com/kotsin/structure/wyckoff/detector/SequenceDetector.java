package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.wyckoff.model.WyckoffEvent;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;
import com.kotsin.structure.wyckoff.model.WyckoffSequence;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.kotsin.structure.wyckoff.model.WyckoffEventType.*;

/**
 * Finds completed canonical sequences in an event history.
 *
 * A sequence matches when its events occur in order (other events may sit in
 * between) and the first and last are at most {@code maxDays} calendar days apart.
 */
public final class SequenceDetector {

    static final Map<String, List<WyckoffEventType>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("SEQ_ACCUM_BREAKOUT", List.of(SC, AR, SPRING, SOS));
        PATTERNS.put("SEQ_DISTRIBUTION_TOP", List.of(BC, AR_TOP));
        PATTERNS.put("SEQ_MARKDOWN_START", List.of(BC, AR_TOP, SOW));
        PATTERNS.put("SEQ_RECOVERY", List.of(SOW, SC));
    }

    private SequenceDetector() {}

    /**
     * Sequences whose last event falls in (asOf - maxDays, asOf].
     */
    public static List<WyckoffSequence> completedAsOf(List<WyckoffEvent> history, LocalDate asOf, int maxDays) {
        List<WyckoffSequence> result = new ArrayList<>();
        for (WyckoffSequence sequence : detect(history, maxDays)) {
            long age = ChronoUnit.DAYS.between(sequence.endDate(), asOf);
            if (age >= 0 && age < maxDays) {
                result.add(sequence);
            }
        }
        return result;
    }

    public static List<WyckoffSequence> detect(List<WyckoffEvent> history, int maxDays) {
        List<WyckoffSequence> sequences = new ArrayList<>();
        for (Map.Entry<String, List<WyckoffEventType>> pattern : PATTERNS.entrySet()) {
            List<WyckoffEventType> steps = pattern.getValue();
            int lastEnd = -1;
            for (int start = 0; start < history.size(); start++) {
                if (history.get(start).getType() != steps.get(0)) {
                    continue;
                }
                int end = match(history, start, steps, maxDays);
                // One report per completing event
                if (end >= 0 && end != lastEnd) {
                    sequences.add(new WyckoffSequence(pattern.getKey(),
                            history.get(start).getDate(), history.get(end).getDate(), steps));
                    lastEnd = end;
                }
            }
        }
        return sequences;
    }

    /**
     * Index of the event completing the pattern from {@code start}, or -1.
     */
    private static int match(List<WyckoffEvent> history, int start, List<WyckoffEventType> steps, int maxDays) {
        LocalDate startDate = history.get(start).getDate();
        int step = 1;
        for (int i = start + 1; i < history.size() && step < steps.size(); i++) {
            WyckoffEvent event = history.get(i);
            if (ChronoUnit.DAYS.between(startDate, event.getDate()) > maxDays) {
                return -1;
            }
            if (event.getType() == steps.get(step)) {
                step++;
                if (step == steps.size()) {
                    return i;
                }
            }
        }
        return -1;
    }
}
