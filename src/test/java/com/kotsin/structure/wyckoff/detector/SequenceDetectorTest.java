package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.wyckoff.model.WyckoffEvent;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;
import com.kotsin.structure.wyckoff.model.WyckoffSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static com.kotsin.structure.wyckoff.model.WyckoffEventType.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SequenceDetector")
class SequenceDetectorTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);
    private static final int MAX_DAYS = 30;

    // ========== Matching ==========

    @Test
    @DisplayName("SC, AR, SPRING, SOS within 30 days completes the accumulation breakout")
    void testDetect_AccumulationBreakout() {
        List<WyckoffEvent> history = List.of(
                event(SC, 0), event(AR, 2), event(SPRING, 12), event(SOS, 20));

        List<WyckoffSequence> sequences = SequenceDetector.detect(history, MAX_DAYS);

        assertEquals(1, sequences.size());
        WyckoffSequence seq = sequences.get(0);
        assertEquals("SEQ_ACCUM_BREAKOUT", seq.sequenceId());
        assertEquals(START, seq.startDate());
        assertEquals(START.plusDays(20), seq.endDate());
        assertEquals(List.of(SC, AR, SPRING, SOS), seq.events());
    }

    @Test
    @DisplayName("Sequence spanning more than 30 days is not reported")
    void testDetect_TooLong() {
        List<WyckoffEvent> history = List.of(
                event(SC, 0), event(AR, 2), event(SPRING, 12), event(SOS, 31));

        assertTrue(SequenceDetector.detect(history, MAX_DAYS).isEmpty());
    }

    @Test
    @DisplayName("Exactly 30 days apart still matches")
    void testDetect_Boundary() {
        List<WyckoffEvent> history = List.of(
                event(SC, 0), event(AR, 2), event(SPRING, 12), event(SOS, 30));

        assertEquals(1, SequenceDetector.detect(history, MAX_DAYS).size());
    }

    @Test
    @DisplayName("Unrelated events in between do not break the sequence")
    void testDetect_Interleaved() {
        List<WyckoffEvent> history = List.of(
                event(SC, 0), event(SOW, 1), event(AR, 3), event(AR_TOP, 8), event(SPRING, 12), event(SOS, 15));

        assertEquals(List.of("SEQ_ACCUM_BREAKOUT"), ids(SequenceDetector.detect(history, MAX_DAYS)));
    }

    @Test
    @DisplayName("Out of order events do not match")
    void testDetect_WrongOrder() {
        List<WyckoffEvent> history = List.of(
                event(AR, 0), event(SC, 2), event(SOS, 5), event(SPRING, 8));

        assertTrue(SequenceDetector.detect(history, MAX_DAYS).isEmpty());
    }

    @Test
    @DisplayName("Distribution top and markdown start share their prefix")
    void testDetect_DistributionPatterns() {
        List<WyckoffEvent> history = List.of(event(BC, 0), event(AR_TOP, 5), event(SOW, 9));

        List<WyckoffSequence> sequences = SequenceDetector.detect(history, MAX_DAYS);

        assertEquals(List.of("SEQ_DISTRIBUTION_TOP", "SEQ_MARKDOWN_START"), ids(sequences));
        assertEquals(START.plusDays(5), sequences.get(0).endDate());
        assertEquals(START.plusDays(9), sequences.get(1).endDate());
    }

    @Test
    @DisplayName("SOW followed by SC is a recovery")
    void testDetect_Recovery() {
        List<WyckoffEvent> history = List.of(event(SOW, 0), event(SC, 4));

        assertEquals(List.of("SEQ_RECOVERY"), ids(SequenceDetector.detect(history, MAX_DAYS)));
    }

    @Test
    @DisplayName("Several starts completing on the same event report once")
    void testDetect_OneReportPerCompletion() {
        List<WyckoffEvent> history = List.of(event(BC, 0), event(BC, 2), event(AR_TOP, 5));

        List<WyckoffSequence> sequences = SequenceDetector.detect(history, MAX_DAYS);

        assertEquals(List.of("SEQ_DISTRIBUTION_TOP"), ids(sequences));
        assertEquals(START, sequences.get(0).startDate());
    }

    @Test
    @DisplayName("Empty history has no sequences")
    void testDetect_Empty() {
        assertTrue(SequenceDetector.detect(List.of(), MAX_DAYS).isEmpty());
    }

    // ========== completedAsOf ==========

    @Test
    @DisplayName("completedAsOf keeps sequences ending within the window before the date")
    void testCompletedAsOf_Window() {
        List<WyckoffEvent> history = List.of(event(BC, 0), event(AR_TOP, 5));
        LocalDate end = START.plusDays(5);

        assertEquals(1, SequenceDetector.completedAsOf(history, end, MAX_DAYS).size());
        assertEquals(1, SequenceDetector.completedAsOf(history, end.plusDays(29), MAX_DAYS).size());
        assertTrue(SequenceDetector.completedAsOf(history, end.plusDays(30), MAX_DAYS).isEmpty());
        assertTrue(SequenceDetector.completedAsOf(history, end.minusDays(1), MAX_DAYS).isEmpty());
    }

    // ========== Helpers ==========

    private static WyckoffEvent event(WyckoffEventType type, int dayOffset) {
        return WyckoffEvent.builder()
                .symbol("QQQ")
                .date(START.plusDays(dayOffset))
                .type(type)
                .regimeAfter(type.getRegime())
                .build();
    }

    private static List<String> ids(List<WyckoffSequence> sequences) {
        return sequences.stream().map(WyckoffSequence::sequenceId).collect(Collectors.toList());
    }
}
