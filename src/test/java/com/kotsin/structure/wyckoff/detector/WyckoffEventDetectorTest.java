package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.config.WyckoffConfig;
import com.kotsin.structure.exception.ValidationException;
import com.kotsin.structure.wyckoff.model.DetectionResult;
import com.kotsin.structure.wyckoff.model.OhlcvBar;
import com.kotsin.structure.wyckoff.model.Regime;
import com.kotsin.structure.wyckoff.model.RegimeState;
import com.kotsin.structure.wyckoff.model.WyckoffEvent;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.kotsin.structure.wyckoff.detector.WyckoffBars.accumulation;
import static com.kotsin.structure.wyckoff.detector.WyckoffBars.bar;
import static com.kotsin.structure.wyckoff.detector.WyckoffBars.day;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Detector behaviour on the {@link WyckoffBars#accumulation()} history.
 */
@DisplayName("WyckoffEventDetector")
class WyckoffEventDetectorTest {

    private static final String SYMBOL = "SPY";

    private WyckoffEventDetector detector;
    private WyckoffConfig config;

    @BeforeEach
    void setUp() {
        detector = new WyckoffEventDetector();
        config = new WyckoffConfig();
    }

    // ========== Event detection ==========

    @Test
    @DisplayName("Decline, climax, rally and spring produce SC, AR, SPRING in order")
    void testDetect_ClimaxRallySpring() {
        DetectionResult result = detector.detect(accumulation(), RegimeState.initial(SYMBOL), config);

        assertEquals(List.of(WyckoffEventType.SC, WyckoffEventType.AR, WyckoffEventType.SPRING), types(result.events()));

        WyckoffEvent sc = result.events().get(0);
        assertEquals(day(25), sc.getDate());
        assertEquals(101.0, sc.getPriceLevel(), 1e-9);
        assertEquals(Regime.ACCUMULATION, sc.getRegimeAfter());
        assertEquals(SYMBOL, sc.getSymbol());

        WyckoffEvent ar = result.events().get(1);
        assertEquals(day(26), ar.getDate());
        assertEquals(106.5, ar.getPriceLevel(), 1e-9);
    }

    @Test
    @DisplayName("Spring is dated on the recovery bar and priced at the breach low")
    void testDetect_SpringDating() {
        DetectionResult result = detector.detect(accumulation(), RegimeState.initial(SYMBOL), config);

        WyckoffEvent spring = result.events().get(2);
        assertEquals(WyckoffEventType.SPRING, spring.getType());
        assertEquals(day(31), spring.getDate());
        assertEquals(100.2, spring.getPriceLevel(), 1e-9);
        // penetration 3.37 + volume 1.70 + recovery 3.00 out of 12
        assertEquals(8.07, spring.getScore(), 0.02);
        assertEquals(spring.getScore() / 12.0, spring.getConfidence(), 0.001);
    }

    @Test
    @DisplayName("Climax score stays within the climax weight maximum")
    void testDetect_ScoreBounds() {
        DetectionResult result = detector.detect(accumulation(), RegimeState.initial(SYMBOL), config);

        WyckoffEvent sc = result.events().get(0);
        assertTrue(sc.getScore() > 0 && sc.getScore() <= 28.0);
        assertTrue(sc.getConfidence() > 0 && sc.getConfidence() <= 1.0);
        assertNotNull(sc.getVolumeContext());
        assertEquals(3_000_000L, sc.getVolumeContext().getVolume());
    }

    @Test
    @DisplayName("Resulting state is Accumulation, evaluated through the last bar date")
    void testDetect_NewState() {
        DetectionResult result = detector.detect(accumulation(), RegimeState.initial(SYMBOL), config);
        RegimeState state = result.newState();

        assertEquals(Regime.ACCUMULATION, state.getCurrentRegime());
        assertEquals(3, state.getEventHistory().size());
        assertEquals(day(31), state.getEvaluatedThrough());
        assertEquals(day(31), state.getLastEventDate());
        assertEquals(1, state.getTransitions().size());
        assertEquals(Regime.UNKNOWN, state.getTransitions().get(0).getFrom());
        assertEquals(WyckoffEventType.SC, state.getTransitions().get(0).getTriggerEvent());
    }

    @Test
    @DisplayName("A second climax in the same span is suppressed; the breakdown reads as SOW")
    void testDetect_DuplicateClimaxSuppressed() {
        List<OhlcvBar> bars = accumulation();
        bars.add(bar(32, 103.0, 103.2, 95.0, 96.0, 4_000_000));

        DetectionResult result = detector.detect(bars, RegimeState.initial(SYMBOL), config);

        assertEquals(List.of(WyckoffEventType.SC, WyckoffEventType.AR, WyckoffEventType.SPRING, WyckoffEventType.SOW),
                types(result.events()));
        // SOW only moves Distribution to Markdown
        assertEquals(Regime.ACCUMULATION, result.newState().getCurrentRegime());
    }

    @Test
    @DisplayName("A climax already in history is detected again once Markdown ends the earlier span")
    void testDetect_ClimaxAllowedInNewSpan() {
        RegimeState markdown = RegimeState.initial(SYMBOL);
        LocalDate date = day(-40);
        for (WyckoffEventType type : List.of(WyckoffEventType.SC, WyckoffEventType.SOS,
                WyckoffEventType.BC, WyckoffEventType.SOW)) {
            markdown = markdown.withEvent(WyckoffEvent.builder()
                    .symbol(SYMBOL)
                    .date(date)
                    .type(type)
                    .priceLevel(110.0)
                    .regimeAfter(RegimeTracker.next(markdown.getCurrentRegime(), type))
                    .build());
            date = date.plusDays(1);
        }
        markdown = markdown.withEvaluatedThrough(day(24));
        assertEquals(Regime.MARKDOWN, markdown.getCurrentRegime());

        DetectionResult result = detector.detect(accumulation(), markdown, config);

        assertEquals(List.of(WyckoffEventType.SC, WyckoffEventType.AR, WyckoffEventType.SPRING), types(result.events()));
        assertEquals(Regime.ACCUMULATION, result.newState().getCurrentRegime());
        assertEquals(Regime.MARKDOWN, result.newState().getTransitions().get(4).getFrom());
        assertEquals(day(25), result.newState().getTransitions().get(4).getDate());
    }

    // ========== Incremental state ==========

    @Test
    @DisplayName("Re-running with the resulting state emits nothing and leaves the state unchanged")
    void testDetect_Idempotent() {
        List<OhlcvBar> bars = accumulation();
        DetectionResult first = detector.detect(bars, RegimeState.initial(SYMBOL), config);

        DetectionResult second = detector.detect(bars, first.newState(), config);

        assertTrue(second.events().isEmpty());
        assertEquals(first.newState(), second.newState());
    }

    @Test
    @DisplayName("Two incremental passes emit the same events as one pass")
    void testDetect_Incremental() {
        List<OhlcvBar> all = accumulation();
        List<OhlcvBar> throughBreach = new ArrayList<>(all.subList(0, 31));

        DetectionResult first = detector.detect(throughBreach, RegimeState.initial(SYMBOL), config);
        assertEquals(List.of(WyckoffEventType.SC, WyckoffEventType.AR), types(first.events()));
        assertEquals(day(30), first.newState().getEvaluatedThrough());

        DetectionResult second = detector.detect(all, first.newState(), config);
        assertEquals(List.of(WyckoffEventType.SPRING), types(second.events()));

        DetectionResult single = detector.detect(all, RegimeState.initial(SYMBOL), config);
        assertEquals(single.newState().getEventHistory(), second.newState().getEventHistory());
        assertEquals(single.newState().getCurrentRegime(), second.newState().getCurrentRegime());
    }

    @Test
    @DisplayName("Detector advances evaluated_through and leaves the as_of version key alone")
    void testDetect_AsOfUntouched() {
        RegimeState prior = RegimeState.initial(SYMBOL).withEvaluatedThrough(day(29)).withAsOf(day(30));

        DetectionResult result = detector.detect(accumulation(), prior, config);

        assertEquals(day(30), result.newState().getAsOf());
        assertEquals(day(31), result.newState().getEvaluatedThrough());
    }

    @Test
    @DisplayName("State without evaluated_through skips bars through its as_of")
    void testDetect_LegacyStateFallsBackToAsOf() {
        RegimeState prior = RegimeState.initial(SYMBOL).withAsOf(day(30));

        DetectionResult result = detector.detect(accumulation(), prior, config);

        // only day 31 is evaluated and a spring needs the climax in its span
        assertTrue(result.events().isEmpty());
        assertEquals(day(31), result.newState().getEvaluatedThrough());
        assertEquals(day(30), result.newState().getAsOf());
    }

    @Test
    @DisplayName("Prior state is not modified")
    void testDetect_PriorStateUntouched() {
        RegimeState prior = RegimeState.initial(SYMBOL);

        detector.detect(accumulation(), prior, config);

        assertEquals(Regime.UNKNOWN, prior.getCurrentRegime());
        assertTrue(prior.getEventHistory().isEmpty());
        assertNull(prior.getEvaluatedThrough());
    }

    // ========== Edge cases ==========

    @Test
    @DisplayName("Fewer bars than the minimum returns the prior state without events")
    void testDetect_InsufficientHistory() {
        List<OhlcvBar> bars = new ArrayList<>(accumulation().subList(0, 19));
        RegimeState prior = RegimeState.initial(SYMBOL);

        DetectionResult result = detector.detect(bars, prior, config);

        assertTrue(result.events().isEmpty());
        assertSame(prior, result.newState());
    }

    @Test
    @DisplayName("Empty history returns the prior state")
    void testDetect_Empty() {
        RegimeState prior = RegimeState.initial(SYMBOL);

        DetectionResult result = detector.detect(List.of(), prior, config);

        assertTrue(result.events().isEmpty());
        assertSame(prior, result.newState());
    }

    @Test
    @DisplayName("Flat market produces no events")
    void testDetect_FlatMarket() {
        List<OhlcvBar> bars = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            bars.add(bar(i, 100.0, 100.5, 99.5, 100.0, 1_000_000));
        }

        DetectionResult result = detector.detect(bars, RegimeState.initial(SYMBOL), config);

        assertTrue(result.events().isEmpty());
        assertEquals(Regime.UNKNOWN, result.newState().getCurrentRegime());
        assertEquals(day(39), result.newState().getEvaluatedThrough());
    }

    @Test
    @DisplayName("Out of order bars are rejected")
    void testDetect_NonMonotonic() {
        List<OhlcvBar> bars = accumulation();
        OhlcvBar moved = bars.remove(10);
        bars.add(moved);

        assertThrows(ValidationException.class,
                () -> detector.detect(bars, RegimeState.initial(SYMBOL), config));
    }

    @Test
    @DisplayName("Duplicate dates are rejected")
    void testDetect_DuplicateDate() {
        List<OhlcvBar> bars = accumulation();
        bars.add(bars.get(bars.size() - 1));

        ValidationException e = assertThrows(ValidationException.class,
                () -> detector.detect(bars, RegimeState.initial(SYMBOL), config));
        assertTrue(e.getMessage().contains(SYMBOL));
    }

    @Test
    @DisplayName("Missing prior state is rejected")
    void testDetect_NullPrior() {
        assertThrows(ValidationException.class, () -> detector.detect(accumulation(), null, config));
    }

    private static List<WyckoffEventType> types(List<WyckoffEvent> events) {
        return events.stream().map(WyckoffEvent::getType).collect(Collectors.toList());
    }
}
