package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.wyckoff.model.Regime;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RegimeTracker - transition rules")
class RegimeTrackerTest {

    // ========== From Unknown ==========

    @ParameterizedTest
    @EnumSource(WyckoffEventType.class)
    @DisplayName("Unknown takes the regime of the first event")
    void testNext_FromUnknown(WyckoffEventType event) {
        assertEquals(event.getRegime(), RegimeTracker.next(Regime.UNKNOWN, event));
    }

    @Test
    @DisplayName("Null current regime behaves as Unknown")
    void testNext_NullCurrent() {
        assertEquals(Regime.DISTRIBUTION, RegimeTracker.next(null, WyckoffEventType.BC));
    }

    // ========== Cycle ==========

    @Test
    @DisplayName("Full cycle: Accumulation, Markup, Distribution, Markdown, Accumulation")
    void testNext_FullCycle() {
        Regime regime = RegimeTracker.next(Regime.UNKNOWN, WyckoffEventType.SC);
        assertEquals(Regime.ACCUMULATION, regime);

        regime = RegimeTracker.next(regime, WyckoffEventType.SOS);
        assertEquals(Regime.MARKUP, regime);

        regime = RegimeTracker.next(regime, WyckoffEventType.BC);
        assertEquals(Regime.DISTRIBUTION, regime);

        regime = RegimeTracker.next(regime, WyckoffEventType.SOW);
        assertEquals(Regime.MARKDOWN, regime);

        regime = RegimeTracker.next(regime, WyckoffEventType.SPRING);
        assertEquals(Regime.ACCUMULATION, regime);
    }

    @ParameterizedTest
    @EnumSource(value = WyckoffEventType.class, names = {"SC", "AR", "AR_TOP", "SPRING"})
    @DisplayName("Accumulation events end Markdown")
    void testNext_MarkdownToAccumulation(WyckoffEventType event) {
        assertEquals(Regime.ACCUMULATION, RegimeTracker.next(Regime.MARKDOWN, event));
    }

    // ========== Sticky ==========

    @Test
    @DisplayName("Out of sequence events leave the regime unchanged")
    void testNext_Sticky() {
        assertEquals(Regime.ACCUMULATION, RegimeTracker.next(Regime.ACCUMULATION, WyckoffEventType.SOW));
        assertEquals(Regime.ACCUMULATION, RegimeTracker.next(Regime.ACCUMULATION, WyckoffEventType.BC));
        assertEquals(Regime.MARKUP, RegimeTracker.next(Regime.MARKUP, WyckoffEventType.SC));
        assertEquals(Regime.MARKUP, RegimeTracker.next(Regime.MARKUP, WyckoffEventType.SOW));
        assertEquals(Regime.DISTRIBUTION, RegimeTracker.next(Regime.DISTRIBUTION, WyckoffEventType.SOS));
        assertEquals(Regime.DISTRIBUTION, RegimeTracker.next(Regime.DISTRIBUTION, WyckoffEventType.UT));
        assertEquals(Regime.MARKDOWN, RegimeTracker.next(Regime.MARKDOWN, WyckoffEventType.BC));
        assertEquals(Regime.MARKDOWN, RegimeTracker.next(Regime.MARKDOWN, WyckoffEventType.UT));
    }

    @Test
    @DisplayName("isTransition reports only regime changes")
    void testIsTransition() {
        assertTrue(RegimeTracker.isTransition(Regime.ACCUMULATION, WyckoffEventType.SOS));
        assertTrue(RegimeTracker.isTransition(Regime.UNKNOWN, WyckoffEventType.AR));
        assertFalse(RegimeTracker.isTransition(Regime.ACCUMULATION, WyckoffEventType.AR));
        assertFalse(RegimeTracker.isTransition(Regime.MARKUP, WyckoffEventType.SOS));
    }
}
