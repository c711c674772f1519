package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.wyckoff.model.Regime;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;

/**
 * Regime transition rules. Regimes are sticky: only the events below move them.
 *
 *   Unknown        -> regime of the first event
 *   SOS            : Accumulation -> Markup
 *   BC             : Markup -> Distribution
 *   SOW            : Distribution -> Markdown
 *   SC/AR/AR_TOP/SPRING : Markdown -> Accumulation
 *
 * Any other combination leaves the regime unchanged.
 */
public final class RegimeTracker {

    private RegimeTracker() {}

    public static Regime next(Regime current, WyckoffEventType event) {
        if (current == null || current == Regime.UNKNOWN) {
            return event.getRegime();
        }
        switch (event) {
            case SOS:
                return current == Regime.ACCUMULATION ? Regime.MARKUP : current;
            case BC:
                return current == Regime.MARKUP ? Regime.DISTRIBUTION : current;
            case SOW:
                return current == Regime.DISTRIBUTION ? Regime.MARKDOWN : current;
            case SC:
            case AR:
            case AR_TOP:
            case SPRING:
                return current == Regime.MARKDOWN ? Regime.ACCUMULATION : current;
            default:
                return current;
        }
    }

    public static boolean isTransition(Regime current, WyckoffEventType event) {
        return next(current, event) != current;
    }
}
