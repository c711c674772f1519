package com.kotsin.structure.wyckoff.model;

/**
 * Structural events and the regime each one belongs to. The mapping is fixed.
 */
public enum WyckoffEventType {
    /** Selling climax: downside exhaustion */
    SC(Regime.ACCUMULATION),
    /** Automatic rally: reflex rally off the climax */
    AR(Regime.ACCUMULATION),
    /** Test of the range ceiling */
    AR_TOP(Regime.ACCUMULATION),
    /** False breakdown below the range floor */
    SPRING(Regime.ACCUMULATION),
    /** Upthrust: false breakout above the range ceiling */
    UT(Regime.DISTRIBUTION),
    /** Sign of strength: upside confirmation */
    SOS(Regime.MARKUP),
    /** Buying climax: upside exhaustion */
    BC(Regime.DISTRIBUTION),
    /** Sign of weakness: downside confirmation */
    SOW(Regime.MARKDOWN);

    private final Regime regime;

    WyckoffEventType(Regime regime) {
        this.regime = regime;
    }

    public Regime getRegime() {
        return regime;
    }

    public boolean isAccumulationSide() {
        return regime == Regime.ACCUMULATION;
    }
}
