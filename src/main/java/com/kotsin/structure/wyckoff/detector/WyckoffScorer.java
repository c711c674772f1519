package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.config.WyckoffConfig;
import com.kotsin.structure.util.MathUtils;

/**
 * Composite event scores: weighted sums of sub-signals normalised to [0, 1].
 * Confidence is score / maximum score of the weight group.
 */
final class WyckoffScorer {

    private WyckoffScorer() {}

    /**
     * SC (up = false) or BC (up = true). Close location and momentum count in the climax direction.
     */
    static Score climax(BarStatistics.BarContext ctx, boolean up, WyckoffConfig config) {
        WyckoffConfig.ClimaxWeights w = config.getWeights().getClimax();
        WyckoffConfig.Normalisation n = config.getNormalisation();

        double volume = ramp(ctx.volumeRatio(), n.getFullVolumeRatio());
        double range = ramp(ctx.rangeRatio(), n.getFullRangeRatio());
        double closeLocation = up ? ctx.closeLocation() : 1.0 - ctx.closeLocation();
        double directional = up ? ctx.momentumOrZero() : -ctx.momentumOrZero();
        double momentum = MathUtils.clampConfidence(MathUtils.safeDivide(Math.max(directional, 0.0), n.getFullMomentum(), 0.0));

        double score = w.getVolume() * volume
                + w.getRange() * range
                + w.getCloseLocation() * MathUtils.clampConfidence(closeLocation)
                + w.getMomentum() * momentum;
        return Score.of(score, w.max());
    }

    /**
     * SPRING / UT.
     *
     * @param penetrationPct  breach beyond the level as a fraction
     * @param breachVolumeRatio volume ratio of the breach bar
     * @param barsToRecover   0 when the breach bar itself closed back inside
     */
    static Score spring(double penetrationPct, double breachVolumeRatio, int barsToRecover, WyckoffConfig config) {
        WyckoffConfig.SpringWeights w = config.getWeights().getSpring();
        WyckoffConfig.SpringConfig s = config.getSpring();

        double penetration = 1.0 - MathUtils.safeDivide(penetrationPct, s.getMaxPenetrationPct(), 1.0);
        double volume = 1.0 - MathUtils.safeDivide(breachVolumeRatio, s.getMaxVolumeRatio(), 1.0);
        double recovery = (double) (s.getRecoveryBars() + 1 - barsToRecover) / (s.getRecoveryBars() + 1);

        double score = w.getPenetration() * MathUtils.clampConfidence(penetration)
                + w.getVolume() * MathUtils.clampConfidence(volume)
                + w.getRecovery() * MathUtils.clampConfidence(recovery);
        return Score.of(score, w.max());
    }

    /**
     * AR / AR_TOP. Both inputs already normalised to [0, 1].
     */
    static Score reaction(double strength, double closeLocation, WyckoffConfig config) {
        WyckoffConfig.ReactionWeights w = config.getWeights().getReaction();
        double score = w.getStrength() * MathUtils.clampConfidence(strength)
                + w.getCloseLocation() * MathUtils.clampConfidence(closeLocation);
        return Score.of(score, w.max());
    }

    /**
     * SOS / SOW. closeLocation already oriented in the breakout direction.
     */
    static Score breakout(double volumeRatio, double closeLocation, WyckoffConfig config) {
        WyckoffConfig.BreakoutWeights w = config.getWeights().getBreakout();
        double volume = ramp(volumeRatio, config.getNormalisation().getFullVolumeRatio());
        double score = w.getVolume() * volume + w.getCloseLocation() * MathUtils.clampConfidence(closeLocation);
        return Score.of(score, w.max());
    }

    /**
     * 0 at ratio 1 (average), 1 at the full ratio.
     */
    private static double ramp(double ratio, double fullRatio) {
        return MathUtils.clampConfidence(MathUtils.safeDivide(ratio - 1.0, fullRatio - 1.0, 0.0));
    }

    record Score(double score, double confidence) {

        static Score of(double score, double max) {
            return new Score(
                    MathUtils.roundOrNull(score, 2),
                    MathUtils.roundOrNull(MathUtils.clampConfidence(MathUtils.safeDivide(score, max, 0.0)), 4));
        }
    }
}
