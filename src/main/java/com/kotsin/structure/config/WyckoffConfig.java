package com.kotsin.structure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Wyckoff structure detection configuration.
 *
 * Sub-signal thresholds decide whether an event fires; score weights decide
 * how strong it is. The climax weights sum to 28 and the spring weights to 12
 * with the defaults below.
 */
@Configuration
@ConfigurationProperties(prefix = "wyckoff")
@Data
public class WyckoffConfig {

    /**
     * Fewer bars than this produce no events
     */
    private int minBars = 20;

    /**
     * Trailing window (excluding the current bar) for volume/range averages and support/resistance
     */
    private int lookbackBars = 20;

    /**
     * Momentum = close / close[n bars ago] - 1
     */
    private int momentumBars = 10;

    /**
     * Max calendar days between the first and last event of a sequence
     */
    private int sequenceMaxDays = 30;

    private ClimaxConfig climax = new ClimaxConfig();

    private ReactionConfig reaction = new ReactionConfig();

    private SpringConfig spring = new SpringConfig();

    private BreakoutConfig breakout = new BreakoutConfig();

    private Normalisation normalisation = new Normalisation();

    private Weights weights = new Weights();

    /**
     * SC / BC triggers
     */
    @Data
    public static class ClimaxConfig {
        private double minVolumeRatio = 2.0;

        private double minRangeRatio = 1.3;

        /**
         * |momentum| into the climax, e.g. 0.03 = 3% over momentumBars
         */
        private double minMomentum = 0.03;
    }

    /**
     * AR / AR_TOP triggers
     */
    @Data
    public static class ReactionConfig {
        /**
         * AR must come within this many bars of the climax
         */
        private int maxBarsAfterClimax = 10;

        /**
         * Close must be at least this far above the SC low
         */
        private double minRallyPct = 0.03;

        /**
         * AR_TOP needs at least this many bars after the reference event
         */
        private int minBarsAfterReference = 2;

        /**
         * High within this fraction below the ceiling counts as a test
         */
        private double ceilingTolerancePct = 0.01;

        private double maxTestCloseLocation = 0.5;
    }

    /**
     * SPRING / UT triggers
     */
    @Data
    public static class SpringConfig {
        /**
         * Max breach beyond the climax level, as a fraction
         */
        private double maxPenetrationPct = 0.05;

        /**
         * Breach bar volume ratio must not exceed this
         */
        private double maxVolumeRatio = 1.0;

        /**
         * Close must be back inside the range within this many bars of the breach
         */
        private int recoveryBars = 3;
    }

    /**
     * SOS / SOW triggers
     */
    @Data
    public static class BreakoutConfig {
        private double minVolumeRatio = 1.5;

        private double sosMinCloseLocation = 0.6;

        private double sowMaxCloseLocation = 0.4;
    }

    /**
     * Values at which a sub-signal scores its full weight
     */
    @Data
    public static class Normalisation {
        private double fullVolumeRatio = 3.0;

        private double fullRangeRatio = 2.0;

        private double fullMomentum = 0.10;

        /**
         * Rally of this multiple of minRallyPct scores the full AR strength
         */
        private double fullRallyMultiple = 3.0;
    }

    @Data
    public static class Weights {
        /**
         * SC / BC, max 28
         */
        private ClimaxWeights climax = new ClimaxWeights();

        /**
         * SPRING / UT, max 12
         */
        private SpringWeights spring = new SpringWeights();

        /**
         * AR / AR_TOP
         */
        private ReactionWeights reaction = new ReactionWeights();

        /**
         * SOS / SOW
         */
        private BreakoutWeights breakout = new BreakoutWeights();
    }

    @Data
    public static class ClimaxWeights {
        private double volume = 10.0;
        private double range = 6.0;
        private double closeLocation = 6.0;
        private double momentum = 6.0;

        public double max() {
            return volume + range + closeLocation + momentum;
        }
    }

    @Data
    public static class SpringWeights {
        private double penetration = 4.0;
        private double volume = 4.0;
        private double recovery = 4.0;

        public double max() {
            return penetration + volume + recovery;
        }
    }

    @Data
    public static class ReactionWeights {
        private double strength = 6.0;
        private double closeLocation = 6.0;

        public double max() {
            return strength + closeLocation;
        }
    }

    @Data
    public static class BreakoutWeights {
        private double volume = 6.0;
        private double closeLocation = 6.0;

        public double max() {
            return volume + closeLocation;
        }
    }
}
