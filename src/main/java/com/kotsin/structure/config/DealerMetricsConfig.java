package com.kotsin.structure.config;

import com.kotsin.structure.dealer.model.FilterConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Dealer gamma metrics configuration.
 *
 * Everything the calculator treats as a constant lives here so the sign
 * convention, the DGPI normalisation and the quality thresholds are explicit
 * and can be changed without touching the calculator.
 */
@Configuration
@ConfigurationProperties(prefix = "dealer")
@Data
public class DealerMetricsConfig {

    /**
     * Default contract filters, overridable per invocation
     */
    private FilterDefaults filter = new FilterDefaults();

    /**
     * Per-contract exposure convention
     */
    private ExposureConfig exposure = new ExposureConfig();

    /**
     * Wall selection
     */
    private WallsConfig walls = new WallsConfig();

    /**
     * Dealer Gamma Pressure Index normalisation
     */
    private DgpiConfig dgpi = new DgpiConfig();

    /**
     * Position classification
     */
    private PositionConfig position = new PositionConfig();

    /**
     * Confidence thresholds
     */
    private ConfidenceConfig confidence = new ConfidenceConfig();

    /**
     * FULL / LIMITED eligibility thresholds
     */
    private StatusConfig status = new StatusConfig();

    /**
     * Build the immutable filter used for a run before invocation overrides are applied.
     */
    public FilterConfig defaultFilterConfig() {
        return FilterConfig.builder()
                .maxDteDays(filter.getMaxDteDays())
                .minOpenInterest(filter.getMinOpenInterest())
                .minVolume(filter.getMinVolume())
                .maxSpreadPct(filter.getMaxSpreadPct())
                .wallsTopN(filter.getWallsTopN())
                .gexSlopeRangePct(filter.getGexSlopeRangePct())
                .build();
    }

    @Data
    public static class FilterDefaults {
        /**
         * Contracts expiring later than this many days are dropped
         */
        private int maxDteDays = 90;

        private long minOpenInterest = 100;

        private long minVolume = 1;

        /**
         * Max bid/ask spread as % of mid. Null or non-positive disables the spread filter.
         */
        private Double maxSpreadPct = 10.0;

        /**
         * Number of walls kept per side
         */
        private int wallsTopN = 3;

        /**
         * Half-width of the slope window around spot, as a fraction (0.02 = +/-2%)
         */
        private double gexSlopeRangePct = 0.02;
    }

    @Data
    public static class ExposureConfig {
        /**
         * Which side carries the negative sign
         */
        private GexSignConvention signConvention = GexSignConvention.CALLS_NEGATIVE;

        /**
         * PER_CONTRACT = gamma x OI x multiplier,
         * PER_ONE_PERCENT_MOVE additionally multiplies by spot^2 x 0.01
         */
        private ExposureScaling scaling = ExposureScaling.PER_CONTRACT;

        private int contractMultiplier = 100;
    }

    @Data
    public static class WallsConfig {
        /**
         * Only strikes within this fraction of spot qualify as walls. Non-positive disables the cap.
         */
        private double maxMoneyness = 0.2;
    }

    @Data
    public static class DgpiConfig {
        /**
         * Base magnitude: sign(net) x log10(|net| + 1) x logScale
         */
        private double logScale = 10.0;

        /**
         * Slope adjustment: 1 + clamp(slope x slopeCoefficient, -maxSlopeEffect, maxSlopeEffect)
         */
        private double slopeCoefficient = 0.01;

        private double maxSlopeEffect = 0.3;

        /**
         * IV rank weight: ivRankBase + ivRank / ivRankDivisor (only when iv_rank is known)
         */
        private double ivRankBase = 0.7;

        private double ivRankDivisor = 333.0;

        /**
         * Output is clamped to [-bound, bound]
         */
        private double bound = 100.0;
    }

    @Data
    public static class PositionConfig {
        /**
         * |gex_net| below this is neutral
         */
        private double neutralThreshold = 1_000.0;
    }

    @Data
    public static class ConfidenceConfig {
        /**
         * Fewer eligible contracts than this is invalid
         */
        private int minContracts = 5;

        private int highContracts = 10;

        private long highTotalOpenInterest = 1_000;

        /**
         * Share of contracts with usable greeks required for high / medium
         */
        private double highCompleteness = 0.8;

        private double mediumCompleteness = 0.5;
    }

    @Data
    public static class StatusConfig {
        private int fullMinEligible = 25;

        private int limitedMinEligible = 1;
    }

    public enum GexSignConvention {
        /** Dealers short calls: call exposure negative, put exposure positive */
        CALLS_NEGATIVE(-1, 1),
        /** Dealers long calls: call exposure positive, put exposure negative */
        CALLS_POSITIVE(1, -1);

        private final int callSign;
        private final int putSign;

        GexSignConvention(int callSign, int putSign) {
            this.callSign = callSign;
            this.putSign = putSign;
        }

        public int callSign() {
            return callSign;
        }

        public int putSign() {
            return putSign;
        }
    }

    public enum ExposureScaling {
        PER_CONTRACT,
        PER_ONE_PERCENT_MOVE
    }
}
