package com.kotsin.structure.execution.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kotsin.structure.dealer.model.FilterConfig;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Invocation-level overrides. A null field keeps the configured default.
 */
@Value
@Builder
@Jacksonized
public class ParameterOverrides {

    public static final ParameterOverrides NONE = ParameterOverrides.builder().build();

    @JsonProperty("max_dte_days")
    Integer maxDteDays;

    @JsonProperty("min_open_interest")
    Long minOpenInterest;

    @JsonProperty("min_volume")
    Long minVolume;

    /**
     * Non-positive disables the spread filter for this run
     */
    @JsonProperty("max_spread_pct")
    Double maxSpreadPct;

    @JsonProperty("walls_top_n")
    Integer wallsTopN;

    @JsonProperty("gex_slope_range_pct")
    Double gexSlopeRangePct;

    /**
     * Explicit spot, first step of spot resolution
     */
    @JsonProperty("spot_override")
    Double spotOverride;

    /**
     * Level applied to this service's loggers for the duration of the run
     */
    @JsonProperty("log_level")
    String logLevel;

    public FilterConfig applyTo(FilterConfig defaults) {
        FilterConfig.FilterConfigBuilder builder = defaults.toBuilder();
        if (maxDteDays != null) {
            builder.maxDteDays(maxDteDays);
        }
        if (minOpenInterest != null) {
            builder.minOpenInterest(minOpenInterest);
        }
        if (minVolume != null) {
            builder.minVolume(minVolume);
        }
        if (maxSpreadPct != null) {
            builder.maxSpreadPct(maxSpreadPct);
        }
        if (wallsTopN != null) {
            builder.wallsTopN(wallsTopN);
        }
        if (gexSlopeRangePct != null) {
            builder.gexSlopeRangePct(gexSlopeRangePct);
        }
        return builder.build();
    }
}
