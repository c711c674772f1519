package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Effective contract filter for one run: configured defaults with invocation overrides applied.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FilterConfig {

    @JsonProperty("max_dte_days")
    int maxDteDays;

    @JsonProperty("min_open_interest")
    long minOpenInterest;

    @JsonProperty("min_volume")
    long minVolume;

    /**
     * Null or non-positive disables the spread filter
     */
    @JsonProperty("max_spread_pct")
    Double maxSpreadPct;

    @JsonProperty("walls_top_n")
    int wallsTopN;

    @JsonProperty("gex_slope_range_pct")
    double gexSlopeRangePct;

    @JsonIgnore
    public boolean isSpreadFilterEnabled() {
        return maxSpreadPct != null && maxSpreadPct > 0;
    }
}
