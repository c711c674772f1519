package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-reason rejection counts of the contract filter. Each contract is counted
 * once, under the first rule it fails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterStats {

    @JsonProperty("total")
    private int total;

    @JsonProperty("expired")
    private int expired;

    @JsonProperty("dte_exceeded")
    private int dteExceeded;

    @JsonProperty("missing_gamma")
    private int missingGamma;

    @JsonProperty("low_open_interest")
    private int lowOpenInterest;

    @JsonProperty("low_volume")
    private int lowVolume;

    @JsonProperty("wide_spread")
    private int wideSpread;

    @JsonProperty("other")
    private int other;

    public int rejected() {
        return expired + dteExceeded + missingGamma + lowOpenInterest + lowVolume + wideSpread + other;
    }
}
