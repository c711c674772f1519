package com.kotsin.structure.dealer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.kotsin.structure.options.model.SpotResolution;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Dealer gamma exposure metrics for one symbol and snapshot.
 *
 * Every property is always serialised; unavailable values are written as
 * explicit nulls. Instances are replaced, never mutated.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonPropertyOrder(alphabetic = true)
public class DealerMetrics {

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("snapshot_time")
    Instant snapshotTime;

    /**
     * Time of the option rows used, at or before the snapshot time
     */
    @JsonProperty("options_time")
    Instant optionsTime;

    @JsonProperty("trading_date")
    LocalDate tradingDate;

    // ---- spot ----

    @JsonProperty("spot_price")
    Double spotPrice;

    @JsonProperty("spot_price_source")
    String spotPriceSource;

    @JsonProperty("spot_resolution_strategy")
    SpotResolution.Strategy spotResolutionStrategy;

    @JsonProperty("spot_attempted_sources")
    List<String> spotAttemptedSources;

    // ---- exposure ----

    @JsonProperty("gex_total")
    Double gexTotal;

    @JsonProperty("gex_net")
    Double gexNet;

    @JsonProperty("gamma_flip")
    Double gammaFlip;

    @JsonProperty("call_walls")
    List<GammaWall> callWalls;

    @JsonProperty("put_walls")
    List<GammaWall> putWalls;

    @JsonProperty("gex_slope")
    Double gexSlope;

    @JsonProperty("dgpi")
    Double dgpi;

    @JsonProperty("strike_gex")
    List<StrikeExposure> strikeGex;

    @JsonProperty("iv_rank")
    Double ivRank;

    // ---- quality ----

    @JsonProperty("position")
    DealerPosition position;

    @JsonProperty("confidence")
    DealerConfidence confidence;

    @JsonProperty("data_completeness")
    Double dataCompleteness;

    @JsonProperty("status")
    DealerStatus status;

    @JsonProperty("status_reason")
    StatusReason statusReason;

    @JsonProperty("processing_status")
    ProcessingStatus processingStatus;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("diagnostics")
    List<String> diagnostics;

    @JsonProperty("eligible_options_count")
    int eligibleOptionsCount;

    @JsonProperty("total_options_count")
    int totalOptionsCount;

    @JsonProperty("filter_stats")
    FilterStats filterStats;

    @JsonProperty("filters")
    FilterConfig filters;

    /**
     * Primary call wall (index 0) or null
     */
    public GammaWall primaryCallWall() {
        return callWalls == null || callWalls.isEmpty() ? null : callWalls.get(0);
    }

    /**
     * Primary put wall (index 0) or null
     */
    public GammaWall primaryPutWall() {
        return putWalls == null || putWalls.isEmpty() ? null : putWalls.get(0);
    }
}
