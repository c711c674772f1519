package com.kotsin.structure.wyckoff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Raw sub-signals of the bar an event was detected on.
 */
@Value
@Builder
@Jacksonized
public class VolumeContext {

    /**
     * Bar volume / trailing average volume
     */
    @JsonProperty("volume_ratio")
    Double volumeRatio;

    /**
     * Bar range / trailing average range
     */
    @JsonProperty("range_ratio")
    Double rangeRatio;

    @JsonProperty("close_location")
    Double closeLocation;

    /**
     * close / close[momentum-bars ago] - 1
     */
    @JsonProperty("momentum")
    Double momentum;

    @JsonProperty("volume")
    long volume;

    @JsonProperty("average_volume")
    Double averageVolume;
}
