package com.kotsin.structure.execution.trigger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kotsin.structure.execution.model.ExecutionTrigger;
import com.kotsin.structure.execution.model.ParameterOverrides;

import java.time.Instant;

/**
 * Payload of the execution trigger topic.
 *
 * {"symbol":"AAPL","snapshot_time":"2024-05-01T20:00:00Z","dry_run":false,
 *  "overrides":{"min_open_interest":50},"trace_id":"ab12cd34"}
 */
public record TriggerMessage(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("snapshot_time") Instant snapshotTime,
        @JsonProperty("dry_run") boolean dryRun,
        @JsonProperty("overrides") ParameterOverrides overrides,
        @JsonProperty("trace_id") String traceId
) {

    public ExecutionTrigger.EventTrigger toTrigger() {
        return new ExecutionTrigger.EventTrigger(symbol, snapshotTime, dryRun,
                overrides != null ? overrides : ParameterOverrides.NONE, traceId);
    }
}
