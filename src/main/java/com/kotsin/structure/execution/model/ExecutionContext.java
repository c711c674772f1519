package com.kotsin.structure.execution.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One invocation: built from a trigger, validated before any work, discarded afterwards.
 *
 * Fields are nullable so a malformed context can be represented and rejected
 * by the validator rather than failing during construction.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionContext {

    ExecutionMode mode;

    /**
     * Upper-case, de-duplicated, sorted
     */
    List<String> scope;

    Instant snapshotTime;

    boolean dryRun;

    @Builder.Default
    ParameterOverrides overrides = ParameterOverrides.NONE;

    String traceId;
}
