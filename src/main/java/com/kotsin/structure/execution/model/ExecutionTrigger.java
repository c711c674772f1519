package com.kotsin.structure.execution.model;

import java.time.Instant;
import java.util.List;

/**
 * Where an invocation came from. Both variants resolve to the same
 * {@link ExecutionContext} and run through the same scaffold.
 */
public interface ExecutionTrigger {

    Instant snapshotTime();

    boolean dryRun();

    ParameterOverrides overrides();

    String traceId();

    /**
     * One symbol, from the trigger topic.
     */
    record EventTrigger(String symbol, Instant snapshotTime, boolean dryRun,
                        ParameterOverrides overrides, String traceId) implements ExecutionTrigger {
    }

    /**
     * Explicit symbols, or the active universe when empty, from the command line.
     */
    record BatchTrigger(List<String> symbols, Instant snapshotTime, boolean dryRun,
                        ParameterOverrides overrides, String traceId) implements ExecutionTrigger {

        public BatchTrigger {
            symbols = symbols == null ? List.of() : List.copyOf(symbols);
        }
    }
}
