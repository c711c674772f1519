package com.kotsin.structure.execution.model;

import com.kotsin.structure.persistence.SnapshotRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one run, in scope order.
 */
@Value
@Builder
public class ExecutionResult {

    String traceId;

    ExecutionMode mode;

    Instant snapshotTime;

    boolean dryRun;

    List<SymbolOutcome> outcomes;

    long durationMs;

    public long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public long succeeded() {
        return count(OutcomeStatus.SUCCESS);
    }

    public long failed() {
        return outcomes.stream().filter(o -> o.status().isFailure()).count();
    }

    public boolean hasFailures() {
        return failed() > 0;
    }

    public Optional<SnapshotRecord> recordFor(String symbol) {
        return outcomes.stream()
                .filter(o -> o.symbol().equals(symbol) && o.record() != null)
                .map(SymbolOutcome::record)
                .findFirst();
    }
}
