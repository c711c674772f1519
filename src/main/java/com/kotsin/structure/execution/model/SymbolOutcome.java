package com.kotsin.structure.execution.model;

import com.kotsin.structure.persistence.SnapshotRecord;

/**
 * Result for one symbol of a run.
 *
 * @param record computed record, present for SUCCESS (also in dry-run)
 * @param error  failure message for FAILED and TIMED_OUT
 */
public record SymbolOutcome(String symbol, OutcomeStatus status, SnapshotRecord record, String error) {

    public static SymbolOutcome success(String symbol, SnapshotRecord record) {
        return new SymbolOutcome(symbol, OutcomeStatus.SUCCESS, record, null);
    }

    public static SymbolOutcome skipped(String symbol) {
        return new SymbolOutcome(symbol, OutcomeStatus.SKIPPED_NO_HISTORY, null, null);
    }

    public static SymbolOutcome failed(String symbol, String error) {
        return new SymbolOutcome(symbol, OutcomeStatus.FAILED, null, error);
    }

    public static SymbolOutcome timedOut(String symbol, long timeoutSeconds) {
        return new SymbolOutcome(symbol, OutcomeStatus.TIMED_OUT, null, "timed out after " + timeoutSeconds + "s");
    }
}
