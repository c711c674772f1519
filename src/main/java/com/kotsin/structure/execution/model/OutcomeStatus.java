package com.kotsin.structure.execution.model;

public enum OutcomeStatus {
    SUCCESS,
    FAILED,
    TIMED_OUT,
    /** No bars and no option rows for the symbol; nothing computed or written */
    SKIPPED_NO_HISTORY;

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
