package com.kotsin.structure.persistence;

import com.kotsin.structure.wyckoff.model.RegimeState;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Versioned regime state, one entry per (symbol, as_of).
 *
 * Reading the latest version strictly before the run date keeps re-runs of the
 * same date independent of what that run wrote earlier.
 */
public interface RegimeStateStore {

    Optional<RegimeState> findLatestBefore(String symbol, LocalDate date);

    /**
     * Insert or replace the version keyed by (state.symbol, state.asOf).
     */
    void save(RegimeState state);
}
