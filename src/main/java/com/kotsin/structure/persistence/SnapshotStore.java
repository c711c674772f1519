package com.kotsin.structure.persistence;

/**
 * Write side of the snapshot collection.
 *
 * Implementations own their retry policy. Exhausted retries surface as
 * {@link com.kotsin.structure.exception.TransientPersistenceException}; an
 * unreachable store as {@link com.kotsin.structure.exception.SystemicException}.
 */
public interface SnapshotStore {

    /**
     * Insert or replace the owned fields of the record keyed by (symbol, time).
     */
    void upsert(SnapshotRecord record);
}
