package com.hive.context;

import java.util.Optional;

/**
 * Persistence for paused runs, keyed by run id. Implementations must be safe for concurrent use by
 * independent runs.
 */
public interface SnapshotStore {

    /** Stores (or replaces) the snapshot under its run id. */
    void save(SessionSnapshot snapshot);

    /** Reads without consuming. */
    Optional<SessionSnapshot> find(String runId);

    /**
     * Atomically removes and returns the snapshot, so that at most one resume can claim it.
     */
    Optional<SessionSnapshot> take(String runId);

    /** @return true when a snapshot was removed */
    boolean delete(String runId);
}
