package com.hive.context;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Process-local snapshot store. Snapshots are lost on restart; use a Redis-backed store across processes. */
public final class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentMap<String, SessionSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(SessionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(snapshot.getRunId(), "snapshot.runId");
        snapshots.put(snapshot.getRunId(), snapshot);
    }

    @Override
    public Optional<SessionSnapshot> find(String runId) {
        return runId == null ? Optional.empty() : Optional.ofNullable(snapshots.get(runId));
    }

    @Override
    public Optional<SessionSnapshot> take(String runId) {
        return runId == null ? Optional.empty() : Optional.ofNullable(snapshots.remove(runId));
    }

    @Override
    public boolean delete(String runId) {
        return runId != null && snapshots.remove(runId) != null;
    }

    public int size() {
        return snapshots.size();
    }
}
