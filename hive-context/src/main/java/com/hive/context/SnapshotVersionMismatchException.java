package com.hive.context;

/**
 * Thrown when a session snapshot is resumed against a graph whose name or version differs from the one that
 * produced it. The resume fails; there is no fallback to another version.
 */
public final class SnapshotVersionMismatchException extends RuntimeException {

    private final String snapshotGraph;
    private final String providedGraph;

    public SnapshotVersionMismatchException(String snapshotGraph, String providedGraph) {
        super(String.format("Snapshot graph mismatch: snapshot=%s, provided=%s", snapshotGraph, providedGraph));
        this.snapshotGraph = snapshotGraph;
        this.providedGraph = providedGraph;
    }

    /** {@code name@version} recorded in the snapshot. */
    public String getSnapshotGraph() {
        return snapshotGraph;
    }

    /** {@code name@version} of the graph passed to resume. */
    public String getProvidedGraph() {
        return providedGraph;
    }
}
