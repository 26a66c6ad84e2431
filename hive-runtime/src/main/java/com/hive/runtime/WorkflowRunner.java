package com.hive.runtime;

import com.hive.context.SessionSnapshot;
import com.hive.context.SnapshotStore;
import com.hive.engine.ExecutionEngine;
import com.hive.engine.RunOptions;
import com.hive.engine.RunResult;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.validation.StructuralError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run and resume entrypoints keyed by run id. Paused runs are parked in the {@link SnapshotStore}; a resume claims
 * the snapshot exactly once, so two concurrent resumes of the same run cannot both proceed.
 * <p>
 * Asynchronous runs share a bounded pool; each run still walks its graph on a single thread.
 */
public final class WorkflowRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final ExecutionEngine engine;
    private final SnapshotStore snapshots;
    private final ExecutorService executor;

    public WorkflowRunner(ExecutionEngine engine, SnapshotStore snapshots, int threads) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), new RunThreadFactory());
    }

    public ExecutionEngine getEngine() {
        return engine;
    }

    public List<StructuralError> validate(GraphDefinition graph) {
        return engine.validate(graph);
    }

    public RunResult start(GraphDefinition graph, String goalRef, Map<String, ?> input) {
        return start(graph, goalRef, input, RunOptions.defaults());
    }

    /**
     * Runs the graph under a fresh run id (unless {@code options} names one) and parks the snapshot when it pauses.
     */
    public RunResult start(GraphDefinition graph, String goalRef, Map<String, ?> input, RunOptions options) {
        RunOptions opts = withRunId(options);
        RunResult result = engine.execute(graph, goalRef, input, opts);
        park(result);
        return result;
    }

    public RunResult resume(String runId, GraphDefinition graph, Map<String, ?> additionalInput) {
        return resume(runId, graph, additionalInput, RunOptions.defaults());
    }

    /**
     * Claims the run's snapshot and resumes it. The snapshot is put back when the resume throws (e.g. the graph
     * version no longer matches), and a new one is parked when the run pauses again.
     *
     * @throws NoSuchSessionException when nothing is parked under {@code runId}
     */
    public RunResult resume(String runId, GraphDefinition graph, Map<String, ?> additionalInput, RunOptions options) {
        SessionSnapshot snapshot = snapshots.take(runId).orElseThrow(() -> new NoSuchSessionException(runId));
        RunResult result;
        try {
            result = engine.resume(graph, snapshot, additionalInput, options);
        } catch (RuntimeException e) {
            log.warn("Resume of run {} failed; restoring snapshot at {}: {}", runId, snapshot.getPausedAt(), e.getMessage());
            snapshots.save(snapshot);
            throw e;
        }
        park(result);
        return result;
    }

    public CompletableFuture<RunResult> startAsync(GraphDefinition graph, String goalRef, Map<String, ?> input) {
        return startAsync(graph, goalRef, input, RunOptions.defaults());
    }

    public CompletableFuture<RunResult> startAsync(GraphDefinition graph, String goalRef, Map<String, ?> input,
                                                   RunOptions options) {
        return CompletableFuture.supplyAsync(() -> start(graph, goalRef, input, options), executor);
    }

    public CompletableFuture<RunResult> resumeAsync(String runId, GraphDefinition graph, Map<String, ?> additionalInput) {
        return CompletableFuture.supplyAsync(() -> resume(runId, graph, additionalInput), executor);
    }

    /** The parked snapshot of a paused run, without claiming it. */
    public Optional<SessionSnapshot> findSession(String runId) {
        return snapshots.find(runId);
    }

    /** Drops a paused run; returns false when nothing was parked under {@code runId}. */
    public boolean discardSession(String runId) {
        boolean removed = snapshots.delete(runId);
        if (removed) {
            log.info("Discarded paused run {}", runId);
        }
        return removed;
    }

    private void park(RunResult result) {
        if (result.isPaused() && result.getSnapshot() != null) {
            snapshots.save(result.getSnapshot());
            log.info("Run {} parked at {}", result.getRunId(), result.getPausedAt());
        }
    }

    private static RunOptions withRunId(RunOptions options) {
        RunOptions opts = options != null ? options : RunOptions.defaults();
        if (opts.getRunId() != null) {
            return opts;
        }
        RunOptions.Builder b = RunOptions.builder().runId(UUID.randomUUID().toString());
        if (opts.getStepBudget() != null) b.stepBudget(opts.getStepBudget());
        if (opts.getCancellationToken() != null) b.cancellationToken(opts.getCancellationToken());
        return b.build();
    }

    /** Stops accepting async runs, waits briefly for running ones, then closes the store when it holds connections. */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Async runs still active after 30s; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        if (snapshots instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close snapshot store: {}", e.getMessage(), e);
            }
        }
    }

    private static final class RunThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "hive-run-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
