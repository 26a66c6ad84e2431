package com.hive.engine;

import com.hive.context.SessionSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@code execute} or {@code resume}. Exactly one of {@link #getOutput()} (SUCCEEDED),
 * {@link #getPausedAt()} (PAUSED) or {@link #getError()} (FAILED, BUDGET_EXCEEDED) is meaningful.
 * {@link #getFinalContext()} is always populated for diagnostics.
 */
public final class RunResult {

    private final String runId;
    private final String graphName;
    private final String graphVersion;
    private final String goalRef;
    private final RunStatus status;
    private final int stepsExecuted;
    private final Map<String, Object> output;
    private final Map<String, Object> finalContext;
    private final RunError error;
    private final SessionSnapshot snapshot;
    private final List<String> visitedNodes;
    private final ExecutionMode mode;

    RunResult(String runId, String graphName, String graphVersion, String goalRef, RunStatus status,
              int stepsExecuted, Map<String, Object> output, Map<String, Object> finalContext, RunError error,
              SessionSnapshot snapshot, List<String> visitedNodes, ExecutionMode mode) {
        this.runId = runId;
        this.graphName = graphName;
        this.graphVersion = graphVersion;
        this.goalRef = goalRef;
        this.status = status;
        this.stepsExecuted = stepsExecuted;
        this.output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : null;
        this.finalContext = finalContext != null ? Collections.unmodifiableMap(new LinkedHashMap<>(finalContext)) : Map.of();
        this.error = error;
        this.snapshot = snapshot;
        this.visitedNodes = visitedNodes != null ? List.copyOf(visitedNodes) : List.of();
        this.mode = mode != null ? mode : ExecutionMode.LIVE;
    }

    public String getRunId() {
        return runId;
    }

    public String getGraphName() {
        return graphName;
    }

    public String getGraphVersion() {
        return graphVersion;
    }

    public String getGoalRef() {
        return goalRef;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getStepsExecuted() {
        return stepsExecuted;
    }

    /** Output mapping; null unless {@link RunStatus#SUCCEEDED}. */
    public Map<String, Object> getOutput() {
        return output;
    }

    public Map<String, Object> getFinalContext() {
        return finalContext;
    }

    /** Null for SUCCEEDED and PAUSED. */
    public RunError getError() {
        return error;
    }

    /** Node the run suspended before; null unless {@link RunStatus#PAUSED}. */
    public String getPausedAt() {
        return snapshot != null ? snapshot.getPausedAt() : null;
    }

    /** Snapshot to persist and hand to resume; null unless {@link RunStatus#PAUSED}. */
    public SessionSnapshot getSnapshot() {
        return snapshot;
    }

    /** Invoked node ids in order, across pause and resume. */
    public List<String> getVisitedNodes() {
        return visitedNodes;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    /** True when model and tool outcomes were canned; such results say nothing about real behavior. */
    public boolean isMock() {
        return mode == ExecutionMode.MOCK;
    }

    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    public boolean isPaused() {
        return status == RunStatus.PAUSED;
    }

    @Override
    public String toString() {
        return "RunResult{runId=" + runId + ", status=" + status + ", steps=" + stepsExecuted
                + (error != null ? ", error=" + error : "")
                + (snapshot != null ? ", pausedAt=" + snapshot.getPausedAt() : "")
                + (isMock() ? ", mock" : "") + "}";
    }
}
