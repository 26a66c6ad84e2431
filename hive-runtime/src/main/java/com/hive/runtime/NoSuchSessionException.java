package com.hive.runtime;

/**
 * Thrown when a resume names a run id with no stored snapshot: never paused, already resumed, or expired.
 */
public final class NoSuchSessionException extends RuntimeException {

    private final String runId;

    public NoSuchSessionException(String runId) {
        super("No paused session for run " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
