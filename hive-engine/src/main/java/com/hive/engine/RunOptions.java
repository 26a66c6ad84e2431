package com.hive.engine;

import java.util.Objects;

/**
 * Per-run overrides: run id, step budget and cancellation token.
 */
public final class RunOptions {

    private static final RunOptions DEFAULTS = new Builder().build();

    private final String runId;
    private final Integer stepBudget;
    private final CancellationToken cancellationToken;

    private RunOptions(Builder builder) {
        this.runId = builder.runId;
        this.stepBudget = builder.stepBudget;
        this.cancellationToken = builder.cancellationToken;
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Caller-chosen run id, or null to generate one. */
    public String getRunId() {
        return runId;
    }

    /** Overrides {@link EngineSettings#getStepBudget()} when non-null. */
    public Integer getStepBudget() {
        return stepBudget;
    }

    /** Null means the run cannot be cancelled. */
    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public static final class Builder {
        private String runId;
        private Integer stepBudget;
        private CancellationToken cancellationToken;

        private Builder() {
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder stepBudget(int stepBudget) {
            if (stepBudget <= 0) throw new IllegalArgumentException("stepBudget must be positive, got " + stepBudget);
            this.stepBudget = stepBudget;
            return this;
        }

        public Builder cancellationToken(CancellationToken token) {
            this.cancellationToken = Objects.requireNonNull(token, "token");
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
