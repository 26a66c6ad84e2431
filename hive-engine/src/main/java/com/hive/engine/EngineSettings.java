package com.hive.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine-wide settings. The step budget has no default: every deployment must choose one.
 */
public final class EngineSettings {

    private final int stepBudget;
    private final Duration nodeTimeout;
    private final RetryPolicy retryPolicy;
    private final ExecutionMode mode;

    private EngineSettings(Builder builder) {
        this.stepBudget = builder.stepBudget;
        this.nodeTimeout = builder.nodeTimeout;
        this.retryPolicy = builder.retryPolicy;
        this.mode = builder.mode;
    }

    /**
     * @param stepBudget maximum node visits per run; must be positive
     */
    public static Builder builder(int stepBudget) {
        return new Builder(stepBudget);
    }

    public int getStepBudget() {
        return stepBudget;
    }

    /** Default per-invocation timeout for model/tool calls; null means wait indefinitely. */
    public Duration getNodeTimeout() {
        return nodeTimeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public static final class Builder {
        private final int stepBudget;
        private Duration nodeTimeout;
        private RetryPolicy retryPolicy = RetryPolicy.immediate();
        private ExecutionMode mode = ExecutionMode.LIVE;

        private Builder(int stepBudget) {
            if (stepBudget <= 0) {
                throw new IllegalArgumentException("stepBudget must be positive, got " + stepBudget);
            }
            this.stepBudget = stepBudget;
        }

        public Builder nodeTimeout(Duration nodeTimeout) {
            if (nodeTimeout != null && (nodeTimeout.isNegative() || nodeTimeout.isZero())) {
                throw new IllegalArgumentException("nodeTimeout must be positive");
            }
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(this);
        }
    }
}
