package com.hive.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * Backoff between node attempts. The number of attempts comes from each node's {@code maxRetries};
 * this only decides the delay and which error kinds are worth retrying.
 * Delay before retry {@code n} (1-based) is {@code initialIntervalMs * backoffCoefficient^(n-1)}, capped at
 * {@code maxIntervalMs} when that is positive.
 */
public final class RetryPolicy {

    private static final RetryPolicy IMMEDIATE = new RetryPolicy(0L, 1.0, 0L, Set.of());

    private final long initialIntervalMs;
    private final double backoffCoefficient;
    private final long maxIntervalMs;
    private final Set<ErrorKind> nonRetryableKinds;

    public RetryPolicy(long initialIntervalMs, double backoffCoefficient, long maxIntervalMs,
                       Set<ErrorKind> nonRetryableKinds) {
        if (initialIntervalMs < 0) throw new IllegalArgumentException("initialIntervalMs must be >= 0");
        if (backoffCoefficient < 1.0) throw new IllegalArgumentException("backoffCoefficient must be >= 1.0");
        this.initialIntervalMs = initialIntervalMs;
        this.backoffCoefficient = backoffCoefficient;
        this.maxIntervalMs = Math.max(0L, maxIntervalMs);
        this.nonRetryableKinds = nonRetryableKinds == null || nonRetryableKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(nonRetryableKinds));
    }

    /** Retries without delay; every kind except the always-final ones is retryable. */
    public static RetryPolicy immediate() {
        return IMMEDIATE;
    }

    public static RetryPolicy exponential(long initialIntervalMs, double backoffCoefficient, long maxIntervalMs) {
        return new RetryPolicy(initialIntervalMs, backoffCoefficient, maxIntervalMs, Set.of());
    }

    /** Copy of this policy that never retries the given kinds (e.g. {@link ErrorKind#AUTH_FAILURE}). */
    public RetryPolicy withNonRetryable(Set<ErrorKind> kinds) {
        return new RetryPolicy(initialIntervalMs, backoffCoefficient, maxIntervalMs, kinds);
    }

    public boolean isRetryable(ErrorKind kind) {
        return kind != null && !kind.isAlwaysFinal() && !nonRetryableKinds.contains(kind);
    }

    /**
     * @param failedAttempt 1-based attempt that just failed
     * @return milliseconds to wait before the next attempt
     */
    public long delayAfterAttempt(int failedAttempt) {
        if (initialIntervalMs == 0L) return 0L;
        long delay = (long) (initialIntervalMs * Math.pow(backoffCoefficient, Math.max(0, failedAttempt - 1)));
        return maxIntervalMs > 0 ? Math.min(delay, maxIntervalMs) : delay;
    }

    public long getInitialIntervalMs() {
        return initialIntervalMs;
    }

    public double getBackoffCoefficient() {
        return backoffCoefficient;
    }

    public long getMaxIntervalMs() {
        return maxIntervalMs;
    }

    public Set<ErrorKind> getNonRetryableKinds() {
        return nonRetryableKinds;
    }
}
