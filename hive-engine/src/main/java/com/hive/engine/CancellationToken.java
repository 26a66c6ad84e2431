package com.hive.engine;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation signal for one run. The engine checks it once per step, pending capability calls
 * race against it, and retry backoff waits on it.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /** Completes when {@link #cancel()} is called; callers must not complete it themselves. */
    public CompletableFuture<Void> onCancelled() {
        return signal.copy();
    }

    /**
     * Sleeps up to {@code millis}, waking early on cancellation.
     *
     * @return true when the token was cancelled
     */
    public boolean await(long millis) {
        if (millis <= 0) return isCancelled();
        try {
            signal.get(millis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException e) {
            return true;
        }
    }
}
