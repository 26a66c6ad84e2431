package com.hive.engine.node;

import com.hive.engine.CancellationToken;
import com.hive.plugin.CapabilityErrorKind;
import com.hive.plugin.CapabilityException;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits for an external capability call under a timeout and a cancellation token. On timeout or cancellation
 * the pending future is cancelled so the capability can stop work.
 */
public final class CapabilityCalls {

    private CapabilityCalls() {
    }

    /**
     * @return the call's result
     * @throws CapabilityException     classified failure, {@link CapabilityErrorKind#TIMEOUT} on expiry
     * @throws CancellationException   when the run was cancelled first
     */
    public static <T> T await(CompletableFuture<T> call, Duration timeout, CancellationToken token) {
        if (call == null) {
            throw new CapabilityException(CapabilityErrorKind.UPSTREAM_FAILURE, "Capability returned no future");
        }
        CompletableFuture<Object> race = CompletableFuture.anyOf(call, token.onCancelled());
        try {
            if (timeout != null) {
                race.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                race.get();
            }
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new CapabilityException(CapabilityErrorKind.TIMEOUT, "Call timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new CancellationException("Interrupted while awaiting capability");
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
        if (!call.isDone()) {
            call.cancel(true);
            throw new CancellationException("Run cancelled");
        }
        try {
            return call.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    /** Normalizes a capability failure: unwraps completion wrappers and classifies anything unknown as upstream. */
    static RuntimeException unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof CapabilityException ce) return ce;
        if (cause instanceof CancellationException ce) return ce;
        String message = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
        return new CapabilityException(CapabilityErrorKind.UPSTREAM_FAILURE, message, cause);
    }
}
