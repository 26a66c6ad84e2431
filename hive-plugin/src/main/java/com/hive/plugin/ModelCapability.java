package com.hive.plugin;

import java.util.concurrent.CompletableFuture;

/**
 * External language-model capability. Completes with a {@link ModelResponse} or exceptionally with a
 * {@link CapabilityException}. The returned future may be cancelled by the caller on timeout or run cancellation.
 */
@FunctionalInterface
public interface ModelCapability {

    CompletableFuture<ModelResponse> complete(ModelRequest request);

    /** Capability that fails every call; used when no model is wired. */
    static ModelCapability unavailable() {
        return request -> CompletableFuture.failedFuture(
                new CapabilityException(CapabilityErrorKind.UPSTREAM_FAILURE, "No model capability configured"));
    }
}
