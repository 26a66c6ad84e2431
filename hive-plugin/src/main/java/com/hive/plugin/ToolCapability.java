package com.hive.plugin;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * External tool capability: {@code call(toolId, args)} completes with the tool result or exceptionally with a
 * {@link CapabilityException} whose kind is one of auth, not found, rate limited, invalid args or upstream failure.
 */
@FunctionalInterface
public interface ToolCapability {

    CompletableFuture<Object> call(String toolId, Map<String, Object> args);
}
