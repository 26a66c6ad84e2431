package com.hive.plugin;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A single external tool registered in a {@link ToolRegistry}.
 */
public interface Tool {

    /** Tool identifier referenced by node {@code toolRefs}. */
    String getToolId();

    /** Human-readable description (e.g. "Lists upcoming bookings"). */
    default String getDescription() {
        return "";
    }

    CompletableFuture<Object> call(Map<String, Object> args);
}
