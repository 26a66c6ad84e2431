package com.hive.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Immutable registry of tools by id. Built once during bootstrap and shared read-only by all runs.
 * Calls to unknown ids fail with {@link CapabilityErrorKind#NOT_FOUND}; a tool that throws synchronously
 * is reported as a failed future instead of propagating.
 */
public final class ToolRegistry implements ToolCapability {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private static final ToolRegistry EMPTY = new ToolRegistry(Map.of());

    private final Map<String, Tool> tools;

    private ToolRegistry(Map<String, Tool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static ToolRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CompletableFuture<Object> call(String toolId, Map<String, Object> args) {
        Tool tool = toolId != null ? tools.get(toolId) : null;
        if (tool == null) {
            return CompletableFuture.failedFuture(
                    new CapabilityException(CapabilityErrorKind.NOT_FOUND, "Unknown tool: " + toolId));
        }
        try {
            CompletableFuture<Object> result = tool.call(args != null ? args : Map.of());
            return result != null ? result : CompletableFuture.completedFuture(null);
        } catch (CapabilityException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            log.debug("Tool {} threw synchronously: {}", toolId, e.toString());
            return CompletableFuture.failedFuture(
                    new CapabilityException(CapabilityErrorKind.UPSTREAM_FAILURE, "Tool " + toolId + " failed: " + e.getMessage(), e));
        }
    }

    public boolean contains(String toolId) {
        return toolId != null && tools.containsKey(toolId);
    }

    public Tool get(String toolId) {
        return toolId != null ? tools.get(toolId) : null;
    }

    public Set<String> getToolIds() {
        return tools.keySet();
    }

    public static final class Builder {
        private final Map<String, Tool> tools = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the id is blank or already registered
         */
        public Builder register(Tool tool) {
            Objects.requireNonNull(tool, "tool");
            String id = Objects.requireNonNull(tool.getToolId(), "toolId").trim();
            if (id.isEmpty()) {
                throw new IllegalArgumentException("Tool id must be non-blank");
            }
            if (tools.putIfAbsent(id, tool) != null) {
                throw new IllegalArgumentException("Tool already registered: " + id);
            }
            return this;
        }

        /** Registers a synchronous function as a tool. */
        public Builder register(String toolId, Function<Map<String, Object>, Object> fn) {
            Objects.requireNonNull(fn, "fn");
            return register(new Tool() {
                @Override
                public String getToolId() {
                    return toolId;
                }

                @Override
                public CompletableFuture<Object> call(Map<String, Object> args) {
                    return CompletableFuture.completedFuture(fn.apply(args));
                }
            });
        }

        public ToolRegistry build() {
            ToolRegistry registry = new ToolRegistry(tools);
            log.info("Tool registry built with {} tool(s): {}", tools.size(), tools.keySet());
            return registry;
        }
    }
}
