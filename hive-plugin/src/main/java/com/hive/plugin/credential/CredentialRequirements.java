package com.hive.plugin.credential;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps tool ids to the required credentials they depend on. Only {@link CredentialSpec#isRequired() required}
 * specs participate; immutable after construction.
 */
public final class CredentialRequirements {

    private static final CredentialRequirements NONE = new CredentialRequirements(List.of());

    private final Map<String, List<String>> credentialsByTool;

    public CredentialRequirements(Collection<CredentialSpec> specs) {
        Map<String, List<String>> byTool = new LinkedHashMap<>();
        for (CredentialSpec spec : specs) {
            if (!spec.isRequired()) continue;
            for (String tool : spec.getTools()) {
                byTool.computeIfAbsent(tool, k -> new ArrayList<>()).add(spec.getName());
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        byTool.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.credentialsByTool = Collections.unmodifiableMap(frozen);
    }

    public static CredentialRequirements none() {
        return NONE;
    }

    public List<String> requiredFor(String toolId) {
        return credentialsByTool.getOrDefault(toolId, List.of());
    }

    /** Credentials required by any of {@code toolRefs} that {@code store} cannot supply, deduplicated in order. */
    public List<String> missingFor(Collection<String> toolRefs, CredentialStore store) {
        List<String> missing = new ArrayList<>();
        for (String tool : toolRefs) {
            for (String name : requiredFor(tool)) {
                if (!missing.contains(name) && !store.isAvailable(name)) missing.add(name);
            }
        }
        return missing;
    }
}
