package com.hive.plugin.credential;

import java.util.List;
import java.util.Objects;

/**
 * Declares a named secret, the environment variable that supplies it, and the tools that need it.
 * Example: {@code calcom} read from {@code CALCOM_API_KEY}, required by the {@code calcom_*} tools.
 */
public final class CredentialSpec {

    private final String name;
    private final String envVar;
    private final List<String> tools;
    private final boolean required;
    private final String description;

    public CredentialSpec(String name, String envVar, List<String> tools, boolean required, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.envVar = envVar;
        this.tools = tools != null ? List.copyOf(tools) : List.of();
        this.required = required;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    /** Environment variable holding the secret; null means the variable is named like the credential. */
    public String getEnvVar() {
        return envVar;
    }

    public List<String> getTools() {
        return tools;
    }

    /** When false the tools work without it (degraded), so availability is not enforced before invocation. */
    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }
}
