package com.hive.plugin.credential;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Environment-backed credentials. Explicit overrides win over the environment; a credential's value is read from
 * its {@link CredentialSpec#getEnvVar() env var} (or the credential name when no spec is known).
 * Blank values count as unavailable.
 */
public final class EnvCredentialStore implements CredentialStore {

    private final Map<String, String> env;
    private final Map<String, String> overrides;
    private final Map<String, String> envVarByName;

    public EnvCredentialStore(Map<String, String> env, Map<String, String> overrides, Collection<CredentialSpec> specs) {
        this.env = env != null ? Map.copyOf(env) : Map.of();
        this.overrides = overrides != null ? Map.copyOf(overrides) : Map.of();
        Map<String, String> byName = new HashMap<>();
        if (specs != null) {
            for (CredentialSpec spec : specs) {
                if (spec.getEnvVar() != null) byName.put(spec.getName(), spec.getEnvVar());
            }
        }
        this.envVarByName = Map.copyOf(byName);
    }

    /** Store over the process environment. */
    public static EnvCredentialStore fromSystemEnv(Collection<CredentialSpec> specs) {
        return new EnvCredentialStore(System.getenv(), null, specs);
    }

    @Override
    public boolean isAvailable(String name) {
        String v = lookup(name);
        return v != null && !v.isBlank();
    }

    @Override
    public String get(String name) {
        String v = lookup(name);
        if (v == null || v.isBlank()) throw new MissingCredentialException(name);
        return v;
    }

    private String lookup(String name) {
        if (name == null) return null;
        String v = overrides.get(name);
        if (v != null) return v;
        return env.get(envVarByName.getOrDefault(name, name));
    }
}
