package com.hive.plugin.credential;

/** Thrown by {@link CredentialStore#get(String)} when the secret is not configured. */
public final class MissingCredentialException extends RuntimeException {

    private final String credentialName;

    public MissingCredentialException(String credentialName) {
        super("Credential not configured: " + credentialName);
        this.credentialName = credentialName;
    }

    public String getCredentialName() {
        return credentialName;
    }
}
