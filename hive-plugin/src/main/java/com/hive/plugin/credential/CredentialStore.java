package com.hive.plugin.credential;

/**
 * Read-only credential lookup shared across runs. Storage and encryption are outside this interface.
 */
public interface CredentialStore {

    boolean isAvailable(String name);

    /**
     * @throws MissingCredentialException when {@link #isAvailable(String)} is false
     */
    String get(String name);

    /** Store with no credentials at all. */
    static CredentialStore none() {
        return new CredentialStore() {
            @Override
            public boolean isAvailable(String name) {
                return false;
            }

            @Override
            public String get(String name) {
                throw new MissingCredentialException(name);
            }
        };
    }
}
