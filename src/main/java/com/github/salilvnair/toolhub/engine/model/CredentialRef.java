package com.github.salilvnair.toolhub.engine.model;

/**
 * Opaque handle to where a service credential lives (an environment variable name).
 * Holds no secret itself; resolved through a {@code CredentialResolver} by the adapter that needs it.
 */
public record CredentialRef(String key) {

    public static CredentialRef env(String variableName) {
        return new CredentialRef(variableName);
    }

    public static CredentialRef none() {
        return new CredentialRef(null);
    }

    public boolean isPresent() {
        return key != null && !key.isBlank();
    }

    @Override
    public String toString() {
        return "CredentialRef[****]";
    }
}
