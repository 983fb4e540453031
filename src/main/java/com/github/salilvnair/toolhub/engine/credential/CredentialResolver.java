package com.github.salilvnair.toolhub.engine.credential;

import com.github.salilvnair.toolhub.engine.model.CredentialRef;

import java.util.Optional;

public interface CredentialResolver {

    /** Resolved secret value, or empty when the reference points nowhere. Callers must never log it. */
    Optional<String> resolve(CredentialRef ref);

    default boolean isAvailable(CredentialRef ref) {
        return ref != null && ref.isPresent() && resolve(ref).isPresent();
    }
}
