package com.github.salilvnair.toolhub.engine.credential;

import com.github.salilvnair.toolhub.engine.model.CredentialRef;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads credentials from the Spring {@link Environment}, which covers OS environment variables,
 * system properties and application properties.
 */
@Component
@RequiredArgsConstructor
public class EnvironmentCredentialResolver implements CredentialResolver {

    private final Environment environment;

    @Override
    public Optional<String> resolve(CredentialRef ref) {
        if (ref == null || !ref.isPresent()) {
            return Optional.empty();
        }
        String value = environment.getProperty(ref.key());
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
