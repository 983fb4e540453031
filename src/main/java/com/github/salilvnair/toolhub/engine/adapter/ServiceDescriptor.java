package com.github.salilvnair.toolhub.engine.adapter;

import com.github.salilvnair.toolhub.engine.model.CredentialRef;

public record ServiceDescriptor(
        String id,
        String displayName,
        String description,
        String baseEndpoint,
        CredentialRef credentialRef
) {
}
