package com.github.salilvnair.toolhub.service.github;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GitHubRepository(
        long id,
        String name,
        @JsonProperty("private") boolean privateRepo,
        String description
) {
}
