package com.github.salilvnair.toolhub.service.github;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GitHubIssue(
        long id,
        @JsonProperty("repo_id") long repoId,
        String title,
        String body,
        List<String> labels,
        String state
) {

    public GitHubIssue {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
