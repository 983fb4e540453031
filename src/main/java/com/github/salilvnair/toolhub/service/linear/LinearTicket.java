package com.github.salilvnair.toolhub.service.linear;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LinearTicket(
        String id,
        @JsonProperty("team_id") String teamId,
        String title,
        String description,
        String state,
        int priority,
        List<String> labels,
        @JsonProperty("assignee_id") String assigneeId
) {

    public LinearTicket {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
