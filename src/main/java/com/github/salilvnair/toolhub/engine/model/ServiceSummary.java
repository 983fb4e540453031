package com.github.salilvnair.toolhub.engine.model;

import java.util.List;

public record ServiceSummary(
        String id,
        String name,
        String description,
        String baseEndpoint,
        List<String> tools
) {
}
