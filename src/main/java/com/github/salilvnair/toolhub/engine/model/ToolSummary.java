package com.github.salilvnair.toolhub.engine.model;

public record ToolSummary(
        String name,
        String qualifiedName,
        String service,
        String description,
        InputContract parameters
) {
}
