package com.github.salilvnair.toolhub.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Envelope returned for every tool execution: either {@code data} on success or a single {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        boolean success,
        String service,
        Object data,
        ToolError error
) {

    public static ToolResult ok(String service, Object data) {
        return new ToolResult(true, service, data == null ? Map.of() : data, null);
    }

    public static ToolResult failure(String service, ToolError error) {
        return new ToolResult(false, service, null, error);
    }

    public static ToolResult failure(ToolError error) {
        return failure(null, error);
    }
}
