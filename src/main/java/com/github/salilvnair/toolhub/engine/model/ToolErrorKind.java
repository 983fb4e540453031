package com.github.salilvnair.toolhub.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ToolErrorKind {

    VALIDATION_ERROR("ValidationError", false),

    TOOL_NOT_FOUND("ToolNotFound", false),

    SERVICE_NOT_FOUND("ServiceNotFound", false),

    UPSTREAM_ERROR("UpstreamError", true),

    INTERNAL_ERROR("InternalError", false);

    private final String wireName;
    private final boolean retryable;

    ToolErrorKind(String wireName, boolean retryable) {
        this.wireName = wireName;
        this.retryable = retryable;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Whether a caller may retry under its own policy. The engine itself never retries. */
    public boolean retryable() {
        return retryable;
    }

    @JsonCreator
    public static ToolErrorKind fromWireName(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown tool error kind: " + value));
    }
}
