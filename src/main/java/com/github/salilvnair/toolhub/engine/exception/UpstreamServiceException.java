package com.github.salilvnair.toolhub.engine.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown by a tool handler when the backend service rejected or failed the call.
 * The upstream code, status and detail are passed through to the caller unchanged.
 */
@Getter
public class UpstreamServiceException extends RuntimeException {

    private final String upstreamCode;
    private final Integer upstreamStatus;
    private Map<String, Object> detail = Map.of();

    public UpstreamServiceException(String message) {
        this(message, null, null, null);
    }

    public UpstreamServiceException(String message, String upstreamCode, Integer upstreamStatus) {
        this(message, upstreamCode, upstreamStatus, null);
    }

    public UpstreamServiceException(String message, String upstreamCode, Integer upstreamStatus, Throwable cause) {
        super(message, cause);
        this.upstreamCode = upstreamCode;
        this.upstreamStatus = upstreamStatus;
    }

    public UpstreamServiceException withDetail(Map<String, Object> detail) {
        this.detail = detail == null ? Map.of() : new LinkedHashMap<>(detail);
        return this;
    }
}
