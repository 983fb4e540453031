package com.github.salilvnair.toolhub.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.toolhub.engine.ToolHubConstants;
import com.github.salilvnair.toolhub.engine.exception.UpstreamServiceException;
import com.github.salilvnair.toolhub.engine.validation.ContractViolation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ToolError(
        ToolErrorKind kind,
        String message,
        Map<String, Object> detail,
        String referenceId
) {

    public ToolError {
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static ToolError toolNotFound(String message) {
        return new ToolError(ToolErrorKind.TOOL_NOT_FOUND, message, null, null);
    }

    public static ToolError serviceNotFound(String message) {
        return new ToolError(ToolErrorKind.SERVICE_NOT_FOUND, message, null, null);
    }

    public static ToolError validation(String message, List<ContractViolation> violations) {
        Map<String, Object> detail = new LinkedHashMap<>();
        if (violations != null && !violations.isEmpty()) {
            detail.put(ToolHubConstants.DETAIL_VIOLATIONS, violations);
        }
        return new ToolError(ToolErrorKind.VALIDATION_ERROR, message, detail, null);
    }

    public static ToolError upstream(String toolName, UpstreamServiceException ex) {
        Map<String, Object> detail = new LinkedHashMap<>(ex.getDetail());
        if (ex.getUpstreamCode() != null) {
            detail.put(ToolHubConstants.DETAIL_UPSTREAM_CODE, ex.getUpstreamCode());
        }
        if (ex.getUpstreamStatus() != null) {
            detail.put(ToolHubConstants.DETAIL_UPSTREAM_STATUS, ex.getUpstreamStatus());
        }
        String reason = ex.getMessage() == null ? "no detail provided" : ex.getMessage();
        return new ToolError(ToolErrorKind.UPSTREAM_ERROR,
                "Upstream service failed for tool '" + toolName + "': " + reason, detail, null);
    }

    public static ToolError upstreamTimeout(String toolName, long timeoutMs) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put(ToolHubConstants.DETAIL_UPSTREAM_CODE, ToolHubConstants.UPSTREAM_CODE_TIMEOUT);
        detail.put(ToolHubConstants.DETAIL_TIMEOUT_MS, timeoutMs);
        return new ToolError(ToolErrorKind.UPSTREAM_ERROR,
                "Upstream service did not respond for tool '" + toolName + "' within " + timeoutMs + " ms",
                detail, null);
    }

    /** Generic failure; the cause is only logged server side under {@code referenceId}. */
    public static ToolError internal(String referenceId) {
        return new ToolError(ToolErrorKind.INTERNAL_ERROR, ToolHubConstants.INTERNAL_ERROR_MESSAGE, null, referenceId);
    }
}
