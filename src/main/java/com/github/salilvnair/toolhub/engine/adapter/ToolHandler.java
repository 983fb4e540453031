package com.github.salilvnair.toolhub.engine.adapter;

import java.util.Map;

/**
 * Per-tool handler capability supplied by a service adapter.
 * Implementations signal backend failures with
 * {@link com.github.salilvnair.toolhub.engine.exception.UpstreamServiceException}; any other exception
 * is reported to callers as an internal error.
 */
@FunctionalInterface
public interface ToolHandler {
    Object handle(Map<String, Object> params) throws Exception;
}
