package com.github.salilvnair.toolhub.engine.adapter;

import java.util.List;
import java.util.Map;

/**
 * Consumer-facing SPI for a backend integration.
 * Implement one adapter per upstream service (for example: "github", "linear") and expose it as a bean;
 * adapters are registered at startup in {@link org.springframework.core.annotation.Order} order.
 * <p>
 * {@link #handle(String, Map)} is called concurrently for different requests, so any mutable state the
 * adapter keeps must be synchronized by the adapter itself.
 */
public interface ServiceAdapter {

    ServiceDescriptor describeService();

    List<ToolDescriptor> listTools();

    /**
     * Executes one of the tools returned by {@link #listTools()}.
     * Params have already been checked against the tool's input contract.
     *
     * @throws com.github.salilvnair.toolhub.engine.exception.UpstreamServiceException when the backend
     *         rejects or fails the call
     */
    Object handle(String toolName, Map<String, Object> params);
}
