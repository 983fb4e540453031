package com.github.salilvnair.toolhub.engine.model;

import com.github.salilvnair.toolhub.engine.ToolHubConstants;
import com.github.salilvnair.toolhub.engine.adapter.ToolHandler;

public record ToolDefinition(
        String name,
        String description,
        InputContract inputContract,
        String ownerServiceId,
        ToolHandler handler
) {

    public ToolDefinition {
        inputContract = inputContract == null ? InputContract.empty() : inputContract;
    }

    public static ToolDefinition of(String ownerServiceId,
                                    String name,
                                    String description,
                                    InputContract inputContract,
                                    ToolHandler handler) {
        return new ToolDefinition(name, description, inputContract, ownerServiceId, handler);
    }

    public String qualifiedName() {
        return ownerServiceId + ToolHubConstants.QUALIFIED_NAME_SEPARATOR + name;
    }

    public ToolSummary summary() {
        return new ToolSummary(name, qualifiedName(), ownerServiceId, description, inputContract);
    }
}
