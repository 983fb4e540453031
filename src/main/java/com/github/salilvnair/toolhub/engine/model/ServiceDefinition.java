package com.github.salilvnair.toolhub.engine.model;

import com.github.salilvnair.toolhub.engine.adapter.ServiceAdapter;
import com.github.salilvnair.toolhub.engine.adapter.ServiceDescriptor;
import com.github.salilvnair.toolhub.engine.adapter.ToolDescriptor;
import lombok.Builder;
import lombok.Singular;

import java.util.List;

@Builder
public record ServiceDefinition(
        String id,
        String displayName,
        String description,
        String baseEndpoint,
        CredentialRef credentialRef,
        @Singular List<ToolDefinition> tools
) {

    public ServiceDefinition {
        credentialRef = credentialRef == null ? CredentialRef.none() : credentialRef;
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    /**
     * Builds the definition an adapter describes, binding every declared tool to
     * {@link ServiceAdapter#handle(String, java.util.Map)} under that tool's name.
     */
    public static ServiceDefinition fromAdapter(ServiceAdapter adapter) {
        ServiceDescriptor descriptor = adapter.describeService();
        List<ToolDescriptor> declared = adapter.listTools() == null ? List.of() : adapter.listTools();
        List<ToolDefinition> tools = declared.stream()
                .map(tool -> ToolDefinition.of(
                        descriptor.id(),
                        tool.name(),
                        tool.description(),
                        tool.inputContract(),
                        params -> adapter.handle(tool.name(), params)))
                .toList();
        return new ServiceDefinition(
                descriptor.id(),
                descriptor.displayName(),
                descriptor.description(),
                descriptor.baseEndpoint(),
                descriptor.credentialRef(),
                tools);
    }

    public ServiceSummary summary() {
        return new ServiceSummary(
                id,
                displayName,
                description,
                baseEndpoint,
                tools.stream().map(ToolDefinition::name).toList());
    }
}
