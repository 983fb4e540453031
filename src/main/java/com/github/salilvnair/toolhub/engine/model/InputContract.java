package com.github.salilvnair.toolhub.engine.model;

import com.github.salilvnair.toolhub.engine.ToolHubConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema describing the parameters a tool accepts. Checked before the handler runs, never executed.
 * Serialized as a JSON-schema style object ({@code type}, {@code properties}, {@code required}).
 */
public record InputContract(
        String type,
        Map<String, ParameterSpec> properties,
        List<String> required,
        boolean additionalProperties
) {

    public InputContract {
        type = type == null || type.isBlank() ? ToolHubConstants.CONTRACT_TYPE_OBJECT : type;
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? List.of() : List.copyOf(required);
    }

    /** Contract accepting any params. */
    public static InputContract empty() {
        return new InputContract(ToolHubConstants.CONTRACT_TYPE_OBJECT, Map.of(), List.of(), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ParameterSpec> properties = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();
        private boolean additionalProperties = true;

        private Builder() {
        }

        public Builder property(String name, String type, String description) {
            properties.put(name, new ParameterSpec(type, description));
            return this;
        }

        public Builder required(String... names) {
            required.addAll(List.of(names));
            return this;
        }

        public Builder additionalProperties(boolean allowed) {
            this.additionalProperties = allowed;
            return this;
        }

        public InputContract build() {
            return new InputContract(ToolHubConstants.CONTRACT_TYPE_OBJECT, properties, required, additionalProperties);
        }
    }
}
