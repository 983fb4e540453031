package com.github.salilvnair.toolhub.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSpec(String type, String description) {
}
