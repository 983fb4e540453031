package com.github.salilvnair.toolhub.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteToolRequest {

    @JsonProperty("tool_name")
    @JsonAlias("toolName")
    private String toolName;

    @JsonAlias("parameters")
    private Map<String, Object> params;
}
