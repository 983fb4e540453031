package com.github.salilvnair.toolhub.engine.adapter;

import com.github.salilvnair.toolhub.engine.model.InputContract;

public record ToolDescriptor(String name, String description, InputContract inputContract) {
}
