package com.github.salilvnair.toolhub.engine.exception;

public enum RegistryErrorCode {

    // =========================
    // Registration errors
    // =========================
    DUPLICATE_SERVICE(
            "A service with the same id is already registered"
    ),

    DUPLICATE_TOOL(
            "A tool with the same name is already registered"
    ),

    INVALID_DEFINITION(
            "Service or tool definition is invalid"
    ),

    REGISTRY_CLOSED(
            "Registry has been closed"
    ),

    // =========================
    // Lookup errors
    // =========================
    SERVICE_NOT_FOUND(
            "Service is not registered"
    ),

    TOOL_NOT_FOUND(
            "Tool is not registered"
    );

    private final String defaultMessage;

    RegistryErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
