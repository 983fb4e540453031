package com.github.salilvnair.toolhub.client;

import com.github.salilvnair.toolhub.engine.model.ToolError;
import lombok.Getter;

/**
 * Raised by {@link ToolHubClient} when the hub cannot be reached, or when a listing call is answered
 * with an error envelope instead of the expected payload.
 */
@Getter
public class ToolHubClientException extends RuntimeException {

    private final int status;
    private final ToolError error;

    public ToolHubClientException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.error = null;
    }

    public ToolHubClientException(String message, int status, ToolError error) {
        super(message);
        this.status = status;
        this.error = error;
    }
}
