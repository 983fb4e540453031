package com.github.salilvnair.toolhub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "toolhub.server")
@Getter
@Setter
public class ToolHubServerConfig {

    /**
     * Debug mode logs every tool execution at INFO. Production mode logs them at DEBUG.
     */
    private boolean debug = false;
}
