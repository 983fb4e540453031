package com.github.salilvnair.toolhub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "toolhub.dispatch")
@Getter
@Setter
public class ToolHubDispatchConfig {

    /**
     * Upper bound for a single handler invocation. Zero or negative runs handlers on the
     * calling thread without a bound.
     */
    private long handlerTimeoutMs = 30000L;

    /**
     * Threads in each service's worker pool. Handlers run on these when a timeout is configured.
     */
    private int workerThreads = 16;
}
