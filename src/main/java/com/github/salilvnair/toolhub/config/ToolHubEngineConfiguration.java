package com.github.salilvnair.toolhub.config;

import com.github.salilvnair.toolhub.engine.dispatch.ServiceWorkerPools;
import com.github.salilvnair.toolhub.engine.registry.ToolRegistry;
import com.github.salilvnair.toolhub.engine.validation.InputContractValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class ToolHubEngineConfiguration {

    @Bean
    public InputContractValidator inputContractValidator() {
        return new InputContractValidator();
    }

    @Bean(destroyMethod = "close")
    public ToolRegistry toolRegistry(InputContractValidator inputContractValidator) {
        return new ToolRegistry(inputContractValidator);
    }

    @Bean(destroyMethod = "close")
    public ServiceWorkerPools serviceWorkerPools(ToolHubDispatchConfig dispatchConfig) {
        return new ServiceWorkerPools(dispatchConfig.getWorkerThreads());
    }
}
