package com.github.salilvnair.toolhub.engine.bootstrap;

import com.github.salilvnair.toolhub.engine.adapter.ServiceAdapter;
import com.github.salilvnair.toolhub.engine.credential.CredentialResolver;
import com.github.salilvnair.toolhub.engine.model.ServiceDefinition;
import com.github.salilvnair.toolhub.engine.registry.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers every {@link ServiceAdapter} bean once all singletons exist and before the web server
 * starts accepting requests. A registration error aborts startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceRegistrationInitializer implements SmartInitializingSingleton {

    private final ToolRegistry registry;
    private final ObjectProvider<ServiceAdapter> adapters;
    private final CredentialResolver credentialResolver;

    @Override
    public void afterSingletonsInstantiated() {
        registerAll();
    }

    public void registerAll() {
        List<ServiceAdapter> ordered = adapters.orderedStream().toList();
        log.info("ToolHub: Registering {} service adapter(s).", ordered.size());
        for (ServiceAdapter adapter : ordered) {
            ServiceDefinition service = ServiceDefinition.fromAdapter(adapter);
            registry.registerService(service);
            if (!credentialResolver.isAvailable(service.credentialRef())) {
                log.warn("ToolHub: No credential configured for service={}", service.id());
            }
        }
        log.info("ToolHub: Registration complete services={} tools={}", registry.serviceCount(), registry.toolCount());
    }
}
