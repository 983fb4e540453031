package com.github.salilvnair.toolhub.engine.registry;

import com.github.salilvnair.toolhub.engine.adapter.ServiceAdapter;
import com.github.salilvnair.toolhub.engine.exception.RegistryErrorCode;
import com.github.salilvnair.toolhub.engine.exception.RegistryException;
import com.github.salilvnair.toolhub.engine.model.ServiceDefinition;
import com.github.salilvnair.toolhub.engine.model.ServiceSummary;
import com.github.salilvnair.toolhub.engine.model.ToolDefinition;
import com.github.salilvnair.toolhub.engine.model.ToolSummary;
import com.github.salilvnair.toolhub.engine.validation.InputContractValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Store of registered services and the tools they contribute.
 * <p>
 * Tools are indexed twice: by {@code (serviceId, toolName)} and by bare tool name. Bare names are
 * unique across the registry; a service declaring a name that is already bound is rejected with
 * {@link RegistryErrorCode#DUPLICATE_TOOL} and none of its tools are added.
 * <p>
 * Lifecycle: construct once, register services during startup, call {@link #close()} at teardown.
 * Mutations run under the write lock, reads under the read lock, so a reader never sees half of a
 * registration.
 */
@Slf4j
public class ToolRegistry implements AutoCloseable {

    private final InputContractValidator contractValidator;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    private final Map<String, ServiceDefinition> services = new LinkedHashMap<>();
    private final Map<String, ToolDefinition> toolsByName = new LinkedHashMap<>();
    private final Map<ToolKey, ToolDefinition> toolsByQualifiedName = new HashMap<>();
    private boolean closed;

    public ToolRegistry(InputContractValidator contractValidator) {
        this.contractValidator = Objects.requireNonNull(contractValidator, "contractValidator");
    }

    public ToolRegistry() {
        this(new InputContractValidator());
    }

    public void registerAdapter(ServiceAdapter adapter) {
        Objects.requireNonNull(adapter, "adapter");
        registerService(ServiceDefinition.fromAdapter(adapter));
    }

    /**
     * Adds the service and every tool it declares, or nothing at all.
     *
     * @throws RegistryException {@code DUPLICATE_SERVICE} if the id is taken, {@code DUPLICATE_TOOL} if any
     *                           declared tool name is already bound, {@code INVALID_DEFINITION} if the
     *                           definition is malformed
     */
    public void registerService(ServiceDefinition service) {
        Objects.requireNonNull(service, "service");
        validateDefinition(service);

        writeLock.lock();
        try {
            ensureOpen();
            if (services.containsKey(service.id())) {
                log.warn("Rejected registration of service={} reason=DUPLICATE_SERVICE", service.id());
                throw new RegistryException(RegistryErrorCode.DUPLICATE_SERVICE,
                        "Service '" + service.id() + "' is already registered");
            }
            Set<String> declared = new HashSet<>();
            for (ToolDefinition tool : service.tools()) {
                ToolDefinition existing = toolsByName.get(tool.name());
                if (existing != null || !declared.add(tool.name())) {
                    String boundTo = existing != null ? existing.ownerServiceId() : service.id();
                    log.warn("Rejected registration of service={} reason=DUPLICATE_TOOL tool={} boundTo={}",
                            service.id(), tool.name(), boundTo);
                    throw new RegistryException(RegistryErrorCode.DUPLICATE_TOOL,
                            "Tool '" + tool.name() + "' declared by service '" + service.id()
                                    + "' is already registered by service '" + boundTo + "'");
                }
            }

            services.put(service.id(), service);
            for (ToolDefinition tool : service.tools()) {
                toolsByName.put(tool.name(), tool);
                toolsByQualifiedName.put(new ToolKey(service.id(), tool.name()), tool);
            }
        } finally {
            writeLock.unlock();
        }

        log.info("Registered service={} name={} tools={}", service.id(), service.displayName(), service.tools().size());
        for (ToolDefinition tool : service.tools()) {
            log.info("Registered tool={} for service={}", tool.name(), service.id());
        }
    }

    /**
     * Removes the service and all of its tools.
     *
     * @throws RegistryException {@code SERVICE_NOT_FOUND} if no such service is registered
     */
    public void unregisterService(String serviceId) {
        ServiceDefinition removed;
        writeLock.lock();
        try {
            ensureOpen();
            removed = services.remove(serviceId);
            if (removed == null) {
                throw serviceNotFound(serviceId);
            }
            for (ToolDefinition tool : removed.tools()) {
                toolsByName.remove(tool.name());
                toolsByQualifiedName.remove(new ToolKey(serviceId, tool.name()));
            }
        } finally {
            writeLock.unlock();
        }
        log.info("Unregistered service={} tools={}", serviceId, removed.tools().size());
    }

    public List<ServiceSummary> listServices() {
        readLock.lock();
        try {
            return services.values().stream().map(ServiceDefinition::summary).toList();
        } finally {
            readLock.unlock();
        }
    }

    public List<ToolSummary> listTools() {
        readLock.lock();
        try {
            return toolsByName.values().stream().map(ToolDefinition::summary).toList();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Tools contributed by one service, in the order the service declared them.
     *
     * @throws RegistryException {@code SERVICE_NOT_FOUND} if no such service is registered
     */
    public List<ToolSummary> listTools(String serviceId) {
        if (serviceId == null) {
            return listTools();
        }
        readLock.lock();
        try {
            ServiceDefinition service = services.get(serviceId);
            if (service == null) {
                throw serviceNotFound(serviceId);
            }
            return service.tools().stream().map(ToolDefinition::summary).toList();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * @throws RegistryException {@code TOOL_NOT_FOUND} if no tool with this name is registered
     */
    public ToolDefinition lookupTool(String toolName) {
        return findTool(toolName).orElseThrow(() -> toolNotFound(toolName));
    }

    /**
     * Resolves a tool within one service. For any registered tool this returns the same definition
     * as {@link #lookupTool(String)}.
     *
     * @throws RegistryException {@code SERVICE_NOT_FOUND} if the service is unknown, {@code TOOL_NOT_FOUND}
     *                           if the service does not declare the tool
     */
    public ToolDefinition lookupTool(String serviceId, String toolName) {
        readLock.lock();
        try {
            if (serviceId == null || !services.containsKey(serviceId)) {
                throw serviceNotFound(serviceId);
            }
            ToolDefinition tool = toolsByQualifiedName.get(new ToolKey(serviceId, toolName));
            if (tool == null) {
                throw new RegistryException(RegistryErrorCode.TOOL_NOT_FOUND,
                        "Tool '" + toolName + "' not found in service '" + serviceId + "'");
            }
            return tool;
        } finally {
            readLock.unlock();
        }
    }

    public Optional<ToolDefinition> findTool(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        readLock.lock();
        try {
            return Optional.ofNullable(toolsByName.get(toolName));
        } finally {
            readLock.unlock();
        }
    }

    public Optional<ServiceDefinition> findService(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        readLock.lock();
        try {
            return Optional.ofNullable(services.get(serviceId));
        } finally {
            readLock.unlock();
        }
    }

    public int serviceCount() {
        readLock.lock();
        try {
            return services.size();
        } finally {
            readLock.unlock();
        }
    }

    public int toolCount() {
        readLock.lock();
        try {
            return toolsByName.size();
        } finally {
            readLock.unlock();
        }
    }

    /** Drops every registration. Further registration attempts fail with {@code REGISTRY_CLOSED}. */
    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            services.clear();
            toolsByName.clear();
            toolsByQualifiedName.clear();
        } finally {
            writeLock.unlock();
        }
        log.info("Tool registry closed");
    }

    private void validateDefinition(ServiceDefinition service) {
        List<String> problems = new ArrayList<>();
        if (service.id() == null || service.id().isBlank()) {
            problems.add("service id must be non-blank");
        }
        for (ToolDefinition tool : service.tools()) {
            String label = tool == null || tool.name() == null ? "<unnamed>" : tool.name();
            if (tool == null) {
                problems.add("tool definitions must be non-null");
                continue;
            }
            if (tool.name() == null || tool.name().isBlank()) {
                problems.add("tool name must be non-blank");
            }
            if (!Objects.equals(tool.ownerServiceId(), service.id())) {
                problems.add("tool '" + label + "' is owned by '" + tool.ownerServiceId() + "' not '" + service.id() + "'");
            }
            if (tool.handler() == null) {
                problems.add("tool '" + label + "' has no handler");
            }
            contractValidator.validateDefinition(tool.inputContract())
                    .forEach(problem -> problems.add("tool '" + label + "': " + problem));
        }
        if (!problems.isEmpty()) {
            throw new RegistryException(RegistryErrorCode.INVALID_DEFINITION,
                    "Invalid definition for service '" + service.id() + "': " + String.join("; ", problems));
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new RegistryException(RegistryErrorCode.REGISTRY_CLOSED);
        }
    }

    private static RegistryException serviceNotFound(String serviceId) {
        return new RegistryException(RegistryErrorCode.SERVICE_NOT_FOUND, "Service '" + serviceId + "' not found");
    }

    private static RegistryException toolNotFound(String toolName) {
        return new RegistryException(RegistryErrorCode.TOOL_NOT_FOUND, "Tool '" + toolName + "' not found");
    }

    private record ToolKey(String serviceId, String toolName) {
    }
}
