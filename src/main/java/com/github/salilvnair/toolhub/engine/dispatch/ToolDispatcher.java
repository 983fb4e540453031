package com.github.salilvnair.toolhub.engine.dispatch;

import com.github.salilvnair.toolhub.config.ToolHubDispatchConfig;
import com.github.salilvnair.toolhub.config.ToolHubServerConfig;
import com.github.salilvnair.toolhub.engine.exception.RegistryErrorCode;
import com.github.salilvnair.toolhub.engine.exception.RegistryException;
import com.github.salilvnair.toolhub.engine.exception.UpstreamServiceException;
import com.github.salilvnair.toolhub.engine.model.ToolDefinition;
import com.github.salilvnair.toolhub.engine.model.ToolError;
import com.github.salilvnair.toolhub.engine.model.ToolResult;
import com.github.salilvnair.toolhub.engine.registry.ToolRegistry;
import com.github.salilvnair.toolhub.engine.validation.ContractViolation;
import com.github.salilvnair.toolhub.engine.validation.InputContractValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a tool, checks its params, runs its handler and folds every outcome into a {@link ToolResult}.
 * {@code execute} never throws.
 */
@Slf4j
@Component
public class ToolDispatcher {

    private final ToolRegistry registry;
    private final InputContractValidator contractValidator;
    private final ServiceWorkerPools workers;
    private final long handlerTimeoutMs;
    private final boolean debug;

    public ToolDispatcher(ToolRegistry registry,
                          InputContractValidator contractValidator,
                          ServiceWorkerPools workers,
                          ToolHubDispatchConfig dispatchConfig,
                          ToolHubServerConfig serverConfig) {
        this.registry = registry;
        this.contractValidator = contractValidator;
        this.workers = workers;
        this.handlerTimeoutMs = dispatchConfig.getHandlerTimeoutMs();
        this.debug = serverConfig.isDebug();
    }

    /** Executes a tool resolved by its registry-wide name. */
    public ToolResult execute(String toolName, Map<String, Object> params) {
        ToolDefinition tool;
        try {
            tool = registry.lookupTool(toolName);
        } catch (RegistryException ex) {
            return lookupFailure(toolName, null, ex);
        }
        return dispatch(tool, params);
    }

    /** Executes a tool resolved within one service. */
    public ToolResult execute(String serviceId, String toolName, Map<String, Object> params) {
        ToolDefinition tool;
        try {
            tool = registry.lookupTool(serviceId, toolName);
        } catch (RegistryException ex) {
            return lookupFailure(toolName, serviceId, ex);
        }
        return dispatch(tool, params);
    }

    private ToolResult dispatch(ToolDefinition tool, Map<String, Object> params) {
        long startedAt = System.currentTimeMillis();
        Map<String, Object> safeParams = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));

        ToolResult result;
        List<ContractViolation> violations = contractValidator.validate(tool.inputContract(), safeParams);
        if (!violations.isEmpty()) {
            result = ToolResult.failure(tool.ownerServiceId(),
                    ToolError.validation("Invalid parameters for tool '" + tool.name() + "'", violations));
        } else {
            result = invoke(tool, safeParams);
        }

        logOutcome(tool, result, System.currentTimeMillis() - startedAt);
        return result;
    }

    private ToolResult invoke(ToolDefinition tool, Map<String, Object> params) {
        try {
            return ToolResult.ok(tool.ownerServiceId(), invokeHandler(tool, params));
        } catch (UpstreamServiceException ex) {
            return ToolResult.failure(tool.ownerServiceId(), ToolError.upstream(tool.name(), ex));
        } catch (TimeoutException ex) {
            return ToolResult.failure(tool.ownerServiceId(), ToolError.upstreamTimeout(tool.name(), handlerTimeoutMs));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return internalFailure(tool, ex);
        } catch (Exception | Error ex) {
            return internalFailure(tool, ex);
        }
    }

    private Object invokeHandler(ToolDefinition tool, Map<String, Object> params) throws Exception {
        if (handlerTimeoutMs <= 0 || workers == null) {
            return tool.handler().handle(params);
        }
        Future<Object> future = workers.forService(tool.ownerServiceId()).submit(() -> tool.handler().handle(params));
        try {
            return future.get(handlerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    private ToolResult internalFailure(ToolDefinition tool, Throwable ex) {
        String referenceId = UUID.randomUUID().toString();
        log.error("Internal failure executing tool={} service={} referenceId={}",
                tool.name(), tool.ownerServiceId(), referenceId, ex);
        return ToolResult.failure(tool.ownerServiceId(), ToolError.internal(referenceId));
    }

    private ToolResult lookupFailure(String toolName, String serviceId, RegistryException ex) {
        ToolError error = ex.getErrorCode() == RegistryErrorCode.SERVICE_NOT_FOUND
                ? ToolError.serviceNotFound(ex.getMessage())
                : ToolError.toolNotFound(ex.getMessage());
        log.info("Tool execution rejected tool={} service={} kind={}", toolName, serviceId, error.kind().wireName());
        return ToolResult.failure(error);
    }

    private void logOutcome(ToolDefinition tool, ToolResult result, long elapsedMs) {
        String outcome = result.success() ? "SUCCESS" : result.error().kind().wireName();
        if (!result.success() && result.error().kind().retryable()) {
            log.warn("Executed tool={} service={} outcome={} elapsedMs={} message={}",
                    tool.name(), tool.ownerServiceId(), outcome, elapsedMs, result.error().message());
        } else if (debug) {
            log.info("Executed tool={} service={} outcome={} elapsedMs={}",
                    tool.name(), tool.ownerServiceId(), outcome, elapsedMs);
        } else {
            log.debug("Executed tool={} service={} outcome={} elapsedMs={}",
                    tool.name(), tool.ownerServiceId(), outcome, elapsedMs);
        }
    }
}
