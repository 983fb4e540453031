package com.github.salilvnair.toolhub.api.controller;

import com.github.salilvnair.toolhub.api.dto.ExecuteToolRequest;
import com.github.salilvnair.toolhub.engine.dispatch.ToolDispatcher;
import com.github.salilvnair.toolhub.engine.exception.RegistryException;
import com.github.salilvnair.toolhub.engine.model.ServiceSummary;
import com.github.salilvnair.toolhub.engine.model.ToolError;
import com.github.salilvnair.toolhub.engine.model.ToolResult;
import com.github.salilvnair.toolhub.engine.registry.ToolRegistry;
import com.github.salilvnair.toolhub.engine.validation.ContractViolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the hub. Every execution answer is a {@link ToolResult} envelope; the status code
 * only mirrors the envelope's error kind.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ToolHubController {

    private final ToolRegistry registry;
    private final ToolDispatcher dispatcher;

    @GetMapping("/services")
    public List<ServiceSummary> services() {
        return registry.listServices();
    }

    @GetMapping("/tools")
    public ResponseEntity<?> tools(@RequestParam(name = "service", required = false) String serviceId) {
        try {
            return ResponseEntity.ok(registry.listTools(serviceId));
        } catch (RegistryException ex) {
            return respond(ToolResult.failure(ToolError.serviceNotFound(ex.getMessage())));
        }
    }

    @GetMapping("/tools/{toolName}")
    public ResponseEntity<?> tool(@PathVariable("toolName") String toolName) {
        return registry.findTool(toolName)
                .<ResponseEntity<?>>map(tool -> ResponseEntity.ok(tool.summary()))
                .orElseGet(() -> respond(ToolResult.failure(
                        ToolError.toolNotFound("Tool '" + toolName + "' not found"))));
    }

    @PostMapping("/execute")
    public ResponseEntity<ToolResult> execute(@RequestBody ExecuteToolRequest request) {
        if (request.getToolName() == null || request.getToolName().isBlank()) {
            return respond(ToolResult.failure(ToolError.validation("tool_name is required",
                    List.of(new ContractViolation("tool_name", "is required")))));
        }
        return respond(dispatcher.execute(request.getToolName(), request.getParams()));
    }

    @PostMapping("/{serviceId}/{toolName}")
    public ResponseEntity<ToolResult> executeOnService(@PathVariable("serviceId") String serviceId,
                                                       @PathVariable("toolName") String toolName,
                                                       @RequestBody(required = false) Map<String, Object> params) {
        return respond(dispatcher.execute(serviceId, toolName, params));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ToolResult> unreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request body: {}", ex.getMessage());
        return respond(ToolResult.failure(ToolError.validation("Request body must be a JSON object", List.of())));
    }

    static HttpStatus statusFor(ToolResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        return switch (result.error().kind()) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case TOOL_NOT_FOUND, SERVICE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UPSTREAM_ERROR -> HttpStatus.BAD_GATEWAY;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ToolResult> respond(ToolResult result) {
        return ResponseEntity.status(statusFor(result)).body(result);
    }
}
