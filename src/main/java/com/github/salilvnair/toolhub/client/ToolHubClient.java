package com.github.salilvnair.toolhub.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.toolhub.engine.model.ServiceSummary;
import com.github.salilvnair.toolhub.engine.model.ToolResult;
import com.github.salilvnair.toolhub.engine.model.ToolSummary;
import com.github.salilvnair.toolhub.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin HTTP client for a running hub. Execution calls always hand back the hub's envelope, whatever
 * the status code; only transport failures and unparseable bodies raise {@link ToolHubClientException}.
 */
@Slf4j
public class ToolHubClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public ToolHubClient(String baseUrl) {
        this(baseUrl, DEFAULT_TIMEOUT);
    }

    public ToolHubClient(String baseUrl, Duration requestTimeout) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout == null ? DEFAULT_TIMEOUT : requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.requestTimeout)
                .build();
    }

    public List<ServiceSummary> listServices() {
        HttpResponse<String> response = send(get("/services"));
        return readListing(response, new TypeReference<List<ServiceSummary>>() { });
    }

    public List<ToolSummary> listTools() {
        HttpResponse<String> response = send(get("/tools"));
        return readListing(response, new TypeReference<List<ToolSummary>>() { });
    }

    public List<ToolSummary> listTools(String serviceId) {
        if (serviceId == null) {
            return listTools();
        }
        HttpResponse<String> response = send(get("/tools?service=" + encode(serviceId)));
        return readListing(response, new TypeReference<List<ToolSummary>>() { });
    }

    public ToolResult execute(String toolName, Map<String, Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tool_name", toolName);
        body.put("params", params == null ? Map.of() : params);
        return readEnvelope(send(post("/execute", body)));
    }

    public ToolResult executeOnService(String serviceId, String toolName, Map<String, Object> params) {
        String path = "/" + encode(serviceId) + "/" + encode(toolName);
        return readEnvelope(send(post(path, params == null ? Map.of() : params)));
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .GET()
                .build();
    }

    private HttpRequest post(String path, Object body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(body)))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("ToolHub client {} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (IOException ex) {
            throw new ToolHubClientException("Request to " + request.uri() + " failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ToolHubClientException("Request to " + request.uri() + " was interrupted", ex);
        }
    }

    private <T> T readListing(HttpResponse<String> response, TypeReference<T> type) {
        if (response.statusCode() / 100 != 2) {
            ToolResult envelope = readEnvelope(response);
            throw new ToolHubClientException(envelope.error() == null
                    ? "Hub answered with status " + response.statusCode()
                    : envelope.error().message(), response.statusCode(), envelope.error());
        }
        try {
            return JsonUtil.fromJson(response.body(), type);
        } catch (IllegalStateException ex) {
            throw new ToolHubClientException("Unparseable response from hub: " + ex.getMessage(), ex);
        }
    }

    private ToolResult readEnvelope(HttpResponse<String> response) {
        JsonNode node = JsonUtil.parseOrNull(response.body());
        if (!node.isObject() || !node.has("success")) {
            throw new ToolHubClientException("Hub answered with status " + response.statusCode()
                    + " and no result envelope", response.statusCode(), null);
        }
        return JsonUtil.fromJson(response.body(), ToolResult.class);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
