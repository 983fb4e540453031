package com.github.salilvnair.toolhub.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.salilvnair.toolhub.engine.model.ServiceSummary;
import com.github.salilvnair.toolhub.engine.model.ToolErrorKind;
import com.github.salilvnair.toolhub.engine.model.ToolResult;
import com.github.salilvnair.toolhub.engine.model.ToolSummary;
import com.github.salilvnair.toolhub.util.JsonUtil;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolHubClientTest {

    private static final String SERVICES_JSON = """
            [{"id":"github","name":"GitHub","description":"GitHub API","baseEndpoint":"https://api.github.com",
              "tools":["list_repos","list_issues"]}]
            """;

    private static final String TOOLS_JSON = """
            [{"name":"list_tickets","qualifiedName":"linear.list_tickets","service":"linear","description":"List",
              "parameters":{"type":"object","properties":{"team_id":{"type":"string","description":"Team"}},
              "required":[],"additionalProperties":true}}]
            """;

    private HttpServer server;
    private ToolHubClient client;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastPath = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/services", exchange -> respond(exchange, 200, SERVICES_JSON));
        server.createContext("/tools", exchange -> {
            String query = exchange.getRequestURI().getQuery();
            if (query != null && query.contains("service=jira")) {
                respond(exchange, 404, "{\"success\":false,\"error\":{\"kind\":\"ServiceNotFound\",\"message\":\"Service 'jira' not found\"}}");
                return;
            }
            respond(exchange, 200, TOOLS_JSON);
        });
        server.createContext("/execute", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            if (lastBody.get().contains("merge_pr")) {
                respond(exchange, 404, "{\"success\":false,\"error\":{\"kind\":\"ToolNotFound\",\"message\":\"Tool 'merge_pr' not found\"}}");
                return;
            }
            respond(exchange, 200, "{\"success\":true,\"service\":\"github\",\"data\":[{\"id\":101}]}");
        });
        server.createContext("/linear", exchange -> {
            lastPath.set(exchange.getRequestURI().getRawPath());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 502, "{\"success\":false,\"service\":\"linear\",\"error\":{\"kind\":\"UpstreamError\","
                    + "\"message\":\"Upstream service failed for tool 'create_ticket': Team with ID team9 not found\","
                    + "\"detail\":{\"upstreamStatus\":404}}}");
        });
        server.createContext("/broken", exchange -> respond(exchange, 503, "<html>unavailable</html>"));
        server.start();
        client = new ToolHubClient("http://127.0.0.1:" + server.getAddress().getPort() + "/", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void listsServicesAndTools() {
        List<ServiceSummary> services = client.listServices();
        List<ToolSummary> tools = client.listTools("linear");

        assertEquals("github", services.get(0).id());
        assertEquals(List.of("list_repos", "list_issues"), services.get(0).tools());
        assertEquals("linear.list_tickets", tools.get(0).qualifiedName());
        assertEquals("string", tools.get(0).parameters().properties().get("team_id").type());
    }

    @Test
    void listingUnknownServiceRaisesWithTheErrorEnvelope() {
        ToolHubClientException ex = assertThrows(ToolHubClientException.class, () -> client.listTools("jira"));

        assertEquals(404, ex.getStatus());
        assertEquals(ToolErrorKind.SERVICE_NOT_FOUND, ex.getError().kind());
    }

    @Test
    void executeSendsToolNameAndParams() {
        ToolResult result = client.execute("list_issues", Map.of("repo_id", 1));

        assertTrue(result.success());
        assertEquals("github", result.service());
        Map<String, Object> sent = JsonUtil.fromJson(lastBody.get(), new TypeReference<Map<String, Object>>() { });
        assertEquals("list_issues", sent.get("tool_name"));
        assertEquals(Map.of("repo_id", 1), sent.get("params"));
    }

    @Test
    void errorEnvelopesAreReturnedNotThrown() {
        ToolResult notFound = client.execute("merge_pr", null);
        ToolResult upstream = client.executeOnService("linear", "create_ticket", Map.of("team_id", "team9", "title", "t"));

        assertFalse(notFound.success());
        assertEquals(ToolErrorKind.TOOL_NOT_FOUND, notFound.error().kind());
        assertNull(notFound.data());
        assertEquals(ToolErrorKind.UPSTREAM_ERROR, upstream.error().kind());
        assertEquals(404, upstream.error().detail().get("upstreamStatus"));
        assertEquals("/linear/create_ticket", lastPath.get());
    }

    @Test
    void nonEnvelopeBodyRaises() {
        ToolHubClientException ex = assertThrows(ToolHubClientException.class,
                () -> client.executeOnService("broken", "anything", Map.of()));

        assertEquals(503, ex.getStatus());
    }

    @Test
    void unreachableHubRaises() {
        server.stop(0);
        server = null;

        assertThrows(ToolHubClientException.class, () -> client.listServices());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
