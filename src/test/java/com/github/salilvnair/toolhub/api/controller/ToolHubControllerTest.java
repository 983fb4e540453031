package com.github.salilvnair.toolhub.api.controller;

import com.github.salilvnair.toolhub.config.ToolHubDispatchConfig;
import com.github.salilvnair.toolhub.config.ToolHubServerConfig;
import com.github.salilvnair.toolhub.config.ToolHubServicesConfig;
import com.github.salilvnair.toolhub.engine.dispatch.ServiceWorkerPools;
import com.github.salilvnair.toolhub.engine.dispatch.ToolDispatcher;
import com.github.salilvnair.toolhub.engine.exception.UpstreamServiceException;
import com.github.salilvnair.toolhub.engine.registry.ToolRegistry;
import com.github.salilvnair.toolhub.engine.validation.InputContractValidator;
import com.github.salilvnair.toolhub.service.github.GitHubServiceAdapter;
import com.github.salilvnair.toolhub.service.linear.LinearServiceAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.github.salilvnair.toolhub.support.TestConstants.SECRET_DETAIL;
import static com.github.salilvnair.toolhub.support.TestConstants.SERVICE_A;
import static com.github.salilvnair.toolhub.support.TestTools.service;
import static com.github.salilvnair.toolhub.support.TestTools.tool;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ToolHubControllerTest {

    private ServiceWorkerPools workers;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry();
        ToolHubServicesConfig servicesConfig = new ToolHubServicesConfig();
        registry.registerAdapter(new GitHubServiceAdapter(servicesConfig));
        registry.registerAdapter(new LinearServiceAdapter(servicesConfig));
        registry.registerService(service(SERVICE_A,
                tool(SERVICE_A, "flaky", params -> {
                    throw new UpstreamServiceException("rate limited", "rate_limited", 429);
                }),
                tool(SERVICE_A, "broken", params -> {
                    throw new IllegalStateException(SECRET_DETAIL);
                })));

        workers = new ServiceWorkerPools(2);
        ToolDispatcher dispatcher = new ToolDispatcher(registry, new InputContractValidator(), workers,
                new ToolHubDispatchConfig(), new ToolHubServerConfig());
        mockMvc = MockMvcBuilders.standaloneSetup(new ToolHubController(registry, dispatcher)).build();
    }

    @AfterEach
    void tearDown() {
        workers.close();
    }

    @Test
    void listsServicesWithTheirToolNames() throws Exception {
        mockMvc.perform(get("/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].id").value("github"))
                .andExpect(jsonPath("$[0].name").value("GitHub"))
                .andExpect(jsonPath("$[1].tools[1]").value("list_tickets"));
    }

    @Test
    void listsToolsOptionallyFilteredByService() throws Exception {
        mockMvc.perform(get("/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(10)))
                .andExpect(jsonPath("$[0].name").value("list_repos"))
                .andExpect(jsonPath("$[0].parameters.type").value("object"));

        mockMvc.perform(get("/tools").param("service", "linear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(4)))
                .andExpect(jsonPath("$[3].qualifiedName").value("linear.create_ticket"))
                .andExpect(jsonPath("$[3].parameters.required[0]").value("team_id"));

        mockMvc.perform(get("/tools").param("service", "jira"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.kind").value("ServiceNotFound"));
    }

    @Test
    void describesSingleTool() throws Exception {
        mockMvc.perform(get("/tools/create_issue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("github"))
                .andExpect(jsonPath("$.parameters.properties.repo_id.type").value("integer"));

        mockMvc.perform(get("/tools/merge_pr"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.kind").value("ToolNotFound"));
    }

    @Test
    void executesToolByName() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"list_issues\",\"params\":{\"repo_id\":2}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.service").value("github"))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].repo_id").value(2))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void acceptsParametersAlias() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"get_member\",\"parameters\":{\"user_id\":\"user1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Alice Smith"));
    }

    @Test
    void unknownToolIsNotFound() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"merge_pr\",\"params\":{}}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.error.kind").value("ToolNotFound"));
    }

    @Test
    void missingToolNameAndBadParamsAreValidationErrors() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"params\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("ValidationError"))
                .andExpect(jsonPath("$.error.detail.violations[0].parameter").value("tool_name"));

        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"create_issue\",\"params\":{\"title\":\"t\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.detail.violations[0].parameter").value("repo_id"));
    }

    @Test
    void repoIdBeyondLongRangeIsRejectedWithoutCreatingAnIssue() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"create_issue\",\"params\":{\"repo_id\":18446744073709551617,\"title\":\"wrapped\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("ValidationError"))
                .andExpect(jsonPath("$.error.detail.violations[0].parameter").value("repo_id"))
                .andExpect(jsonPath("$.error.detail.violations[0].reason").value("is out of range for type integer"));

        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"list_issues\",\"params\":{\"repo_id\":1}}"))
                .andExpect(status().isOk())
                .andExpect(content().string(not(containsString("wrapped"))));
    }

    @Test
    void oversizedPriorityIsAnUpstreamRangeError() throws Exception {
        mockMvc.perform(post("/linear/create_ticket")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"team_id\":\"team1\",\"title\":\"t\",\"priority\":4294967296}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.kind").value("UpstreamError"))
                .andExpect(jsonPath("$.error.message", containsString("priority must be between 0 and 3")))
                .andExpect(jsonPath("$.error.detail.upstreamStatus").value(422));
    }

    @Test
    void malformedJsonIsAValidationError() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.kind").value("ValidationError"));
    }

    @Test
    void upstreamFailureMapsToBadGateway() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"flaky\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.kind").value("UpstreamError"))
                .andExpect(jsonPath("$.error.message", containsString("rate limited")))
                .andExpect(jsonPath("$.error.detail.upstreamStatus").value(429));
    }

    @Test
    void internalFailureHidesItsCause() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"broken\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.kind").value("InternalError"))
                .andExpect(jsonPath("$.error.referenceId", notNullValue()))
                .andExpect(content().string(not(containsString(SECRET_DETAIL))));
    }

    @Test
    void executesToolWithinService() throws Exception {
        mockMvc.perform(post("/linear/create_ticket")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"team_id\":\"team2\",\"title\":\"Refresh pricing copy\",\"priority\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("linear"))
                .andExpect(jsonPath("$.data.team_id").value("team2"))
                .andExpect(jsonPath("$.data.priority").value(1));

        mockMvc.perform(post("/linear/list_teams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(3)));

        mockMvc.perform(post("/github/list_tickets").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.kind").value("ToolNotFound"));

        mockMvc.perform(post("/jira/list_tickets").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.kind").value("ServiceNotFound"));
    }
}
