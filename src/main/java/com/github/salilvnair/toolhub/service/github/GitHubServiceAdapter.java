package com.github.salilvnair.toolhub.service.github;

import com.github.salilvnair.toolhub.config.ToolHubServicesConfig;
import com.github.salilvnair.toolhub.engine.ToolHubConstants;
import com.github.salilvnair.toolhub.engine.adapter.ServiceAdapter;
import com.github.salilvnair.toolhub.engine.adapter.ServiceDescriptor;
import com.github.salilvnair.toolhub.engine.adapter.ToolDescriptor;
import com.github.salilvnair.toolhub.engine.adapter.ToolParams;
import com.github.salilvnair.toolhub.engine.exception.UpstreamServiceException;
import com.github.salilvnair.toolhub.engine.model.CredentialRef;
import com.github.salilvnair.toolhub.engine.model.InputContract;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * GitHub integration backed by an in-memory data set that mirrors the shape of the GitHub REST API.
 * Created issues are kept for the lifetime of the process.
 */
@Slf4j
@Order(1)
@Component
@ConditionalOnProperty(prefix = "toolhub.services.github", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GitHubServiceAdapter implements ServiceAdapter {

    public static final String TOOL_LIST_REPOS = "list_repos";
    public static final String TOOL_LIST_ISSUES = "list_issues";
    public static final String TOOL_GET_USER = "get_user";
    public static final String TOOL_CREATE_ISSUE = "create_issue";

    private final ToolHubServicesConfig.Service config;

    private final List<GitHubRepository> repositories = List.of(
            new GitHubRepository(1, "security-project", false, "A project about security"),
            new GitHubRepository(2, "private-repo", true, "Contains sensitive data"),
            new GitHubRepository(3, "public-apis", false, "Collection of public APIs")
    );

    private final List<GitHubUser> users = List.of(
            new GitHubUser(201, "admin", "admin@example.com", "admin"),
            new GitHubUser(202, "developer", "dev@example.com", "developer"),
            new GitHubUser(203, "guest", "guest@example.com", "guest")
    );

    private final List<GitHubIssue> issues = new CopyOnWriteArrayList<>(List.of(
            new GitHubIssue(101, 1, "Security vulnerability found",
                    "Found a critical security issue in the authentication module", List.of("security", "critical"), "open"),
            new GitHubIssue(102, 1, "Update documentation",
                    "Documentation needs to be updated for the new features", List.of("documentation"), "closed"),
            new GitHubIssue(103, 2, "API Keys exposed",
                    "The API keys for production are exposed in the code", List.of("security", "critical", "confidential"), "open"),
            new GitHubIssue(104, 3, "Add new API endpoints",
                    "Need to add endpoints for the new features", List.of("enhancement"), "open")
    ));

    private final AtomicLong nextIssueId = new AtomicLong(105);

    public GitHubServiceAdapter(ToolHubServicesConfig servicesConfig) {
        this.config = servicesConfig.getGithub();
    }

    @Override
    public ServiceDescriptor describeService() {
        return new ServiceDescriptor(
                ToolHubConstants.SERVICE_GITHUB,
                "GitHub",
                "GitHub API service for repository management",
                config.getBaseEndpoint(),
                CredentialRef.env(config.getCredentialEnv()));
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return List.of(
                new ToolDescriptor(TOOL_LIST_REPOS, "List GitHub repositories",
                        InputContract.builder()
                                .property("include_private", ToolHubConstants.PARAM_TYPE_BOOLEAN,
                                        "Whether to include private repositories")
                                .build()),
                new ToolDescriptor(TOOL_LIST_ISSUES, "List GitHub issues",
                        InputContract.builder()
                                .property("repo_id", ToolHubConstants.PARAM_TYPE_INTEGER, "Repository ID to filter issues by")
                                .property("state", ToolHubConstants.PARAM_TYPE_STRING, "Issue state (open, closed)")
                                .property("labels", ToolHubConstants.PARAM_TYPE_ARRAY, "Labels to filter issues by")
                                .build()),
                new ToolDescriptor(TOOL_GET_USER, "Get a GitHub user by ID or username",
                        InputContract.builder()
                                .property("user_id", ToolHubConstants.PARAM_TYPE_INTEGER, "User ID")
                                .property("username", ToolHubConstants.PARAM_TYPE_STRING, "Username")
                                .build()),
                new ToolDescriptor(TOOL_CREATE_ISSUE, "Create a new GitHub issue",
                        InputContract.builder()
                                .property("repo_id", ToolHubConstants.PARAM_TYPE_INTEGER, "Repository ID")
                                .property("title", ToolHubConstants.PARAM_TYPE_STRING, "Issue title")
                                .property("body", ToolHubConstants.PARAM_TYPE_STRING, "Issue body")
                                .property("labels", ToolHubConstants.PARAM_TYPE_ARRAY, "Issue labels")
                                .required("repo_id", "title")
                                .build())
        );
    }

    @Override
    public Object handle(String toolName, Map<String, Object> params) {
        return switch (toolName) {
            case TOOL_LIST_REPOS -> listRepos(params);
            case TOOL_LIST_ISSUES -> listIssues(params);
            case TOOL_GET_USER -> getUser(params);
            case TOOL_CREATE_ISSUE -> createIssue(params);
            default -> throw new IllegalArgumentException("GitHub adapter does not implement tool " + toolName);
        };
    }

    private List<GitHubRepository> listRepos(Map<String, Object> params) {
        boolean includePrivate = ToolParams.bool(params, "include_private", false);
        return repositories.stream()
                .filter(repo -> includePrivate || !repo.privateRepo())
                .toList();
    }

    private List<GitHubIssue> listIssues(Map<String, Object> params) {
        Long repoId = ToolParams.longValue(params, "repo_id");
        String state = ToolParams.string(params, "state");
        List<String> labels = ToolParams.stringList(params, "labels");
        return issues.stream()
                .filter(issue -> repoId == null || issue.repoId() == repoId)
                .filter(issue -> state == null || state.isBlank() || issue.state().equals(state))
                .filter(issue -> labels.isEmpty() || issue.labels().stream().anyMatch(labels::contains))
                .toList();
    }

    private GitHubUser getUser(Map<String, Object> params) {
        Long userId = ToolParams.longValue(params, "user_id");
        String username = ToolParams.string(params, "username");
        if (userId == null && (username == null || username.isBlank())) {
            throw new UpstreamServiceException("user_id or username is required",
                    ToolHubConstants.UPSTREAM_CODE_UNPROCESSABLE, 422);
        }
        return users.stream()
                .filter(user -> (userId != null && user.id() == userId)
                        || (username != null && user.username().equals(username)))
                .findFirst()
                .orElseThrow(() -> new UpstreamServiceException("User not found",
                        ToolHubConstants.UPSTREAM_CODE_NOT_FOUND, 404));
    }

    private GitHubIssue createIssue(Map<String, Object> params) {
        long repoId = ToolParams.longValue(params, "repo_id");
        String title = ToolParams.string(params, "title");
        if (title.isBlank()) {
            throw new UpstreamServiceException("title must not be blank",
                    ToolHubConstants.UPSTREAM_CODE_UNPROCESSABLE, 422);
        }
        boolean repoExists = repositories.stream().anyMatch(repo -> repo.id() == repoId);
        if (!repoExists) {
            throw new UpstreamServiceException("Repository with ID " + repoId + " not found",
                    ToolHubConstants.UPSTREAM_CODE_NOT_FOUND, 404);
        }
        String body = ToolParams.string(params, "body");
        GitHubIssue issue = new GitHubIssue(
                nextIssueId.getAndIncrement(),
                repoId,
                title,
                body == null ? "" : body,
                new ArrayList<>(ToolParams.stringList(params, "labels")),
                "open");
        issues.add(issue);
        log.debug("Created GitHub issue id={} repoId={}", issue.id(), repoId);
        return issue;
    }
}
