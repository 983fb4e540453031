package com.github.salilvnair.toolhub.service.linear;

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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Linear integration backed by an in-memory workspace (teams, tickets, members).
 * Tool names are ticket/member flavoured so they never collide with the GitHub tools.
 */
@Slf4j
@Order(2)
@Component
@ConditionalOnProperty(prefix = "toolhub.services.linear", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LinearServiceAdapter implements ServiceAdapter {

    public static final String TOOL_LIST_TEAMS = "list_teams";
    public static final String TOOL_LIST_TICKETS = "list_tickets";
    public static final String TOOL_GET_MEMBER = "get_member";
    public static final String TOOL_CREATE_TICKET = "create_ticket";

    private static final int DEFAULT_PRIORITY = 2;
    private static final int MAX_PRIORITY = 3;

    private final ToolHubServicesConfig.Service config;

    private final List<LinearTeam> teams = List.of(
            new LinearTeam("team1", "Engineering", "ENG", "Engineering team"),
            new LinearTeam("team2", "Product", "PROD", "Product team"),
            new LinearTeam("team3", "Security", "SEC", "Security team")
    );

    private final List<LinearMember> members = List.of(
            new LinearMember("user1", "Alice Smith", "alice@example.com", true),
            new LinearMember("user2", "Bob Johnson", "bob@example.com", true),
            new LinearMember("user3", "Charlie Brown", "charlie@example.com", false)
    );

    private final List<LinearTicket> tickets = new CopyOnWriteArrayList<>(List.of(
            new LinearTicket("issue1", "team1", "Implement new feature",
                    "Implement the new user profile feature", "todo", 1, List.of("feature", "frontend"), "user1"),
            new LinearTicket("issue2", "team1", "Fix login bug",
                    "Users can't log in with certain email domains", "in_progress", 2, List.of("bug", "critical"), "user2"),
            new LinearTicket("issue3", "team3", "Security audit findings",
                    "Address security findings from the recent audit", "todo", 0, List.of("security", "urgent"), "user1"),
            new LinearTicket("issue4", "team2", "Update pricing page",
                    "Update the pricing page with new plans", "done", 3, List.of("marketing"), "user3")
    ));

    private final AtomicInteger nextTicketNumber = new AtomicInteger(5);

    public LinearServiceAdapter(ToolHubServicesConfig servicesConfig) {
        this.config = servicesConfig.getLinear();
    }

    @Override
    public ServiceDescriptor describeService() {
        return new ServiceDescriptor(
                ToolHubConstants.SERVICE_LINEAR,
                "Linear",
                "Linear API service for issue tracking",
                config.getBaseEndpoint(),
                CredentialRef.env(config.getCredentialEnv()));
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return List.of(
                new ToolDescriptor(TOOL_LIST_TEAMS, "List Linear teams", InputContract.builder().build()),
                new ToolDescriptor(TOOL_LIST_TICKETS, "List Linear tickets",
                        InputContract.builder()
                                .property("team_id", ToolHubConstants.PARAM_TYPE_STRING, "Team ID to filter tickets by")
                                .property("state", ToolHubConstants.PARAM_TYPE_STRING, "Ticket state (todo, in_progress, done)")
                                .property("assignee_id", ToolHubConstants.PARAM_TYPE_STRING, "Assignee ID to filter tickets by")
                                .property("priority", ToolHubConstants.PARAM_TYPE_INTEGER, "Priority to filter tickets by (0-3)")
                                .build()),
                new ToolDescriptor(TOOL_GET_MEMBER, "Get a Linear member by ID or email",
                        InputContract.builder()
                                .property("user_id", ToolHubConstants.PARAM_TYPE_STRING, "Member ID")
                                .property("email", ToolHubConstants.PARAM_TYPE_STRING, "Member email")
                                .build()),
                new ToolDescriptor(TOOL_CREATE_TICKET, "Create a new Linear ticket",
                        InputContract.builder()
                                .property("team_id", ToolHubConstants.PARAM_TYPE_STRING, "Team ID")
                                .property("title", ToolHubConstants.PARAM_TYPE_STRING, "Ticket title")
                                .property("description", ToolHubConstants.PARAM_TYPE_STRING, "Ticket description")
                                .property("priority", ToolHubConstants.PARAM_TYPE_INTEGER, "Ticket priority (0-3)")
                                .property("assignee_id", ToolHubConstants.PARAM_TYPE_STRING, "Assignee ID")
                                .required("team_id", "title")
                                .build())
        );
    }

    @Override
    public Object handle(String toolName, Map<String, Object> params) {
        return switch (toolName) {
            case TOOL_LIST_TEAMS -> teams;
            case TOOL_LIST_TICKETS -> listTickets(params);
            case TOOL_GET_MEMBER -> getMember(params);
            case TOOL_CREATE_TICKET -> createTicket(params);
            default -> throw new IllegalArgumentException("Linear adapter does not implement tool " + toolName);
        };
    }

    private List<LinearTicket> listTickets(Map<String, Object> params) {
        String teamId = ToolParams.string(params, "team_id");
        String state = ToolParams.string(params, "state");
        String assigneeId = ToolParams.string(params, "assignee_id");
        Long priority = ToolParams.longValue(params, "priority");
        return tickets.stream()
                .filter(ticket -> teamId == null || ticket.teamId().equals(teamId))
                .filter(ticket -> state == null || ticket.state().equals(state))
                .filter(ticket -> assigneeId == null || assigneeId.equals(ticket.assigneeId()))
                .filter(ticket -> priority == null || ticket.priority() == priority)
                .toList();
    }

    private LinearMember getMember(Map<String, Object> params) {
        String userId = ToolParams.string(params, "user_id");
        String email = ToolParams.string(params, "email");
        if (userId == null && email == null) {
            throw new UpstreamServiceException("user_id or email is required",
                    ToolHubConstants.UPSTREAM_CODE_UNPROCESSABLE, 422);
        }
        return members.stream()
                .filter(member -> member.id().equals(userId) || member.email().equals(email))
                .findFirst()
                .orElseThrow(() -> new UpstreamServiceException("Member not found",
                        ToolHubConstants.UPSTREAM_CODE_NOT_FOUND, 404));
    }

    private LinearTicket createTicket(Map<String, Object> params) {
        String teamId = ToolParams.string(params, "team_id");
        String title = ToolParams.string(params, "title");
        Long requestedPriority = ToolParams.longValue(params, "priority");
        long priority = requestedPriority == null ? DEFAULT_PRIORITY : requestedPriority;
        if (priority < 0 || priority > MAX_PRIORITY) {
            throw new UpstreamServiceException("priority must be between 0 and " + MAX_PRIORITY,
                    ToolHubConstants.UPSTREAM_CODE_UNPROCESSABLE, 422)
                    .withDetail(Map.of("priority", priority));
        }
        boolean teamExists = teams.stream().anyMatch(team -> team.id().equals(teamId));
        if (!teamExists) {
            throw new UpstreamServiceException("Team with ID " + teamId + " not found",
                    ToolHubConstants.UPSTREAM_CODE_NOT_FOUND, 404);
        }
        String description = ToolParams.string(params, "description");
        LinearTicket ticket = new LinearTicket(
                "issue" + nextTicketNumber.getAndIncrement(),
                teamId,
                title,
                description == null ? "" : description,
                "todo",
                (int) priority,
                List.of(),
                ToolParams.string(params, "assignee_id"));
        tickets.add(ticket);
        log.debug("Created Linear ticket id={} teamId={}", ticket.id(), teamId);
        return ticket;
    }
}
