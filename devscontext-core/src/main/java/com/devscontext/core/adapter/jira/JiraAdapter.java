package com.devscontext.core.adapter.jira;

import com.devscontext.common.exception.AdapterException;
import com.devscontext.common.util.TextUtils;
import com.devscontext.core.adapter.IssueTracker;
import com.devscontext.core.adapter.SourceAdapter;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.jira.JiraComment;
import com.devscontext.core.model.jira.JiraContext;
import com.devscontext.core.model.jira.JiraTicket;
import com.devscontext.core.model.jira.LinkedIssue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Jira Cloud REST v3. Primary adapter: its ticket drives what the other
 * adapters search for.
 */
@Component
@Order(1)
@ConditionalOnProperty(prefix = "devscontext.sources.jira", name = "enabled", havingValue = "true")
@Slf4j
public class JiraAdapter implements SourceAdapter, IssueTracker {

    public static final String NAME = "jira";

    private static final String API_PATH = "/rest/api/3";
    private static final String TICKET_FIELDS =
        "summary,description,status,assignee,labels,components,issuelinks,created,updated,customfield_10016,customfield_10020";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final int SEARCH_EXCERPT_CHARS = 300;
    private static final int WATCHER_PAGE_SIZE = 50;
    private static final DateTimeFormatter JIRA_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");
    private static final Pattern AC_HEADING = Pattern.compile(
        "(?im)^\\s*(?:#+\\s*|h\\d\\.\\s*|\\*+)?acceptance criteria\\s*:?\\**\\s*$");
    private static final Pattern NEXT_HEADING = Pattern.compile("(?m)^\\s*(?:#+\\s|h\\d\\.\\s)");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final DevsContextProperties.Jira config;
    private final Clock clock;

    public JiraAdapter(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                       DevsContextProperties properties, Clock clock) {
        this.config = properties.getSources().getJira();
        this.objectMapper = objectMapper;
        this.clock = clock;
        WebClient.Builder builder = webClientBuilder.clone()
            .baseUrl(StringUtils.hasText(config.getBaseUrl()) ? stripTrailingSlash(config.getBaseUrl()) : "http://localhost")
            .defaultHeader("Accept", "application/json");
        if (StringUtils.hasText(config.getEmail()) && StringUtils.hasText(config.getApiToken())) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(config.getEmail(), config.getApiToken()));
        }
        this.webClient = builder.build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.ISSUE_TRACKER;
    }

    @Override
    public boolean isPrimary() {
        return config.isPrimary();
    }

    @Override
    public SourceContext fetchTaskContext(String taskId, SourceContext primaryHint, FetchDepth depth) {
        long startTime = System.currentTimeMillis();
        ensureConfigured();

        JsonNode issue = get(uri -> uri.path(API_PATH + "/issue/{id}")
            .queryParam("fields", "{fields}")
            .build(taskId, ticketFields()));
        JiraTicket ticket = parseTicket(issue);
        List<LinkedIssue> linkedIssues = parseLinkedIssues(issue.path("fields").path("issuelinks"));
        List<JiraComment> comments = fetchComments(taskId, depth.getMaxComments());

        JiraContext context = JiraContext.builder()
            .ticket(ticket)
            .comments(comments)
            .linkedIssues(linkedIssues)
            .build();

        long duration = System.currentTimeMillis() - startTime;
        log.info("[JIRA] Ticket context fetched | taskId={} | comments={} | linkedIssues={} | durationMs={}",
            taskId, comments.size(), linkedIssues.size(), duration);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status", ticket.getStatus());
        metadata.put("commentCount", comments.size());
        metadata.put("linkedIssueCount", linkedIssues.size());
        if (ticket.getUpdated() != null) {
            metadata.put("updated", ticket.getUpdated().toString());
        }

        return SourceContext.builder()
            .sourceName(NAME)
            .sourceType(SourceType.ISSUE_TRACKER)
            .data(context)
            .rawText(format(context))
            .metadata(metadata)
            .fetchedAt(clock.instant())
            .build();
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        ensureConfigured();
        String jql = "text ~ \"" + escapeJql(query) + "\" ORDER BY updated DESC";
        JsonNode response = get(uri -> uri.path(API_PATH + "/search")
            .queryParam("jql", "{jql}")
            .queryParam("maxResults", maxResults)
            .queryParam("fields", "summary,status,description")
            .build(jql));

        List<SearchResult> results = new ArrayList<>();
        JsonNode issues = response.path("issues");
        for (int i = 0; i < issues.size() && results.size() < maxResults; i++) {
            JsonNode issue = issues.get(i);
            String key = issue.path("key").asText();
            JsonNode fields = issue.path("fields");
            String description = AdfText.toText(fields.path("description"));
            results.add(SearchResult.builder()
                .sourceName(NAME)
                .sourceType(SourceType.ISSUE_TRACKER)
                .title("[" + key + "] " + fields.path("summary").asText(""))
                .excerpt(description != null ? TextUtils.truncateText(description, SEARCH_EXCERPT_CHARS) : "")
                .url(stripTrailingSlash(config.getBaseUrl()) + "/browse/" + key)
                .relevanceScore(rankScore(i, issues.size()))
                .metadata(Map.of("status", fields.path("status").path("name").asText("Unknown")))
                .build());
        }
        return results;
    }

    @Override
    public List<TrackedIssue> findIssues(String status, List<String> projects, int maxResults) {
        ensureConfigured();
        String jql = buildWatcherJql(status, projects);
        JsonNode response = get(uri -> uri.path(API_PATH + "/search")
            .queryParam("jql", "{jql}")
            .queryParam("maxResults", Math.min(maxResults, WATCHER_PAGE_SIZE))
            .queryParam("fields", "key,updated")
            .build(jql));

        List<TrackedIssue> issues = new ArrayList<>();
        for (JsonNode issue : response.path("issues")) {
            issues.add(new TrackedIssue(issue.path("key").asText(),
                parseDate(issue.path("fields").path("updated").asText(null))));
        }
        log.info("[JIRA] Watcher query | status={} | projects={} | found={}", status, projects, issues.size());
        return issues;
    }

    @Override
    public boolean healthCheck() {
        if (!isConfigured()) {
            log.warn("[JIRA] Adapter missing required configuration");
            return false;
        }
        try {
            get(uri -> uri.path(API_PATH + "/myself").build());
            return true;
        } catch (AdapterException e) {
            log.warn("[JIRA] Health check failed | error={}", e.getMessage());
            return false;
        }
    }

    static String buildWatcherJql(String status, List<String> projects) {
        StringBuilder jql = new StringBuilder();
        if (projects != null && projects.size() == 1) {
            jql.append("project = \"").append(escapeJql(projects.get(0))).append("\" AND ");
        } else if (projects != null && projects.size() > 1) {
            jql.append("project IN (")
                .append(projects.stream().map(p -> "\"" + escapeJql(p) + "\"").collect(Collectors.joining(", ")))
                .append(") AND ");
        }
        jql.append("status = \"").append(escapeJql(status)).append("\" ORDER BY updated DESC");
        return jql.toString();
    }

    static String extractAcceptanceCriteria(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        Matcher heading = AC_HEADING.matcher(description);
        if (!heading.find()) {
            return null;
        }
        String rest = description.substring(heading.end());
        Matcher next = NEXT_HEADING.matcher(rest);
        String section = next.find() ? rest.substring(0, next.start()) : rest;
        section = section.strip();
        return section.isEmpty() ? null : section;
    }

    private JiraTicket parseTicket(JsonNode issue) {
        JsonNode fields = issue.path("fields");
        String description = AdfText.toText(fields.path("description"));

        String acceptanceCriteria = null;
        if (StringUtils.hasText(config.getAcceptanceCriteriaField())) {
            acceptanceCriteria = AdfText.toText(fields.path(config.getAcceptanceCriteriaField()));
        }
        if (acceptanceCriteria == null || acceptanceCriteria.isBlank()) {
            acceptanceCriteria = extractAcceptanceCriteria(description);
        }

        List<String> labels = new ArrayList<>();
        fields.path("labels").forEach(label -> labels.add(label.asText()));
        List<String> components = new ArrayList<>();
        fields.path("components").forEach(component -> components.add(component.path("name").asText()));

        JsonNode sprints = fields.path("customfield_10020");
        String sprint = sprints.isArray() && sprints.size() > 0
            ? sprints.get(sprints.size() - 1).path("name").asText(null)
            : null;

        return JiraTicket.builder()
            .ticketId(issue.path("key").asText())
            .title(fields.path("summary").asText(""))
            .description(description)
            .status(fields.path("status").path("name").asText("Unknown"))
            .assignee(fields.path("assignee").path("displayName").asText(null))
            .labels(labels)
            .components(components)
            .acceptanceCriteria(acceptanceCriteria)
            .storyPoints(fields.path("customfield_10016").isNumber() ? fields.path("customfield_10016").asDouble() : null)
            .sprint(sprint)
            .created(parseDate(fields.path("created").asText(null)))
            .updated(parseDate(fields.path("updated").asText(null)))
            .build();
    }

    private List<LinkedIssue> parseLinkedIssues(JsonNode links) {
        List<LinkedIssue> linked = new ArrayList<>();
        for (JsonNode link : links) {
            JsonNode type = link.path("type");
            JsonNode issue;
            String direction;
            if (link.has("outwardIssue")) {
                issue = link.path("outwardIssue");
                direction = type.path("outward").asText(type.path("name").asText("Related"));
            } else if (link.has("inwardIssue")) {
                issue = link.path("inwardIssue");
                direction = type.path("inward").asText(type.path("name").asText("Related"));
            } else {
                continue;
            }
            linked.add(new LinkedIssue(
                issue.path("key").asText(),
                issue.path("fields").path("summary").asText(""),
                issue.path("fields").path("status").path("name").asText("Unknown"),
                direction));
        }
        return linked;
    }

    private List<JiraComment> fetchComments(String taskId, int maxComments) {
        try {
            JsonNode response = get(uri -> uri.path(API_PATH + "/issue/{id}/comment")
                .queryParam("maxResults", maxComments)
                .queryParam("orderBy", "-created")
                .build(taskId));
            List<JiraComment> comments = new ArrayList<>();
            for (JsonNode comment : response.path("comments")) {
                comments.add(new JiraComment(
                    comment.path("author").path("displayName").asText("Unknown"),
                    AdfText.toText(comment.path("body")),
                    parseDate(comment.path("created").asText(null))));
            }
            return comments;
        } catch (AdapterException e) {
            // Ticket without comments is still useful
            log.warn("[JIRA] Failed to fetch comments | taskId={} | error={}", taskId, e.getMessage());
            return List.of();
        }
    }

    private String format(JiraContext context) {
        JiraTicket ticket = context.getTicket();
        List<String> parts = new ArrayList<>();
        parts.add("# [" + ticket.getTicketId() + "] " + ticket.getTitle());
        parts.add("## Description\n" + (ticket.getDescription() != null ? ticket.getDescription() : "No description"));

        if (ticket.getAcceptanceCriteria() != null) {
            parts.add("## Acceptance Criteria\n" + ticket.getAcceptanceCriteria());
        }

        parts.add("\n## Details");
        parts.add("- **Status:** " + ticket.getStatus());
        if (ticket.getAssignee() != null) {
            parts.add("- **Assignee:** " + ticket.getAssignee());
        }
        if (!ticket.getComponents().isEmpty()) {
            parts.add("- **Components:** " + String.join(", ", ticket.getComponents()));
        }
        if (!ticket.getLabels().isEmpty()) {
            parts.add("- **Labels:** " + String.join(", ", ticket.getLabels()));
        }
        if (ticket.getSprint() != null) {
            parts.add("- **Sprint:** " + ticket.getSprint());
        }

        if (!context.getComments().isEmpty()) {
            parts.add("\n## Comments (" + context.getComments().size() + ")");
            for (JiraComment comment : context.getComments()) {
                String date = comment.getCreated() != null ? comment.getCreated().toString().substring(0, 10) : "Unknown";
                parts.add("\n**" + comment.getAuthor() + "** (" + date + "):");
                parts.add(comment.getBody() != null ? comment.getBody() : "");
            }
        }

        if (!context.getLinkedIssues().isEmpty()) {
            parts.add("\n## Linked Issues (" + context.getLinkedIssues().size() + ")");
            for (LinkedIssue linked : context.getLinkedIssues()) {
                parts.add("- [" + linked.getTicketId() + "] " + linked.getTitle()
                    + " (" + linked.getStatus() + ") - " + linked.getLinkType());
            }
        }
        return String.join("\n", parts);
    }

    private JsonNode get(Function<UriBuilder, URI> uriFunction) {
        try {
            String body = webClient.get()
                .uri(uriFunction)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(REQUEST_TIMEOUT)
                .block();
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            String message = status == 404 ? "Jira issue not found" : "Jira API error: " + status + " " + e.getStatusText();
            throw new AdapterException(NAME, message, e);
        } catch (AdapterException e) {
            throw e;
        } catch (Exception e) {
            throw new AdapterException(NAME, "Jira request failed: " + e.getMessage(), e);
        }
    }

    private String ticketFields() {
        return StringUtils.hasText(config.getAcceptanceCriteriaField())
            ? TICKET_FIELDS + "," + config.getAcceptanceCriteriaField()
            : TICKET_FIELDS;
    }

    private boolean isConfigured() {
        return StringUtils.hasText(config.getBaseUrl()) && StringUtils.hasText(config.getEmail())
            && StringUtils.hasText(config.getApiToken());
    }

    private void ensureConfigured() {
        if (!isConfigured()) {
            throw new AdapterException(NAME, "Jira adapter requires base-url, email and api-token");
        }
    }

    private static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, JIRA_DATE).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException ignored) {
                log.debug("[JIRA] Unparseable date | value={}", value);
                return null;
            }
        }
    }

    private static double rankScore(int index, int total) {
        return total <= 1 ? 1.0 : 1.0 - (0.5 * index / (total - 1));
    }

    private static String escapeJql(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
