package com.devscontext.core.adapter.slack;

import com.devscontext.common.exception.AdapterException;
import com.devscontext.common.util.TextUtils;
import com.devscontext.core.adapter.DiscussionPatterns;
import com.devscontext.core.adapter.SourceAdapter;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.TicketFields;
import com.devscontext.core.model.slack.SlackContext;
import com.devscontext.core.model.slack.SlackMessage;
import com.devscontext.core.model.slack.SlackThread;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Slack Web API. Uses {@code search.messages} when the token allows it and
 * falls back to scanning the history of the configured channels.
 */
@Component
@Order(3)
@ConditionalOnProperty(prefix = "devscontext.sources.slack", name = "enabled", havingValue = "true")
@Slf4j
public class SlackAdapter implements SourceAdapter {

    public static final String NAME = "slack";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(20);
    private static final int TITLE_KEYWORDS = 5;
    private static final int HISTORY_PAGE_SIZE = 200;
    private static final int THREAD_REPLY_LIMIT = 50;
    private static final int MAX_REPLIES_SHOWN = 10;
    private static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final DevsContextProperties.Slack config;
    private final Clock clock;

    private final Map<String, String> channelIdsByName = new ConcurrentHashMap<>();
    private final Map<String, String> userNames = new ConcurrentHashMap<>();

    public SlackAdapter(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                        DevsContextProperties properties, Clock clock) {
        this.config = properties.getSources().getSlack();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl())
            .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.COMMUNICATION;
    }

    @Override
    public boolean needsPrimaryContext() {
        return true;
    }

    @Override
    public SourceContext fetchTaskContext(String taskId, SourceContext primaryHint, FetchDepth depth) {
        long startTime = System.currentTimeMillis();
        ensureConfigured();

        List<String> queries = new ArrayList<>();
        queries.add(taskId);
        queries.addAll(TextUtils.extractKeywords(TicketFields.from(primaryHint).getTitle()).stream()
            .limit(TITLE_KEYWORDS).toList());

        int budget = Math.min(config.getMaxMessages(), depth.getMaxMessages());
        int perQuery = Math.max(1, budget / queries.size());

        Map<String, RawMessage> matches = new LinkedHashMap<>();
        for (String query : queries) {
            for (RawMessage message : searchMessages(query, perQuery)) {
                matches.putIfAbsent(message.channelId() + ":" + message.ts(), message);
            }
        }

        List<SlackThread> threads = new ArrayList<>();
        List<SlackMessage> standalone = new ArrayList<>();
        Set<String> processedThreads = new LinkedHashSet<>();

        for (RawMessage message : matches.values()) {
            String threadTs = message.threadTs() != null ? message.threadTs() : message.ts();
            if (!processedThreads.add(message.channelId() + ":" + threadTs)) {
                continue;
            }
            if (config.isIncludeThreads() && (message.replyCount() > 0 || message.threadTs() != null)) {
                List<RawMessage> thread = fetchThread(message, threadTs);
                if (!thread.isEmpty()) {
                    threads.add(toThread(thread));
                    continue;
                }
            }
            standalone.add(toMessage(message));
        }

        SlackContext slackContext = new SlackContext(threads, standalone);
        long duration = System.currentTimeMillis() - startTime;
        log.info("[SLACK] Context assembled | taskId={} | queries={} | matches={} | threads={} | standalone={} | durationMs={}",
            taskId, queries.size(), matches.size(), threads.size(), standalone.size(), duration);

        return SourceContext.builder()
            .sourceName(NAME)
            .sourceType(SourceType.COMMUNICATION)
            .data(slackContext)
            .rawText(format(slackContext))
            .metadata(Map.of("threadCount", threads.size(), "standaloneCount", standalone.size()))
            .fetchedAt(clock.instant())
            .build();
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        ensureConfigured();
        List<RawMessage> matches = searchMessages(query, maxResults);
        List<SearchResult> results = new ArrayList<>();
        for (int i = 0; i < matches.size() && results.size() < maxResults; i++) {
            RawMessage message = matches.get(i);
            results.add(SearchResult.builder()
                .sourceName(NAME)
                .sourceType(SourceType.COMMUNICATION)
                .title(message.channelName() != null ? "Slack: #" + message.channelName() : "Slack message")
                .excerpt(TextUtils.truncateText(message.text(), 300))
                .url(message.permalink())
                .relevanceScore(matches.size() <= 1 ? 1.0 : 1.0 - (0.5 * i / (matches.size() - 1)))
                .metadata(Map.of("channel", message.channelName() != null ? message.channelName() : "",
                    "ts", message.ts()))
                .build());
        }
        return results;
    }

    @Override
    public boolean healthCheck() {
        if (config.getBotToken() == null || config.getBotToken().isBlank()) {
            log.warn("[SLACK] Adapter missing bot token");
            return false;
        }
        try {
            JsonNode response = call("auth.test", Map.of());
            if (!response.path("ok").asBoolean(false)) {
                log.warn("[SLACK] Health check failed | error={}", response.path("error").asText());
                return false;
            }
            return true;
        } catch (AdapterException e) {
            log.warn("[SLACK] Health check failed | error={}", e.getMessage());
            return false;
        }
    }

    private List<RawMessage> searchMessages(String query, int maxResults) {
        JsonNode response = call("search.messages", Map.of(
            "query", query,
            "count", String.valueOf(maxResults),
            "sort", "timestamp",
            "sort_dir", "desc"));

        if (response.path("ok").asBoolean(false)) {
            List<RawMessage> found = new ArrayList<>();
            for (JsonNode match : response.path("messages").path("matches")) {
                JsonNode channel = match.path("channel");
                found.add(parse(match, channel.path("id").asText(""), channel.path("name").asText(null)));
            }
            if (!found.isEmpty()) {
                return found;
            }
        } else {
            log.debug("[SLACK] search.messages unavailable, scanning channel history | error={}",
                response.path("error").asText());
        }
        return searchChannelHistory(query, maxResults);
    }

    private List<RawMessage> searchChannelHistory(String query, int maxResults) {
        Map<String, String> channelIds = resolveChannelIds();
        long oldest = clock.instant().minus(Duration.ofDays(config.getLookbackDays())).getEpochSecond();
        List<RawMessage> found = new ArrayList<>();

        for (String channelName : config.getChannels()) {
            String name = channelName.startsWith("#") ? channelName.substring(1) : channelName;
            String channelId = channelIds.get(name);
            if (channelId == null) {
                log.warn("[SLACK] Configured channel not visible to bot | channel={}", name);
                continue;
            }
            JsonNode response = call("conversations.history", Map.of(
                "channel", channelId,
                "oldest", String.valueOf(oldest),
                "limit", String.valueOf(HISTORY_PAGE_SIZE)));
            if (!response.path("ok").asBoolean(false)) {
                continue;
            }
            for (JsonNode message : response.path("messages")) {
                if (TextUtils.containsIgnoreCase(message.path("text").asText(""), query)) {
                    found.add(parse(message, channelId, name));
                    if (found.size() >= maxResults) {
                        return found;
                    }
                }
            }
        }
        return found;
    }

    private List<RawMessage> fetchThread(RawMessage message, String threadTs) {
        JsonNode response = call("conversations.replies", Map.of(
            "channel", message.channelId(),
            "ts", threadTs,
            "limit", String.valueOf(THREAD_REPLY_LIMIT)));
        if (!response.path("ok").asBoolean(false)) {
            return List.of();
        }
        List<RawMessage> thread = new ArrayList<>();
        for (JsonNode reply : response.path("messages")) {
            thread.add(parse(reply, message.channelId(), message.channelName()));
        }
        return thread;
    }

    private SlackThread toThread(List<RawMessage> raw) {
        SlackMessage parent = toMessage(raw.get(0));
        List<SlackMessage> replies = raw.subList(1, raw.size()).stream().map(this::toMessage).toList();

        Set<String> participants = new LinkedHashSet<>();
        List<String> decisions = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        participants.add(parent.getUserName());
        for (SlackMessage message : concat(parent, replies)) {
            participants.add(message.getUserName());
            decisions.addAll(DiscussionPatterns.extractDecisions(message.getText()));
            actions.addAll(DiscussionPatterns.extractActionItems(message.getText()));
        }

        return SlackThread.builder()
            .parent(parent)
            .replies(replies)
            .participants(new ArrayList<>(participants))
            .decisions(decisions.stream().distinct().limit(10).toList())
            .actionItems(actions.stream().distinct().limit(10).toList())
            .build();
    }

    private SlackMessage toMessage(RawMessage raw) {
        return SlackMessage.builder()
            .messageId(raw.ts())
            .channelId(raw.channelId())
            .channelName(raw.channelName() != null ? raw.channelName() : raw.channelId())
            .userId(raw.userId())
            .userName(resolveUserName(raw.userId()))
            .text(raw.text())
            .timestamp(parseTs(raw.ts()))
            .threadTs(raw.threadTs())
            .permalink(raw.permalink())
            .build();
    }

    static String format(SlackContext context) {
        List<String> parts = new ArrayList<>();
        for (SlackThread thread : context.getThreads()) {
            SlackMessage parent = thread.getParent();
            List<String> lines = new ArrayList<>();
            lines.add("## #" + parent.getChannelName() + " Thread");
            lines.add("**Started:** " + (parent.getTimestamp() != null ? MINUTE.format(parent.getTimestamp()) : "Unknown"));
            lines.add("**Participants:** " + String.join(", ", thread.getParticipants()));
            lines.add("");
            lines.add("**" + parent.getUserName() + ":** " + parent.getText());
            thread.getReplies().stream().limit(MAX_REPLIES_SHOWN)
                .forEach(reply -> lines.add("**" + reply.getUserName() + ":** " + reply.getText()));
            if (!thread.getDecisions().isEmpty()) {
                lines.add("\n**Decisions:**");
                thread.getDecisions().forEach(d -> lines.add("- " + d));
            }
            if (!thread.getActionItems().isEmpty()) {
                lines.add("\n**Action Items:**");
                thread.getActionItems().forEach(a -> lines.add("- " + a));
            }
            parts.add(String.join("\n", lines));
        }
        context.getStandaloneMessages().stream().limit(10).forEach(message -> parts.add(
            "**#" + message.getChannelName() + "** ("
                + (message.getTimestamp() != null ? DAY.format(message.getTimestamp()) : "Unknown") + ") **"
                + message.getUserName() + ":** " + message.getText()));
        return String.join("\n\n---\n\n", parts);
    }

    private Map<String, String> resolveChannelIds() {
        if (!channelIdsByName.isEmpty()) {
            return channelIdsByName;
        }
        JsonNode response = call("conversations.list", Map.of(
            "types", "public_channel,private_channel",
            "limit", "200"));
        for (JsonNode channel : response.path("channels")) {
            String name = channel.path("name").asText("");
            String id = channel.path("id").asText("");
            if (!name.isEmpty() && !id.isEmpty()) {
                channelIdsByName.put(name, id);
            }
        }
        return channelIdsByName;
    }

    private String resolveUserName(String userId) {
        if (userId == null) {
            return "unknown";
        }
        String cached = userNames.get(userId);
        if (cached != null) {
            return cached;
        }
        try {
            JsonNode response = call("users.info", Map.of("user", userId));
            JsonNode profile = response.path("user").path("profile");
            String name = firstNonBlank(profile.path("display_name").asText(""),
                profile.path("real_name").asText(""), userId);
            userNames.put(userId, name);
            return name;
        } catch (AdapterException e) {
            log.debug("[SLACK] User lookup failed | userId={} | error={}", userId, e.getMessage());
            return userId;
        }
    }

    private RawMessage parse(JsonNode message, String channelId, String channelName) {
        String ts = message.path("ts").asText("0");
        String threadTs = message.path("thread_ts").asText(null);
        return new RawMessage(
            ts,
            channelId,
            channelName,
            message.path("user").asText(null),
            message.path("text").asText(""),
            threadTs != null && !threadTs.equals(ts) ? threadTs : null,
            message.path("reply_count").asInt(0),
            message.path("permalink").asText(null));
    }

    private JsonNode call(String method, Map<String, String> params) {
        try {
            String body = webClient.get()
                .uri(uri -> {
                    uri.path("/" + method);
                    params.forEach((key, value) -> uri.queryParam(key, "{" + key + "}"));
                    return uri.build(params);
                })
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getBotToken())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(REQUEST_TIMEOUT)
                .block();
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (WebClientResponseException e) {
            throw new AdapterException(NAME, "Slack API error: " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (Exception e) {
            throw new AdapterException(NAME, "Slack request failed: " + e.getMessage(), e);
        }
    }

    private void ensureConfigured() {
        if (config.getBotToken() == null || config.getBotToken().isBlank()) {
            throw new AdapterException(NAME, "Slack adapter requires a bot-token");
        }
    }

    private static Instant parseTs(String ts) {
        try {
            BigDecimal seconds = new BigDecimal(ts);
            return Instant.ofEpochMilli(seconds.movePointRight(3).longValue());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<SlackMessage> concat(SlackMessage first, List<SlackMessage> rest) {
        List<SlackMessage> all = new ArrayList<>(rest.size() + 1);
        all.add(first);
        all.addAll(rest);
        return all;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private record RawMessage(String ts, String channelId, String channelName, String userId, String text,
                              String threadTs, int replyCount, String permalink) {
    }
}
