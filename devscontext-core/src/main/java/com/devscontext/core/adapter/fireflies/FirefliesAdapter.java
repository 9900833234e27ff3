package com.devscontext.core.adapter.fireflies;

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
import com.devscontext.core.model.meeting.MeetingContext;
import com.devscontext.core.model.meeting.MeetingExcerpt;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Meeting transcripts from the Fireflies.ai GraphQL API.
 */
@Component
@Order(2)
@ConditionalOnProperty(prefix = "devscontext.sources.fireflies", name = "enabled", havingValue = "true")
@Slf4j
public class FirefliesAdapter implements SourceAdapter {

    public static final String NAME = "fireflies";

    static final String TRANSCRIPTS_QUERY = """
        query Transcripts($keyword: String, $limit: Int) {
          transcripts(keyword: $keyword, limit: $limit) {
            id
            title
            date
            participants
            sentences { text speaker_name }
            summary { action_items }
          }
        }
        """;

    private static final String HEALTH_QUERY = "query { user { email } }";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_SENTENCES_PER_MEETING = 20;
    private static final int TITLE_KEYWORDS = 3;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final DevsContextProperties.Fireflies config;
    private final Clock clock;

    public FirefliesAdapter(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                            DevsContextProperties properties, Clock clock) {
        this.config = properties.getSources().getFireflies();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json")
            .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.MEETING;
    }

    @Override
    public boolean needsPrimaryContext() {
        return true;
    }

    @Override
    public SourceContext fetchTaskContext(String taskId, SourceContext primaryHint, FetchDepth depth) {
        long startTime = System.currentTimeMillis();
        ensureConfigured();

        List<String> terms = new ArrayList<>();
        terms.add(taskId);
        String title = TicketFields.from(primaryHint).getTitle();
        terms.addAll(TextUtils.extractKeywords(title).stream().limit(TITLE_KEYWORDS).collect(Collectors.toList()));

        // Search by ticket id, then by title keywords, deduplicating transcripts
        Map<String, JsonNode> transcripts = new LinkedHashMap<>();
        for (String term : terms) {
            for (JsonNode transcript : queryTranscripts(term, depth.getMaxMeetings())) {
                transcripts.putIfAbsent(transcript.path("id").asText(), transcript);
            }
            if (transcripts.size() >= depth.getMaxMeetings()) {
                break;
            }
        }

        List<MeetingExcerpt> meetings = new ArrayList<>();
        for (JsonNode transcript : transcripts.values()) {
            MeetingExcerpt excerpt = toExcerpt(transcript, terms);
            if (excerpt != null) {
                meetings.add(excerpt);
            }
            if (meetings.size() >= depth.getMaxMeetings()) {
                break;
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("[FIREFLIES] Meeting context fetched | taskId={} | terms={} | transcripts={} | meetings={} | durationMs={}",
            taskId, terms.size(), transcripts.size(), meetings.size(), duration);

        return SourceContext.builder()
            .sourceName(NAME)
            .sourceType(SourceType.MEETING)
            .data(new MeetingContext(meetings))
            .rawText(format(meetings))
            .metadata(Map.of("meetingCount", meetings.size()))
            .fetchedAt(clock.instant())
            .build();
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        ensureConfigured();
        List<SearchResult> results = new ArrayList<>();
        List<JsonNode> transcripts = queryTranscripts(query, maxResults);
        for (int i = 0; i < transcripts.size() && results.size() < maxResults; i++) {
            JsonNode transcript = transcripts.get(i);
            MeetingExcerpt excerpt = toExcerpt(transcript, List.of(query));
            String text = excerpt != null ? excerpt.getExcerpt() : transcript.path("title").asText("");
            results.add(SearchResult.builder()
                .sourceName(NAME)
                .sourceType(SourceType.MEETING)
                .title("Meeting: " + transcript.path("title").asText("Untitled"))
                .excerpt(TextUtils.truncateText(text, 300))
                .relevanceScore(transcripts.size() <= 1 ? 1.0 : 1.0 - (0.5 * i / (transcripts.size() - 1)))
                .metadata(Map.of("transcriptId", transcript.path("id").asText()))
                .build());
        }
        return results;
    }

    @Override
    public boolean healthCheck() {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[FIREFLIES] Adapter missing API key");
            return false;
        }
        try {
            graphql(HEALTH_QUERY, Map.of());
            return true;
        } catch (AdapterException e) {
            log.warn("[FIREFLIES] Health check failed | error={}", e.getMessage());
            return false;
        }
    }

    private List<JsonNode> queryTranscripts(String keyword, int limit) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("keyword", keyword);
        variables.put("limit", limit);
        JsonNode data = graphql(TRANSCRIPTS_QUERY, variables);
        List<JsonNode> transcripts = new ArrayList<>();
        data.path("transcripts").forEach(transcripts::add);
        return transcripts;
    }

    /**
     * Keeps the sentences that mention one of the search terms. Returns null
     * when the transcript has no relevant sentence and its title does not match.
     */
    private MeetingExcerpt toExcerpt(JsonNode transcript, List<String> terms) {
        String title = transcript.path("title").asText("Untitled meeting");
        List<String> matching = new ArrayList<>();
        List<String> decisions = new ArrayList<>();
        Set<String> speakers = new LinkedHashSet<>();

        for (JsonNode sentence : transcript.path("sentences")) {
            String text = sentence.path("text").asText("");
            if (terms.stream().anyMatch(term -> TextUtils.containsIgnoreCase(text, term))) {
                String speaker = sentence.path("speaker_name").asText("Unknown");
                speakers.add(speaker);
                if (matching.size() < MAX_SENTENCES_PER_MEETING) {
                    matching.add("**" + speaker + ":** " + text);
                }
                decisions.addAll(DiscussionPatterns.extractDecisions(text));
            }
        }

        boolean titleMatches = terms.stream().anyMatch(term -> TextUtils.containsIgnoreCase(title, term));
        if (matching.isEmpty() && !titleMatches) {
            return null;
        }

        List<String> participants = new ArrayList<>();
        transcript.path("participants").forEach(p -> participants.add(p.asText()));
        if (participants.isEmpty()) {
            participants.addAll(speakers);
        }

        JsonNode dateNode = transcript.path("date");
        Instant date = dateNode.isNumber() ? Instant.ofEpochMilli(dateNode.asLong()) : null;

        return MeetingExcerpt.builder()
            .meetingTitle(title)
            .meetingDate(date)
            .participants(participants)
            .excerpt(String.join("\n", matching))
            .actionItems(parseActionItems(transcript.path("summary").path("action_items")))
            .decisions(decisions.stream().distinct().limit(10).collect(Collectors.toList()))
            .build();
    }

    private List<String> parseActionItems(JsonNode node) {
        List<String> items = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> items.add(item.asText()));
        } else if (node.isTextual()) {
            for (String line : node.asText().split("\\R")) {
                String trimmed = line.strip();
                // "**Speaker**" lines group the items by owner
                if (trimmed.startsWith("**")) {
                    continue;
                }
                String item = trimmed.replaceFirst("^[*\\-•]+", "").strip();
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
        }
        return items.stream().limit(10).collect(Collectors.toList());
    }

    static String format(List<MeetingExcerpt> meetings) {
        List<String> parts = new ArrayList<>();
        for (MeetingExcerpt meeting : meetings) {
            StringBuilder part = new StringBuilder();
            part.append("## Meeting: ").append(meeting.getMeetingTitle());
            if (meeting.getMeetingDate() != null) {
                part.append(" (").append(DAY.format(meeting.getMeetingDate())).append(')');
            }
            if (!meeting.getParticipants().isEmpty()) {
                part.append("\n**Participants:** ").append(String.join(", ", meeting.getParticipants()));
            }
            if (meeting.getExcerpt() != null && !meeting.getExcerpt().isBlank()) {
                part.append("\n\n").append(meeting.getExcerpt());
            }
            if (!meeting.getDecisions().isEmpty()) {
                part.append("\n\n**Decisions:**");
                meeting.getDecisions().forEach(d -> part.append("\n- ").append(d));
            }
            if (!meeting.getActionItems().isEmpty()) {
                part.append("\n\n**Action Items:**");
                meeting.getActionItems().forEach(a -> part.append("\n- ").append(a));
            }
            parts.add(part.toString());
        }
        return String.join("\n\n---\n\n", parts);
    }

    private JsonNode graphql(String query, Map<String, Object> variables) {
        try {
            String body = webClient.post()
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .bodyValue(Map.of("query", query, "variables", variables))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(REQUEST_TIMEOUT)
                .block();
            JsonNode root = objectMapper.readTree(body == null ? "{}" : body);
            JsonNode errors = root.path("errors");
            if (errors.isArray() && errors.size() > 0) {
                throw new AdapterException(NAME, "Fireflies GraphQL error: " + errors.get(0).path("message").asText("unknown"));
            }
            return root.path("data");
        } catch (WebClientResponseException e) {
            throw new AdapterException(NAME, "Fireflies API error: " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (AdapterException e) {
            throw e;
        } catch (Exception e) {
            throw new AdapterException(NAME, "Fireflies request failed: " + e.getMessage(), e);
        }
    }

    private void ensureConfigured() {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new AdapterException(NAME, "Fireflies adapter requires an api-key");
        }
    }
}
