package com.devscontext.core.adapter.slack;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.devscontext.common.exception.AdapterException;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.slack.SlackContext;
import com.devscontext.core.model.slack.SlackThread;
import com.devscontext.core.support.Fixtures;
import com.devscontext.core.support.MutableClock;
import com.devscontext.core.support.StubExchange;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.util.List;

class SlackAdapterTest {

    private static final String SEARCH_JSON = """
        {"ok": true, "messages": {"matches": [
          {"ts": "1709287200.000100", "user": "U1", "text": "PROJ-123 webhook retries are failing", "reply_count": 2,
           "channel": {"id": "C1", "name": "payments-eng"}, "permalink": "https://acme.slack.com/p1"},
          {"ts": "1709290800.000200", "user": "U1", "text": "deploying webhook fix",
           "channel": {"id": "C1", "name": "payments-eng"}}
        ]}}
        """;

    private static final String REPLIES_JSON = """
        {"ok": true, "messages": [
          {"ts": "1709287200.000100", "user": "U1", "text": "PROJ-123 webhook retries are failing", "reply_count": 2},
          {"ts": "1709287300.000100", "thread_ts": "1709287200.000100", "user": "U1", "text": "We decided to use exponential backoff for retries"},
          {"ts": "1709287400.000100", "thread_ts": "1709287200.000100", "user": "U1", "text": "I'll update the runbook tomorrow"}
        ]}
        """;

    private static final String USER_JSON = """
        {"ok": true, "user": {"profile": {"display_name": "dana", "real_name": "Dana Kim"}}}
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-02T00:00:00Z"));
    private DevsContextProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DevsContextProperties();
        DevsContextProperties.Slack slack = properties.getSources().getSlack();
        slack.setEnabled(true);
        slack.setBotToken("xoxb-test");
        slack.setChannels(List.of("#payments-eng"));
    }

    private SlackAdapter adapter(StubExchange stub) {
        return new SlackAdapter(stub.builder(), objectMapper, properties, clock);
    }

    @Test
    void groupsThreadsAndStandaloneMessages() {
        StubExchange stub = new StubExchange()
            .ok("/api/search.messages", SEARCH_JSON)
            .ok("/api/conversations.replies", REPLIES_JSON)
            .ok("/api/users.info", USER_JSON);

        SourceContext context = adapter(stub).fetchTaskContext("PROJ-123", Fixtures.paymentsTicket("PROJ-123"), FetchDepth.STANDARD);

        SlackContext slack = context.dataAs(SlackContext.class).orElseThrow();
        assertEquals(1, slack.getThreads().size());
        assertEquals(1, slack.getStandaloneMessages().size());

        SlackThread thread = slack.getThreads().get(0);
        assertEquals(2, thread.getReplies().size());
        assertEquals(List.of("use exponential backoff for retries"), thread.getDecisions());
        assertEquals(List.of("update the runbook tomorrow"), thread.getActionItems());

        assertThat(context.getRawText())
            .startsWith("## #payments-eng Thread\n**Started:** 2024-03-01 10:00\n**Participants:** dana")
            .contains("**Decisions:**\n- use exponential backoff for retries")
            .contains("**#payments-eng** (2024-03-01) **dana:** deploying webhook fix");
        assertEquals("Bearer xoxb-test", stub.requests().get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void userNamesAreLookedUpOnce() {
        StubExchange stub = new StubExchange()
            .ok("/api/search.messages", SEARCH_JSON)
            .ok("/api/conversations.replies", REPLIES_JSON)
            .ok("/api/users.info", USER_JSON);

        adapter(stub).fetchTaskContext("PROJ-123", null, FetchDepth.STANDARD);

        assertEquals(1, stub.requestsTo("/api/users.info").size());
    }

    @Test
    void fallsBackToChannelHistoryWhenSearchIsNotAllowed() {
        StubExchange stub = new StubExchange()
            .ok("/api/search.messages", "{\"ok\": false, \"error\": \"not_allowed_token_type\"}")
            .ok("/api/conversations.list", "{\"ok\": true, \"channels\": [{\"id\": \"C1\", \"name\": \"payments-eng\"}]}")
            .ok("/api/conversations.history", """
                {"ok": true, "messages": [
                  {"ts": "1709287200.000100", "user": "U1", "text": "Webhook retries are failing"},
                  {"ts": "1709287300.000100", "user": "U1", "text": "lunch?"}
                ]}
                """);

        List<SearchResult> results = adapter(stub).search("webhook", 5);

        assertEquals(1, results.size());
        assertEquals("Slack: #payments-eng", results.get(0).getTitle());
        assertEquals(1.0, results.get(0).getRelevanceScore());
        assertThat(stub.requestsTo("/api/conversations.history").get(0).url().getQuery()).contains("channel=C1");
    }

    @Test
    void missingTokenFailsWithoutCallingSlack() {
        properties.getSources().getSlack().setBotToken(" ");
        StubExchange stub = new StubExchange();
        SlackAdapter adapter = adapter(stub);

        assertThrows(AdapterException.class, () -> adapter.search("webhook", 5));
        assertFalse(adapter.healthCheck());
        assertTrue(stub.requests().isEmpty());
    }

    @Test
    void healthCheckReadsAuthTestResult() {
        assertTrue(adapter(new StubExchange().ok("/api/auth.test", "{\"ok\": true}")).healthCheck());
        assertFalse(adapter(new StubExchange().ok("/api/auth.test", "{\"ok\": false, \"error\": \"invalid_auth\"}")).healthCheck());
    }
}
