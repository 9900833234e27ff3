package com.devscontext.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

class FetchResultTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void rawTextsSkipFailedAndEmptySources() {
        FetchResult result = new FetchResult(List.of(
            SourceContext.builder().sourceName("jira").sourceType(SourceType.ISSUE_TRACKER)
                .rawText("# [PROJ-1] Webhook retries").fetchedAt(NOW).build(),
            SourceContext.failure("slack", SourceType.COMMUNICATION, "timeout", NOW),
            SourceContext.builder().sourceName("fireflies").sourceType(SourceType.MEETING)
                .rawText("").fetchedAt(NOW).build(),
            SourceContext.builder().sourceName("local_docs").sourceType(SourceType.DOCUMENTATION)
                .rawText("## Webhook processing").fetchedAt(NOW).build()));

        assertEquals(List.of("# [PROJ-1] Webhook retries", "## Webhook processing"), result.rawTexts());
        assertEquals(4, result.size());
        assertEquals(1, result.failedCount());
    }
}
