package com.devscontext.core.adapter.docs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.docs.DocSection;
import com.devscontext.core.model.docs.DocType;
import com.devscontext.core.model.docs.DocsContext;
import com.devscontext.core.support.Fixtures;
import com.devscontext.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

class LocalDocsAdapterTest {

    @TempDir
    Path tempDir;

    private DevsContextProperties properties;
    private LocalDocsAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        Path docs = tempDir.resolve("docs");
        write(docs.resolve("architecture/payments.md"), """
            # Payments
            Overview of the payments service.

            ## Webhook processing
            Webhooks are queued before processing. Retry logic uses exponential backoff.
            ```
            # not a heading
            ```
            """);
        write(docs.resolve("standards/testing.md"), "# Testing standards\nUse JUnit 5 for all tests.\n");
        write(docs.resolve("guides/onboarding.md"), "# Onboarding\nWelcome aboard.\n");
        write(docs.resolve("diagrams/flow.png"), "not text");

        properties = new DevsContextProperties();
        properties.getSources().getDocs().setEnabled(true);
        properties.getSources().getDocs().setPaths(List.of(docs.toString()));
        adapter = new LocalDocsAdapter(properties, new MutableClock(Instant.parse("2026-03-02T00:00:00Z")));
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void matchesTicketFieldsAndAlwaysAddsStandards() {
        SourceContext context = adapter.fetchTaskContext("PROJ-123", Fixtures.paymentsTicket("PROJ-123"), FetchDepth.STANDARD);

        DocsContext docs = context.dataAs(DocsContext.class).orElseThrow();
        assertThat(docs.getSections()).extracting(DocSection::getSectionTitle)
            .containsExactly("Webhook processing", "Payments", "Testing standards");
        assertTrue(docs.hasMatches());
        assertEquals(2, context.getMetadata().get("matchedCount"));
        assertEquals(1, context.getMetadata().get("standardsCount"));
        assertThat(context.getRawText())
            .startsWith("## Webhook processing\n*Source: docs/architecture/payments.md* [architecture]")
            .contains("[standards]")
            .doesNotContain("Onboarding");
    }

    @Test
    void withoutTicketOnlyStandardsAreReturned() {
        SourceContext context = adapter.fetchTaskContext("PROJ-123", null, FetchDepth.STANDARD);

        DocsContext docs = context.dataAs(DocsContext.class).orElseThrow();
        assertThat(docs.getSections()).extracting(DocSection::getDocType).containsExactly(DocType.STANDARDS);
        assertFalse(docs.hasMatches());
    }

    @Test
    void codeFencesDoNotStartSections() {
        List<DocSection> sections = LocalDocsAdapter.splitSections("docs/guide.md",
            "intro text\n# A\nbody a\n```\n# inside\n```\n## B ##\nbody b", DocType.OTHER);

        assertThat(sections).extracting(DocSection::getSectionTitle).containsExactly("guide", "A", "B");
        assertEquals("body a\n```\n# inside\n```", sections.get(1).getContent());
        assertEquals("body b", sections.get(2).getContent());
    }

    @Test
    void searchScoresByTermCoverage() {
        List<SearchResult> results = adapter.search("webhook retry", 5);

        assertEquals(1, results.size());
        SearchResult top = results.get(0);
        assertEquals("Webhook processing (docs/architecture/payments.md)", top.getTitle());
        assertEquals(1.0, top.getRelevanceScore());
        assertEquals("ARCHITECTURE", top.getMetadata().get("docType"));
        assertTrue(adapter.search("   ", 5).isEmpty());
    }

    @Test
    void standardsCanBeNarrowedByArea() {
        assertEquals(1, adapter.findStandards(null).size());
        assertEquals(1, adapter.findStandards("testing").size());
        assertTrue(adapter.findStandards("security").isEmpty());
    }

    @Test
    void configuredStandardsPathOutsideDocsRootIsScanned() throws IOException {
        Path rules = tempDir.resolve("team-rules");
        write(rules.resolve("rules.md"), "# Logging\nUse SLF4J placeholders.\n");
        properties.getSources().getDocs().setStandardsPath(rules.toString());

        List<DocSection> standards = adapter.findStandards("logging");

        assertEquals(1, standards.size());
        assertEquals("team-rules/rules.md", standards.get(0).getFilePath());
    }

    @Test
    void healthDependsOnReadableDirectory() {
        assertTrue(adapter.healthCheck());

        properties.getSources().getDocs().setPaths(List.of(tempDir.resolve("missing").toString()));
        assertFalse(adapter.healthCheck());
    }
}
