package com.devscontext.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.devscontext.common.exception.AdapterException;
import com.devscontext.core.adapter.AdapterRegistry;
import com.devscontext.core.adapter.SourceAdapter;
import com.devscontext.core.adapter.docs.LocalDocsAdapter;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.fetch.FetchCoordinator;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.FetchResult;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.TicketFields;
import com.devscontext.core.quality.QualityScorer;
import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.core.support.FakeAdapter;
import com.devscontext.core.support.Fixtures;
import com.devscontext.core.support.MutableClock;
import com.devscontext.core.synthesis.SynthesisEngine;
import com.devscontext.data.entity.ContextStatus;
import com.devscontext.data.entity.PrebuiltContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

class PreprocessingPipelineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final MutableClock clock = new MutableClock(NOW);
    private final PrebuiltContextStore store = mock(PrebuiltContextStore.class);
    private final SynthesisEngine engine = mock(SynthesisEngine.class);
    private final DevsContextProperties properties = new DevsContextProperties();

    private FakeAdapter jira;
    private FakeAdapter fireflies;
    private FakeAdapter docs;

    @BeforeEach
    void setUp() {
        jira = new FakeAdapter("jira", SourceType.ISSUE_TRACKER).primary().returning(Fixtures.paymentsTicket("PROJ-1"));
        fireflies = new FakeAdapter("fireflies", SourceType.MEETING).needsPrimary().returning(Fixtures.emptyMeetings());
        docs = new FakeAdapter("local_docs", SourceType.DOCUMENTATION).needsPrimary().returning(Fixtures.architectureDocs());

        when(store.put(any(PrebuiltContext.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(engine.getName()).thenReturn("test");
        when(engine.synthesize(eq("PROJ-1"), anyList())).thenReturn("## Task: PROJ-1 draft");
        when(engine.refine(eq("PROJ-1"), eq("## Task: PROJ-1 draft"), anyList())).thenReturn("## Task: PROJ-1 refined");
        when(engine.detectGaps(anyString())).thenReturn(List.of());
    }

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private PreprocessingPipeline pipeline(SourceAdapter... adapters) {
        return new PreprocessingPipeline(new AdapterRegistry(List.of(adapters)),
            new FetchCoordinator(executor, clock), engine, new QualityScorer(), store, properties, clock);
    }

    @Test
    void buildsScoresAndStoresContext() {
        PrebuiltContext record = pipeline(jira, fireflies, docs).build("PROJ-1");

        assertEquals(0.70, record.getQualityScore(), 1e-9);
        assertThat(record.getGaps()).containsExactly("No related meetings found", "No linked issues");
        assertThat(record.getSourcesUsed()).containsExactly("jira:PROJ-1", "docs:docs/architecture/payments.md");
        assertEquals(NOW, record.getBuiltAt());
        assertEquals(NOW.plus(Duration.ofHours(24)), record.getExpiresAt());
        assertEquals(ContextStatus.ACTIVE, record.getStatus());
        assertEquals(64, record.getSourceDataHash().length());
        assertThat(record.getSynthesizedContext())
            .startsWith("## Task: PROJ-1 refined")
            .contains("## Context Quality")
            .contains("**Score:** 70% (Moderate)")
            .endsWith("- No linked issues");
        verify(store).put(record);
    }

    @Test
    void runsDraftAndRefinementPasses() {
        when(engine.detectGaps("## Task: PROJ-1 refined")).thenReturn(List.of("Unclear rollout plan", "No linked issues"));

        PrebuiltContext record = pipeline(jira, fireflies, docs).build("PROJ-1");

        verify(engine, times(1)).synthesize(eq("PROJ-1"), anyList());
        verify(engine, times(1)).refine(eq("PROJ-1"), eq("## Task: PROJ-1 draft"), anyList());
        assertThat(record.getGaps()).containsExactly(
            "No related meetings found", "No linked issues", "Unclear rollout plan");
    }

    @Test
    void gapDetectionCanBeSwitchedOff() {
        properties.getAgents().getPreprocessor().setDetectGaps(false);

        pipeline(jira, fireflies, docs).build("PROJ-1");

        verify(engine, never()).detectGaps(anyString());
    }

    @Test
    void failedSynthesisFallsBackToRawContext() {
        when(engine.synthesize(eq("PROJ-1"), anyList())).thenThrow(new IllegalStateException("engine down"));
        when(engine.refine(eq("PROJ-1"), anyString(), anyList())).thenAnswer(invocation -> invocation.getArgument(1));

        PrebuiltContext record = pipeline(jira, fireflies, docs).build("PROJ-1");

        assertThat(record.getSynthesizedContext())
            .startsWith("## Task: PROJ-1\n\n*Note: LLM synthesis unavailable, showing raw context.*");
        assertEquals(0.70, record.getQualityScore(), 1e-9);
    }

    @Test
    void missingTicketAbortsWithoutWriting() {
        FakeAdapter brokenJira = new FakeAdapter("jira", SourceType.ISSUE_TRACKER).primary()
            .failing(new AdapterException("jira", "Jira issue not found"));

        AdapterException error = assertThrows(AdapterException.class,
            () -> pipeline(brokenJira, fireflies, docs).build("PROJ-404"));

        assertThat(error.getMessage()).contains("PROJ-404").contains("Jira issue not found");
        verify(store, never()).put(any());
    }

    @Test
    void failingSecondaryStillProducesRecord() {
        FakeAdapter brokenDocs = new FakeAdapter("local_docs", SourceType.DOCUMENTATION)
            .failing(new IllegalStateException("disk unavailable"));

        PrebuiltContext record = pipeline(jira, fireflies, brokenDocs).build("PROJ-1");

        assertEquals(0.50, record.getQualityScore(), 1e-9);
        assertThat(record.getGaps()).contains("No matching documentation found");
    }

    @Test
    void crossSourceSearchAddsRelatedMeetings() {
        fireflies.searchReturning(List.of(
            SearchResult.builder().sourceName("fireflies").sourceType(SourceType.MEETING)
                .title("Payments sync").excerpt("We agreed webhook retries use exponential backoff").relevanceScore(1.0).build(),
            SearchResult.builder().sourceName("fireflies").sourceType(SourceType.MEETING)
                .title("Hiring sync").excerpt("Interview loop changes").relevanceScore(0.5).build()));

        PrebuiltContext record = pipeline(jira, fireflies, docs).build("PROJ-1");

        assertEquals(0.90, record.getQualityScore(), 1e-9);
        assertThat(record.getSourcesUsed()).contains("fireflies:related");
        assertThat(record.getGaps()).containsExactly("No linked issues");
    }

    @Test
    void standardsOnlyDocsDoNotCountAsDocumentationMatch(@TempDir Path tempDir) throws IOException {
        LocalDocsAdapter localDocs = localDocs(tempDir, "standards/coding.md",
            "# Coding standards\nKeep controllers thin and log with placeholders.\n\n"
                + "Every webhook handler needs retry logic with exponential backoff.\n");

        PrebuiltContext record = pipeline(jira, fireflies, localDocs).build("PROJ-1");
        SourceContext ticket = Fixtures.paymentsTicket("PROJ-1");
        SourceContext onDemandDocs = localDocs.fetchTaskContext("PROJ-1", ticket, FetchDepth.STANDARD);
        double onDemand = new QualityScorer()
            .score(TicketFields.from(ticket), new FetchResult(List.of(ticket, onDemandDocs)))
            .getScore();

        assertEquals(0.50, record.getQualityScore(), 1e-9);
        assertEquals(onDemand, record.getQualityScore(), 1e-9);
        assertThat(record.getGaps()).contains("No matching documentation found");
        assertThat(record.getSourcesUsed()).containsExactly("jira:PROJ-1", "docs:docs/standards/coding.md");
    }

    @Test
    void broadDocSearchAddsSectionsTheTaskFetchMissed(@TempDir Path tempDir) throws IOException {
        LocalDocsAdapter localDocs = localDocs(tempDir, "guides/runbook.md",
            "# Operations\nThe webhook queue is drained every night.\n");

        PrebuiltContext record = pipeline(jira, fireflies, localDocs).build("PROJ-1");

        assertEquals(0.70, record.getQualityScore(), 1e-9);
        assertThat(record.getSourcesUsed()).containsExactly("jira:PROJ-1", "docs:docs/guides/runbook.md");
        assertThat(record.getGaps()).doesNotContain("No matching documentation found");
    }

    private LocalDocsAdapter localDocs(Path tempDir, String relativePath, String content) throws IOException {
        Path root = tempDir.resolve("docs");
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        properties.getSources().getDocs().setEnabled(true);
        properties.getSources().getDocs().setPaths(List.of(root.toString()));
        return new LocalDocsAdapter(properties, clock);
    }

    @Test
    void qualityLabels() {
        assertEquals("Good", PreprocessingPipeline.qualityLabel(0.85));
        assertEquals("Moderate", PreprocessingPipeline.qualityLabel(0.6));
        assertEquals("Limited", PreprocessingPipeline.qualityLabel(0.45));
        assertEquals("Incomplete", PreprocessingPipeline.qualityLabel(0.1));
        assertEquals("", PreprocessingPipeline.qualitySection(1.0, List.of()));
    }
}
