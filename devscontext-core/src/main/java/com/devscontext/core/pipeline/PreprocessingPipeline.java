package com.devscontext.core.pipeline;

import com.devscontext.common.exception.AdapterException;
import com.devscontext.common.exception.ConfigurationException;
import com.devscontext.common.util.SourceDataHasher;
import com.devscontext.common.util.TextUtils;
import com.devscontext.core.adapter.AdapterRegistry;
import com.devscontext.core.adapter.SourceAdapter;
import com.devscontext.core.adapter.docs.LocalDocsAdapter;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.fetch.FetchCoordinator;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.FetchResult;
import com.devscontext.core.model.Gap;
import com.devscontext.core.model.QualityAssessment;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.TicketFields;
import com.devscontext.core.model.docs.DocSection;
import com.devscontext.core.model.docs.DocsContext;
import com.devscontext.core.model.jira.JiraContext;
import com.devscontext.core.model.meeting.MeetingContext;
import com.devscontext.core.model.slack.SlackContext;
import com.devscontext.core.model.slack.SlackMessage;
import com.devscontext.core.model.slack.SlackThread;
import com.devscontext.core.quality.QualityScorer;
import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.core.synthesis.SynthesisEngine;
import com.devscontext.core.synthesis.SynthesisFormats;
import com.devscontext.data.entity.ContextStatus;
import com.devscontext.data.entity.PrebuiltContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds and stores context ahead of request time.
 *
 * <p>Six steps: deep fetch, broad doc search, cross-source matching, multi-pass
 * synthesis, quality scoring and persistence. Only a missing ticket aborts a
 * build; every other failure leaves an empty contribution behind.
 */
@Service
@Slf4j
public class PreprocessingPipeline {

    private static final DateTimeFormatter MEETING_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final int CROSS_SOURCE_KEYWORDS = 3;

    private final AdapterRegistry registry;
    private final FetchCoordinator fetchCoordinator;
    private final SynthesisEngine synthesisEngine;
    private final QualityScorer qualityScorer;
    private final PrebuiltContextStore store;
    private final DevsContextProperties properties;
    private final Clock clock;

    public PreprocessingPipeline(AdapterRegistry registry, FetchCoordinator fetchCoordinator,
                                 SynthesisEngine synthesisEngine, QualityScorer qualityScorer,
                                 PrebuiltContextStore store, DevsContextProperties properties, Clock clock) {
        this.registry = registry;
        this.fetchCoordinator = fetchCoordinator;
        this.synthesisEngine = synthesisEngine;
        this.qualityScorer = qualityScorer;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public PrebuiltContext build(String taskId) {
        long startTime = System.currentTimeMillis();
        log.info("[PIPELINE] ========== PREPROCESSING START ========== | taskId={}", taskId);

        // STEP 1: deep fetch
        long stepStart = System.currentTimeMillis();
        SourceAdapter primary = registry.getPrimary()
            .orElseThrow(() -> new ConfigurationException("Preprocessing needs a primary issue tracker adapter"));
        FetchResult fetched = fetchCoordinator.fetch(taskId, registry.getAdapters(), FetchDepth.DEEP,
            properties.getFetch().getDeepPerSourceTimeout(), properties.getFetch().getDeepOverallTimeout());
        SourceContext ticket = fetched.getContexts().stream()
            .filter(c -> primary.getName().equals(c.getSourceName()))
            .findFirst()
            .orElse(null);
        if (ticket == null || !ticket.hasContent()) {
            String reason = ticket != null && ticket.hasError() ? ticket.getError() : "no ticket data";
            throw new AdapterException(primary.getName(), "Could not fetch ticket " + taskId + ": " + reason);
        }
        TicketFields fields = TicketFields.from(ticket);
        log.info("[PIPELINE] STEP 1: Deep fetch complete | taskId={} | sources={} | failed={} | durationMs={}",
            taskId, fetched.size(), fetched.failedCount(), System.currentTimeMillis() - stepStart);

        List<SourceContext> contexts = new ArrayList<>(fetched.getContexts());

        // STEP 2: broad doc search
        stepStart = System.currentTimeMillis();
        Optional<LocalDocsAdapter> docs = registry.find(LocalDocsAdapter.class);
        docs.flatMap(adapter -> docsSupplement(adapter, fields.getTitle(), FetchDepth.DEEP.getMaxDocSections(), contexts))
            .ifPresent(contexts::add);
        log.info("[PIPELINE] STEP 2: Broad doc search complete | taskId={} | docsAdapter={} | durationMs={}",
            taskId, docs.isPresent(), System.currentTimeMillis() - stepStart);

        // STEP 3: cross-source matching
        stepStart = System.currentTimeMillis();
        String keywordQuery = String.join(" ",
            TextUtils.extractKeywords(fields.getTitle()).stream().limit(CROSS_SOURCE_KEYWORDS).collect(Collectors.toList()));
        int matched = 0;
        if (!keywordQuery.isBlank()) {
            for (SourceAdapter adapter : registry.getAdapters()) {
                if (adapter.getSourceType() != SourceType.MEETING && adapter.getSourceType() != SourceType.COMMUNICATION) {
                    continue;
                }
                int limit = adapter.getSourceType() == SourceType.MEETING
                    ? FetchDepth.DEEP.getMaxMeetings() : FetchDepth.DEEP.getMaxMessages();
                Optional<SourceContext> related = supplement(adapter, keywordQuery, limit, contexts);
                if (related.isPresent()) {
                    contexts.add(related.get());
                    matched++;
                }
            }
        }
        log.info("[PIPELINE] STEP 3: Cross-source matching complete | taskId={} | keywords=\"{}\" | supplementedSources={} | durationMs={}",
            taskId, keywordQuery, matched, System.currentTimeMillis() - stepStart);

        // STEP 4: multi-pass synthesis
        stepStart = System.currentTimeMillis();
        String draft = synthesizeSafely(taskId, contexts);
        String body = refineSafely(taskId, draft, contexts);
        List<String> detected = properties.getAgents().getPreprocessor().isDetectGaps()
            ? detectGapsSafely(taskId, body) : List.of();
        log.info("[PIPELINE] STEP 4: Synthesis complete | taskId={} | engine={} | draftChars={} | bodyChars={} | detectedGaps={} | durationMs={}",
            taskId, synthesisEngine.getName(), draft.length(), body.length(), detected.size(), System.currentTimeMillis() - stepStart);

        // STEP 5: quality scoring
        QualityAssessment quality = qualityScorer.score(fields, new FetchResult(contexts));
        List<String> gaps = new ArrayList<>(quality.gapDescriptions());
        detected.stream().filter(g -> !gaps.contains(g)).forEach(gaps::add);
        log.info("[PIPELINE] STEP 5: Quality scored | taskId={} | score={} | gaps={}", taskId, quality.getScore(), gaps.size());

        // STEP 6: persist
        Instant now = clock.instant();
        List<String> rawTexts = new FetchResult(contexts).rawTexts();
        PrebuiltContext record = PrebuiltContext.builder()
            .taskId(taskId)
            .synthesizedContext(body + qualitySection(quality.getScore(), gaps))
            .sourcesUsed(sourcesUsed(contexts))
            .qualityScore(quality.getScore())
            .gaps(gaps)
            .sourceDataHash(SourceDataHasher.hash(rawTexts))
            .builtAt(now)
            .expiresAt(now.plus(Duration.ofHours(properties.getAgents().getPreprocessor().getContextTtlHours())))
            .status(ContextStatus.ACTIVE)
            .build();
        PrebuiltContext saved = store.put(record);

        log.info("[PIPELINE] ========== PREPROCESSING COMPLETE ========== | taskId={} | quality={} | sources={} | duration={}",
            taskId, quality.getScore(), record.getSourcesUsed().size(),
            TextUtils.formatDuration(System.currentTimeMillis() - startTime));
        return saved;
    }

    /**
     * Search results from {@code adapter} that add something to what was
     * already fetched, as an extra context. A hit must mention one of the
     * query terms to count.
     */
    Optional<SourceContext> supplement(SourceAdapter adapter, String query, int maxResults,
                                       List<SourceContext> existing) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        List<SearchResult> results;
        try {
            results = adapter.search(query, maxResults);
        } catch (Exception e) {
            log.warn("[PIPELINE] Supplementary search failed | adapter={} | error={}", adapter.getName(), e.getMessage());
            return Optional.empty();
        }
        String known = existing.stream()
            .filter(c -> adapter.getName().equals(c.getSourceName()))
            .map(SourceContext::getRawText)
            .collect(Collectors.joining("\n"));
        List<String> terms = TextUtils.extractKeywords(query);

        List<SearchResult> fresh = results.stream()
            .filter(r -> r.getExcerpt() != null && !r.getExcerpt().isBlank())
            .filter(r -> !known.contains(r.getExcerpt().strip()))
            .filter(r -> terms.isEmpty() || mentionsAny(r, terms))
            .collect(Collectors.toList());
        if (fresh.isEmpty()) {
            return Optional.empty();
        }

        String text = fresh.stream()
            .map(r -> "### " + r.getTitle() + (r.getUrl() != null ? "\n" + r.getUrl() : "") + "\n\n" + r.getExcerpt())
            .collect(Collectors.joining("\n\n"));
        return Optional.of(SourceContext.builder()
            .sourceName(adapter.getName() + ":related")
            .sourceType(adapter.getSourceType())
            .rawText("## Related " + adapter.getSourceType().name().toLowerCase(Locale.ROOT) + " results for \""
                + query + "\"\n\n" + text)
            .metadata(Map.of("query", query, "resultCount", fresh.size()))
            .fetchedAt(clock.instant())
            .build());
    }

    /**
     * Doc sections found by a body search on the ticket title that the task
     * fetch did not already return. Carries a {@link DocsContext} so scoring
     * can tell matches from standards.
     */
    Optional<SourceContext> docsSupplement(LocalDocsAdapter adapter, String query, int maxResults,
                                           List<SourceContext> existing) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        List<DocSection> found;
        try {
            found = adapter.searchSections(query, maxResults);
        } catch (Exception e) {
            log.warn("[PIPELINE] Broad doc search failed | adapter={} | error={}", adapter.getName(), e.getMessage());
            return Optional.empty();
        }
        Set<String> known = existing.stream()
            .filter(c -> adapter.getName().equals(c.getSourceName()))
            .flatMap(c -> c.dataAs(DocsContext.class).stream())
            .flatMap(d -> d.getSections().stream())
            .map(PreprocessingPipeline::sectionKey)
            .collect(Collectors.toSet());
        List<DocSection> fresh = found.stream()
            .filter(section -> !known.contains(sectionKey(section)))
            .collect(Collectors.toList());
        if (fresh.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SourceContext.builder()
            .sourceName(adapter.getName() + ":related")
            .sourceType(SourceType.DOCUMENTATION)
            .data(new DocsContext(fresh))
            .rawText(LocalDocsAdapter.format(fresh))
            .metadata(Map.of("query", query, "resultCount", fresh.size()))
            .fetchedAt(clock.instant())
            .build());
    }

    private static String sectionKey(DocSection section) {
        return section.getFilePath() + "#" + section.getSectionTitle();
    }

    static String qualitySection(double score, List<String> gaps) {
        if (gaps.isEmpty()) {
            return "";
        }
        StringBuilder section = new StringBuilder("\n\n## Context Quality\n\n");
        section.append("**Score:** ").append(Math.round(score * 100)).append("% (").append(qualityLabel(score)).append(")\n\n");
        section.append("**Missing context:**\n");
        gaps.forEach(g -> section.append("- ").append(g).append('\n'));
        return section.toString().stripTrailing();
    }

    static String qualityLabel(double score) {
        if (score >= 0.8) {
            return "Good";
        }
        if (score >= 0.6) {
            return "Moderate";
        }
        if (score >= 0.4) {
            return "Limited";
        }
        return "Incomplete";
    }

    static List<String> sourcesUsed(List<SourceContext> contexts) {
        Set<String> sources = new LinkedHashSet<>();
        for (SourceContext context : contexts) {
            if (!context.hasContent()) {
                continue;
            }
            switch (context.getSourceType()) {
                case ISSUE_TRACKER -> sources.add(context.dataAs(JiraContext.class)
                    .filter(jira -> jira.getTicket() != null)
                    .map(jira -> "jira:" + jira.getTicket().getTicketId())
                    .orElse(context.getSourceName()));
                case MEETING -> context.dataAs(MeetingContext.class).ifPresentOrElse(
                    meetings -> meetings.getMeetings().stream()
                        .filter(m -> m.getMeetingDate() != null)
                        .forEach(m -> sources.add("fireflies:" + MEETING_DATE.format(m.getMeetingDate()))),
                    () -> sources.add(context.getSourceName()));
                case COMMUNICATION -> context.dataAs(SlackContext.class).ifPresentOrElse(
                    slack -> slackChannels(slack).forEach(channel -> sources.add("slack:#" + channel)),
                    () -> sources.add(context.getSourceName()));
                case DOCUMENTATION -> context.dataAs(DocsContext.class).ifPresentOrElse(
                    docs -> docs.getSections().forEach(s -> sources.add("docs:" + s.getFilePath())),
                    () -> sources.add(context.getSourceName()));
                default -> sources.add(context.getSourceName());
            }
        }
        return new ArrayList<>(sources);
    }

    private static Set<String> slackChannels(SlackContext slack) {
        Set<String> channels = new LinkedHashSet<>();
        slack.getThreads().stream().map(SlackThread::getParent).map(SlackMessage::getChannelName)
            .filter(c -> c != null && !c.isBlank()).forEach(channels::add);
        slack.getStandaloneMessages().stream().map(SlackMessage::getChannelName)
            .filter(c -> c != null && !c.isBlank()).forEach(channels::add);
        return channels;
    }

    private static boolean mentionsAny(SearchResult result, List<String> terms) {
        return terms.stream().anyMatch(t -> TextUtils.containsIgnoreCase(result.getExcerpt(), t)
            || TextUtils.containsIgnoreCase(result.getTitle(), t));
    }

    private String synthesizeSafely(String taskId, List<SourceContext> contexts) {
        try {
            return synthesisEngine.synthesize(taskId, contexts);
        } catch (RuntimeException e) {
            log.warn("[PIPELINE] Synthesis failed, using raw context | taskId={} | error={}", taskId, e.getMessage());
            return SynthesisFormats.fallback(taskId, contexts);
        }
    }

    private String refineSafely(String taskId, String draft, List<SourceContext> contexts) {
        try {
            String refined = synthesisEngine.refine(taskId, draft, contexts);
            return refined == null || refined.isBlank() ? draft : refined;
        } catch (RuntimeException e) {
            log.warn("[PIPELINE] Refinement failed, keeping draft | taskId={} | error={}", taskId, e.getMessage());
            return draft;
        }
    }

    private List<String> detectGapsSafely(String taskId, String body) {
        try {
            return synthesisEngine.detectGaps(body);
        } catch (RuntimeException e) {
            log.warn("[PIPELINE] Gap detection failed | taskId={} | error={}", taskId, e.getMessage());
            return List.of();
        }
    }
}
