package com.devscontext.core.orchestrator;

import com.devscontext.common.exception.StorageException;
import com.devscontext.common.util.TextUtils;
import com.devscontext.core.adapter.AdapterRegistry;
import com.devscontext.core.adapter.SourceAdapter;
import com.devscontext.core.adapter.docs.LocalDocsAdapter;
import com.devscontext.core.cache.SynthesisDedupCache;
import com.devscontext.core.config.CoreConfig;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.fetch.FetchCoordinator;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.FetchResult;
import com.devscontext.core.model.QualityAssessment;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.SynthesizedContext;
import com.devscontext.core.model.TicketFields;
import com.devscontext.core.model.docs.DocSection;
import com.devscontext.core.quality.QualityScorer;
import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.core.synthesis.SynthesisEngine;
import com.devscontext.core.synthesis.SynthesisFormats;
import com.devscontext.data.entity.PrebuiltContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Request-facing entry point.
 *
 * <p>Task context comes from the pre-built store when a fresh record exists,
 * otherwise from an on-demand fetch and single synthesis pass behind the dedup
 * cache. Search and standards lookups never touch either cache.
 */
@Service
@Slf4j
public class ContextOrchestrator {

    private final AdapterRegistry registry;
    private final FetchCoordinator fetchCoordinator;
    private final SynthesisDedupCache dedupCache;
    private final SynthesisEngine synthesisEngine;
    private final QualityScorer qualityScorer;
    private final PrebuiltContextStore store;
    private final DevsContextProperties properties;
    private final ExecutorService fetchExecutor;
    private final Clock clock;

    public ContextOrchestrator(AdapterRegistry registry, FetchCoordinator fetchCoordinator,
                               SynthesisDedupCache dedupCache, SynthesisEngine synthesisEngine,
                               QualityScorer qualityScorer, PrebuiltContextStore store,
                               DevsContextProperties properties,
                               @Qualifier(CoreConfig.FETCH_EXECUTOR) ExecutorService fetchExecutor, Clock clock) {
        this.registry = registry;
        this.fetchCoordinator = fetchCoordinator;
        this.dedupCache = dedupCache;
        this.synthesisEngine = synthesisEngine;
        this.qualityScorer = qualityScorer;
        this.store = store;
        this.properties = properties;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    public SynthesizedContext getTaskContext(String taskId) {
        return getTaskContext(taskId, false);
    }

    /**
     * @param refresh skip the pre-built store and drop the cached entry before rebuilding
     */
    public SynthesizedContext getTaskContext(String taskId, boolean refresh) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        long startTime = System.currentTimeMillis();

        if (refresh) {
            dedupCache.invalidate(taskId);
        } else {
            Optional<SynthesizedContext> prebuilt = findPrebuilt(taskId);
            if (prebuilt.isPresent()) {
                log.info("[CONTEXT_ORCH] Served pre-built context | taskId={} | quality={} | durationMs={}",
                    taskId, prebuilt.get().getQualityScore(), System.currentTimeMillis() - startTime);
                return prebuilt.get();
            }
        }

        SynthesizedContext context = dedupCache.getOrBuild(taskId, () -> buildOnDemand(taskId));
        log.info("[CONTEXT_ORCH] Served context | taskId={} | refresh={} | quality={} | sources={} | durationMs={}",
            taskId, refresh, context.getQualityScore(), context.getSourcesUsed().size(),
            System.currentTimeMillis() - startTime);
        return context;
    }

    /**
     * Keyword search across every adapter, best matches first. Adapters that
     * fail or time out contribute nothing.
     */
    public List<SearchResult> searchContext(String query, int maxResults) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        long startTime = System.currentTimeMillis();
        long timeoutMs = properties.getFetch().getPerSourceTimeout().toMillis();

        List<CompletableFuture<List<SearchResult>>> futures = registry.getAdapters().stream()
            .map(adapter -> CompletableFuture.supplyAsync(() -> adapter.search(query, maxResults), fetchExecutor)
                .completeOnTimeout(List.of(), timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("[CONTEXT_ORCH] Search failed | adapter={} | error={}", adapter.getName(), e.getMessage());
                    return List.of();
                }))
            .collect(Collectors.toList());

        List<SearchResult> results = futures.stream()
            .map(CompletableFuture::join)
            .flatMap(List::stream)
            .sorted(Comparator.comparingDouble(SearchResult::getRelevanceScore).reversed())
            .limit(maxResults)
            .collect(Collectors.toList());

        log.info("[CONTEXT_ORCH] Search completed | query=\"{}\" | adapters={} | results={} | durationMs={}",
            query, futures.size(), results.size(), System.currentTimeMillis() - startTime);
        return results;
    }

    /** Coding standards as markdown, optionally narrowed to one area. */
    public String getStandards(String area) {
        Optional<LocalDocsAdapter> docs = registry.find(LocalDocsAdapter.class);
        if (docs.isEmpty()) {
            return "No standards available: the local docs source is not enabled.";
        }
        List<DocSection> sections = docs.get().findStandards(area);
        log.info("[CONTEXT_ORCH] Standards retrieved | area={} | sections={}", area, sections.size());
        if (sections.isEmpty()) {
            return area == null || area.isBlank()
                ? "No coding standards found."
                : "No coding standards found for area: " + area;
        }
        return "# Coding Standards" + (area == null || area.isBlank() ? "" : ": " + area) + "\n\n"
            + LocalDocsAdapter.format(sections);
    }

    public HealthStatus healthCheck() {
        Map<String, Boolean> adapters = new LinkedHashMap<>();
        for (SourceAdapter adapter : registry.getAdapters()) {
            boolean healthy;
            try {
                healthy = adapter.healthCheck();
            } catch (Exception e) {
                log.warn("[CONTEXT_ORCH] Health check failed | adapter={} | error={}", adapter.getName(), e.getMessage());
                healthy = false;
            }
            adapters.put(adapter.getName(), healthy);
        }
        boolean overall = adapters.values().stream().allMatch(Boolean::booleanValue);
        return new HealthStatus(overall, adapters);
    }

    public boolean invalidateCache(String taskId) {
        boolean removed = dedupCache.invalidate(taskId);
        log.info("[CONTEXT_ORCH] Cache invalidated | taskId={} | removed={}", taskId, removed);
        return removed;
    }

    public int invalidateCache() {
        return dedupCache.invalidateAll();
    }

    public SynthesisDedupCache.Stats cacheStats() {
        return dedupCache.stats();
    }

    SynthesizedContext buildOnDemand(String taskId) {
        long startTime = System.currentTimeMillis();
        FetchResult fetched = fetchCoordinator.fetch(taskId, registry.getAdapters(), FetchDepth.STANDARD,
            properties.getFetch().getPerSourceTimeout(), properties.getFetch().getOverallTimeout());

        String body;
        try {
            body = synthesisEngine.synthesize(taskId, fetched.getContexts());
        } catch (RuntimeException e) {
            log.warn("[CONTEXT_ORCH] Synthesis failed, using raw context | taskId={} | error={}", taskId, e.getMessage());
            body = SynthesisFormats.fallback(taskId, fetched.getContexts());
        }

        TicketFields ticket = TicketFields.from(fetched.firstOfType(SourceType.ISSUE_TRACKER).orElse(null));
        QualityAssessment quality = qualityScorer.score(ticket, fetched);

        log.info("[CONTEXT_ORCH] On-demand build complete | taskId={} | sources={} | failed={} | quality={} | duration={}",
            taskId, fetched.size(), fetched.failedCount(), quality.getScore(),
            TextUtils.formatDuration(System.currentTimeMillis() - startTime));

        return SynthesizedContext.builder()
            .taskId(taskId)
            .body(body)
            .sourcesUsed(fetched.withContent().stream().map(SourceContext::getSourceName).collect(Collectors.toList()))
            .qualityScore(quality.getScore())
            .gaps(quality.getGaps())
            .builtAt(clock.instant())
            .prebuilt(false)
            .build();
    }

    private Optional<SynthesizedContext> findPrebuilt(String taskId) {
        try {
            Optional<PrebuiltContext> record = store.get(taskId);
            if (record.isEmpty()) {
                return Optional.empty();
            }
            if (store.isStale(record.get())) {
                log.info("[CONTEXT_ORCH] Pre-built context stale | taskId={} | status={} | expiresAt={}",
                    taskId, record.get().getStatus(), record.get().getExpiresAt());
                return Optional.empty();
            }
            return Optional.of(PrebuiltContextStore.toSynthesizedContext(record.get()));
        } catch (StorageException e) {
            log.warn("[CONTEXT_ORCH] Pre-built store unavailable, building on demand | taskId={} | error={}",
                taskId, e.getMessage());
            return Optional.empty();
        }
    }
}
