package com.devscontext.core.watcher;

import com.devscontext.core.adapter.AdapterRegistry;
import com.devscontext.core.adapter.IssueTracker;
import com.devscontext.core.adapter.IssueTracker.TrackedIssue;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.pipeline.PreprocessingPipeline;
import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.data.entity.PrebuiltContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the issue tracker for tickets in the trigger status and pre-builds
 * context for each one that has no fresh record.
 *
 * <p>At most one cycle runs at a time; a cycle that starts while another is in
 * progress returns immediately. A failing ticket is logged and left for the
 * next cycle.
 */
@Service
@Slf4j
public class SourceWatcher {

    private final AdapterRegistry registry;
    private final PreprocessingPipeline pipeline;
    private final PrebuiltContextStore store;
    private final DevsContextProperties.Preprocessor config;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger processedCount = new AtomicInteger();

    public SourceWatcher(AdapterRegistry registry, PreprocessingPipeline pipeline,
                         PrebuiltContextStore store, DevsContextProperties properties) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.store = store;
        this.config = properties.getAgents().getPreprocessor();
    }

    /**
     * One poll cycle.
     *
     * @return the task ids built in this cycle
     */
    public List<String> pollOnce() {
        if (stopped.get()) {
            log.debug("[WATCHER] Watcher stopped, skipping cycle");
            return List.of();
        }
        if (!running.compareAndSet(false, true)) {
            log.info("[WATCHER] Previous cycle still running, skipping");
            return List.of();
        }
        long startTime = System.currentTimeMillis();
        try {
            return runCycle(startTime);
        } finally {
            running.set(false);
        }
    }

    public int runOnce() {
        return pollOnce().size();
    }

    public void stop() {
        stopped.set(true);
        log.info("[WATCHER] Watcher stopped | processedTotal={}", processedCount.get());
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getProcessedCount() {
        return processedCount.get();
    }

    private List<String> runCycle(long startTime) {
        try {
            store.markExpired();
        } catch (RuntimeException e) {
            log.warn("[WATCHER] Storage maintenance failed | error={}", e.getMessage());
        }

        Optional<IssueTracker> tracker = registry.getIssueTracker();
        if (tracker.isEmpty()) {
            log.warn("[WATCHER] No issue tracker adapter enabled, nothing to poll");
            return List.of();
        }

        List<TrackedIssue> issues;
        try {
            issues = tracker.get().findIssues(config.getJiraStatus(), config.getJiraProjects(), config.getMaxTicketsPerCycle());
        } catch (RuntimeException e) {
            log.error("[WATCHER] Issue query failed | status={} | projects={} | error={}",
                config.getJiraStatus(), config.getJiraProjects(), e.getMessage(), e);
            return List.of();
        }
        log.info("[WATCHER] Poll cycle started | status={} | projects={} | candidates={}",
            config.getJiraStatus(), config.getJiraProjects(), issues.size());

        List<String> processed = new ArrayList<>();
        int skipped = 0;
        int failed = 0;
        for (TrackedIssue issue : issues) {
            if (stopped.get()) {
                break;
            }
            try {
                if (!needsBuild(issue)) {
                    skipped++;
                    continue;
                }
                pipeline.build(issue.key());
                processed.add(issue.key());
                processedCount.incrementAndGet();
            } catch (RuntimeException e) {
                failed++;
                log.error("[WATCHER] Preprocessing failed | taskId={} | error={}", issue.key(), e.getMessage(), e);
            }
        }

        log.info("[WATCHER] Poll cycle completed | built={} | skipped={} | failed={} | durationMs={}",
            processed.size(), skipped, failed, System.currentTimeMillis() - startTime);
        return processed;
    }

    /**
     * No record, a stale one, or a ticket updated after the record was built.
     * The last case is flagged stale in the store before rebuilding.
     */
    boolean needsBuild(TrackedIssue issue) {
        Optional<PrebuiltContext> existing = store.get(issue.key());
        if (existing.isEmpty()) {
            return true;
        }
        PrebuiltContext record = existing.get();
        if (store.isStale(record)) {
            log.debug("[WATCHER] Stored context stale | taskId={} | status={} | expiresAt={}",
                issue.key(), record.getStatus(), record.getExpiresAt());
            return true;
        }
        if (issue.updated() != null && record.getBuiltAt() != null && issue.updated().isAfter(record.getBuiltAt())) {
            log.info("[WATCHER] Ticket changed since build | taskId={} | builtAt={} | updated={}",
                issue.key(), record.getBuiltAt(), issue.updated());
            store.markStale(issue.key());
            return true;
        }
        log.debug("[WATCHER] Stored context fresh, skipping | taskId={}", issue.key());
        return false;
    }
}
