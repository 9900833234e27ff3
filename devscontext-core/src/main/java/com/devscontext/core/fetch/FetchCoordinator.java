package com.devscontext.core.fetch;

import com.devscontext.common.util.TextUtils;
import com.devscontext.core.adapter.SourceAdapter;
import com.devscontext.core.config.CoreConfig;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.FetchResult;
import com.devscontext.core.model.SourceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a fetch out to the enabled adapters and joins the results.
 *
 * <p>The primary adapter runs first. Everything else runs concurrently on the
 * fetch executor, with dependants receiving the primary's context (or null when
 * it failed). Every adapter gets exactly one entry in the result, in adapter
 * order; exceptions and timeouts become error entries and never reach the caller.
 */
@Service
@Slf4j
public class FetchCoordinator {

    private final ExecutorService executor;
    private final Clock clock;

    public FetchCoordinator(@Qualifier(CoreConfig.FETCH_EXECUTOR) ExecutorService executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    public FetchResult fetch(String taskId, List<SourceAdapter> adapters, FetchDepth depth,
                             Duration perSourceTimeout, Duration overallTimeout) {
        return fetch(taskId, adapters, depth, perSourceTimeout, overallTimeout, null);
    }

    /**
     * @param ticketHint an already fetched primary context. When given, the primary
     *                   adapter is not called again and the hint takes its slot.
     */
    public FetchResult fetch(String taskId, List<SourceAdapter> adapters, FetchDepth depth,
                             Duration perSourceTimeout, Duration overallTimeout, SourceContext ticketHint) {
        long startTime = System.currentTimeMillis();
        long overallDeadline = System.nanoTime() + overallTimeout.toNanos();

        log.info("[FETCH] Starting fetch | taskId={} | adapters={} | depth={} | perSourceMs={} | overallMs={} | hint={}",
            taskId, adapters.size(), depth, perSourceTimeout.toMillis(), overallTimeout.toMillis(), ticketHint != null);

        SourceContext[] results = new SourceContext[adapters.size()];
        Map<Integer, Future<SourceContext>> pending = new LinkedHashMap<>();

        try {
            // Phase 1: primary
            SourceContext primaryContext = ticketHint;
            int primaryIndex = primaryIndex(adapters);
            if (primaryIndex >= 0) {
                SourceAdapter primary = adapters.get(primaryIndex);
                if (primaryContext == null) {
                    Future<SourceContext> future = executor.submit(() -> invoke(primary, taskId, null, depth));
                    pending.put(primaryIndex, future);
                    long waitNanos = Math.min(perSourceTimeout.toNanos(), overallDeadline - System.nanoTime());
                    primaryContext = await(future, primary, waitNanos, false);
                    pending.remove(primaryIndex);
                }
                results[primaryIndex] = primaryContext;
            }

            // Phase 2: secondaries share one deadline
            SourceContext hint = primaryContext != null && !primaryContext.hasError() ? primaryContext : null;
            for (int i = 0; i < adapters.size(); i++) {
                if (i == primaryIndex) {
                    continue;
                }
                SourceAdapter adapter = adapters.get(i);
                SourceContext adapterHint = adapter.needsPrimaryContext() ? hint : null;
                pending.put(i, executor.submit(() -> invoke(adapter, taskId, adapterHint, depth)));
            }

            long phaseDeadline = Math.min(System.nanoTime() + perSourceTimeout.toNanos(), overallDeadline);
            for (Map.Entry<Integer, Future<SourceContext>> entry : pending.entrySet()) {
                SourceAdapter adapter = adapters.get(entry.getKey());
                boolean overall = overallDeadline <= phaseDeadline;
                results[entry.getKey()] = await(entry.getValue(), adapter, phaseDeadline - System.nanoTime(), overall);
            }
        } catch (InterruptedException e) {
            pending.values().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            log.warn("[FETCH] Fetch interrupted | taskId={}", taskId);
            for (int i = 0; i < results.length; i++) {
                if (results[i] == null) {
                    SourceAdapter adapter = adapters.get(i);
                    results[i] = SourceContext.failure(adapter.getName(), adapter.getSourceType(),
                        "Fetch cancelled", clock.instant());
                }
            }
        }

        FetchResult result = new FetchResult(List.of(results));
        long duration = System.currentTimeMillis() - startTime;
        log.info("[FETCH] Fetch completed | taskId={} | sources={} | failed={} | withContent={} | duration={}",
            taskId, result.size(), result.failedCount(), result.withContent().size(), TextUtils.formatDuration(duration));
        return result;
    }

    private SourceContext await(Future<SourceContext> future, SourceAdapter adapter, long waitNanos,
                                boolean overallCeiling) throws InterruptedException {
        try {
            return future.get(Math.max(0, waitNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            String error = overallCeiling
                ? "Overall fetch timeout exceeded"
                : "Timed out after " + TimeUnit.NANOSECONDS.toMillis(Math.max(0, waitNanos)) + "ms";
            log.warn("[FETCH] Adapter timed out | adapter={} | error={}", adapter.getName(), error);
            return SourceContext.failure(adapter.getName(), adapter.getSourceType(), error, clock.instant());
        } catch (ExecutionException e) {
            // invoke() catches everything, this only happens on executor-level failures
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return SourceContext.failure(adapter.getName(), adapter.getSourceType(),
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), clock.instant());
        }
    }

    private SourceContext invoke(SourceAdapter adapter, String taskId, SourceContext hint, FetchDepth depth) {
        long startTime = System.currentTimeMillis();
        try {
            SourceContext context = adapter.fetchTaskContext(taskId, hint, depth);
            long duration = System.currentTimeMillis() - startTime;
            if (context == null) {
                log.warn("[FETCH] Adapter returned nothing | adapter={} | durationMs={}", adapter.getName(), duration);
                return SourceContext.failure(adapter.getName(), adapter.getSourceType(),
                    "Adapter returned no context", clock.instant());
            }
            log.debug("[FETCH] Adapter completed | adapter={} | chars={} | error={} | durationMs={}",
                adapter.getName(), context.getRawText().length(), context.getError(), duration);
            return context;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            log.warn("[FETCH] Adapter failed | adapter={} | durationMs={} | error={}",
                adapter.getName(), duration, e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return SourceContext.failure(adapter.getName(), adapter.getSourceType(), message, clock.instant());
        }
    }

    private static int primaryIndex(List<SourceAdapter> adapters) {
        for (int i = 0; i < adapters.size(); i++) {
            if (adapters.get(i).isPrimary()) {
                return i;
            }
        }
        return -1;
    }
}
