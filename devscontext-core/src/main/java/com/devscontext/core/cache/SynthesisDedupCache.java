package com.devscontext.core.cache;

import com.devscontext.common.exception.SynthesisException;
import com.devscontext.core.model.SynthesizedContext;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * In-memory TTL cache of synthesized context with single-flight builds.
 *
 * <p>Concurrent callers for the same key share one build. The entry is stored
 * before the in-flight marker is removed, so a caller that misses the marker
 * always finds the entry. Builds run on their own executor; a waiter that gives
 * up does not cancel a build other callers may still be waiting on.
 *
 * <p>Entries expire lazily on read. When full, expired entries are purged first
 * and then the least recently used entry is evicted.
 */
@Slf4j
public class SynthesisDedupCache {

    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;
    private final ExecutorService executor;

    // Access-ordered, guarded by this
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ConcurrentHashMap<String, CompletableFuture<SynthesizedContext>> pending = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong joins = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public SynthesisDedupCache(Duration ttl, int maxSize, Clock clock, ExecutorService executor) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Returns the cached value, joins an in-flight build, or runs {@code builder}
     * once for every caller currently asking for {@code key}. Blocks until done.
     *
     * @throws SynthesisException when the build failed or the wait was interrupted;
     *                            unchecked builder exceptions are rethrown as is
     */
    public SynthesizedContext getOrBuild(String key, Supplier<SynthesizedContext> builder) {
        CompletableFuture<SynthesizedContext> future = getOrBuildAsync(key, builder);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("Interrupted while waiting for context build of " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SynthesisException("Context build failed for " + key, cause);
        }
    }

    public CompletableFuture<SynthesizedContext> getOrBuildAsync(String key, Supplier<SynthesizedContext> builder) {
        Optional<SynthesizedContext> cached = get(key);
        if (cached.isPresent()) {
            hits.incrementAndGet();
            log.debug("[DEDUP_CACHE] Cache hit | key={}", key);
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<SynthesizedContext> created = new CompletableFuture<>();
        CompletableFuture<SynthesizedContext> existing = pending.putIfAbsent(key, created);
        if (existing != null) {
            joins.incrementAndGet();
            log.debug("[DEDUP_CACHE] Joining in-flight build | key={}", key);
            return existing.copy();
        }

        // A build may have finished between the lookup and the registration
        Optional<SynthesizedContext> raced = get(key);
        if (raced.isPresent()) {
            hits.incrementAndGet();
            pending.remove(key, created);
            created.complete(raced.get());
            return created.copy();
        }

        misses.incrementAndGet();
        log.info("[DEDUP_CACHE] Cache miss, starting build | key={}", key);
        executor.execute(() -> runBuild(key, builder, created));
        return created.copy();
    }

    private void runBuild(String key, Supplier<SynthesizedContext> builder, CompletableFuture<SynthesizedContext> future) {
        long startTime = System.currentTimeMillis();
        try {
            SynthesizedContext value = builder.get();
            put(key, value);
            pending.remove(key, future);
            future.complete(value);
            log.info("[DEDUP_CACHE] Build completed | key={} | durationMs={}", key, System.currentTimeMillis() - startTime);
        } catch (Throwable t) {
            pending.remove(key, future);
            future.completeExceptionally(t);
            log.warn("[DEDUP_CACHE] Build failed | key={} | durationMs={} | error={}",
                key, System.currentTimeMillis() - startTime, t.getMessage());
        }
    }

    public synchronized Optional<SynthesizedContext> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isValidAt(clock.instant(), ttl)) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.getValue());
    }

    synchronized void put(String key, SynthesizedContext value) {
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        Instant now = clock.instant();
        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            entries.values().removeIf(e -> !e.isValidAt(now, ttl));
            Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
            while (entries.size() >= maxSize && eldest.hasNext()) {
                String evicted = eldest.next().getKey();
                eldest.remove();
                evictions.incrementAndGet();
                log.debug("[DEDUP_CACHE] Evicted least recently used entry | key={}", evicted);
            }
        }
        entries.put(key, new CacheEntry(value, now));
    }

    public synchronized boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    public synchronized int invalidateAll() {
        int size = entries.size();
        entries.clear();
        log.info("[DEDUP_CACHE] Cache cleared | entries={}", size);
        return size;
    }

    public synchronized int size() {
        return entries.size();
    }

    public boolean isBuilding(String key) {
        return pending.containsKey(key);
    }

    public Stats stats() {
        return new Stats(size(), pending.size(), hits.get(), misses.get(), joins.get(), evictions.get());
    }

    @Value
    public static class Stats {
        int size;
        int inFlight;
        long hits;
        long misses;
        long joins;
        long evictions;
    }

    @Value
    static class CacheEntry {
        SynthesizedContext value;
        Instant createdAt;

        boolean isValidAt(Instant now, Duration ttl) {
            return now.isBefore(createdAt.plus(ttl));
        }
    }
}
