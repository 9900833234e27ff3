package com.devscontext.core.storage;

import com.devscontext.common.exception.StorageException;
import com.devscontext.core.model.Gap;
import com.devscontext.core.model.SynthesizedContext;
import com.devscontext.data.entity.ContextStatus;
import com.devscontext.data.entity.PrebuiltContext;
import com.devscontext.data.repository.PrebuiltContextRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable store of pre-built context, one row per task.
 *
 * <p>The agent process is the only writer; the API process only reads. Writes
 * are single-row upserts by task id, so a reader sees either the previous row or
 * the new one. There is no locking beyond what the database does for one write.
 * Database errors surface as {@link StorageException}.
 *
 * <p>{@code sourceDataHash} is kept for the optional content check in
 * {@link #isStale(PrebuiltContext, String)}, for callers that already hold
 * freshly fetched source text. The watcher does not fetch everything to get a
 * hash; it checks freshness against the ticket's {@code updated} time, so TTL and
 * that timestamp are the staleness signals in normal operation.
 */
@Service
@Slf4j
public class PrebuiltContextStore {

    private final PrebuiltContextRepository repository;
    private final Clock clock;

    public PrebuiltContextStore(PrebuiltContextRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Optional<PrebuiltContext> get(String taskId) {
        return access("get", () -> repository.findById(taskId));
    }

    /** Inserts or replaces the row for the record's task id. */
    @Transactional
    public PrebuiltContext put(PrebuiltContext record) {
        long startTime = System.currentTimeMillis();
        PrebuiltContext saved = access("put", () -> repository.save(record));
        log.info("[STORAGE] Context stored | taskId={} | quality={} | expiresAt={} | durationMs={}",
            record.getTaskId(), record.getQualityScore(), record.getExpiresAt(), System.currentTimeMillis() - startTime);
        return saved;
    }

    /** Stale when flagged by maintenance or past its expiry. */
    public boolean isStale(PrebuiltContext record) {
        return record.getStatus() != ContextStatus.ACTIVE || record.isExpiredAt(clock.instant());
    }

    /**
     * Also stale when a freshly computed source hash no longer matches the
     * stored one. A null hash means no source hash was computed and only TTL applies.
     */
    public boolean isStale(PrebuiltContext record, String currentSourceHash) {
        if (isStale(record)) {
            return true;
        }
        return currentSourceHash != null && !currentSourceHash.equals(record.getSourceDataHash());
    }

    public PrebuiltStats stats() {
        Instant now = clock.instant();
        return access("stats", () -> PrebuiltStats.builder()
            .total(repository.count())
            .active(repository.countActive(now))
            .expired(repository.countExpired(now))
            .stale(repository.countByStatus(ContextStatus.STALE))
            .avgQuality(repository.averageQualityScore())
            .lastBuild(repository.findLatestBuiltAt())
            .build());
    }

    @Transactional
    public boolean delete(String taskId) {
        return access("delete", () -> {
            if (!repository.existsById(taskId)) {
                return false;
            }
            repository.deleteById(taskId);
            return true;
        });
    }

    public int deleteExpired() {
        int deleted = access("deleteExpired", () -> repository.deleteExpired(clock.instant()));
        if (deleted > 0) {
            log.info("[STORAGE] Expired contexts deleted | count={}", deleted);
        }
        return deleted;
    }

    public int markExpired() {
        int marked = access("markExpired", () -> repository.markExpired(clock.instant()));
        if (marked > 0) {
            log.info("[STORAGE] Contexts marked expired | count={}", marked);
        }
        return marked;
    }

    public boolean markStale(String taskId) {
        boolean marked = access("markStale", () -> repository.markStale(taskId)) > 0;
        log.debug("[STORAGE] Context marked stale | taskId={} | found={}", taskId, marked);
        return marked;
    }

    public List<PrebuiltSummary> listAll() {
        return access("listAll", () -> repository.findAllByOrderByBuiltAtDesc().stream()
            .map(PrebuiltContextStore::toSummary)
            .collect(Collectors.toList()));
    }

    public static SynthesizedContext toSynthesizedContext(PrebuiltContext record) {
        List<Gap> gaps = record.getGaps() == null ? List.of()
            : record.getGaps().stream().filter(Objects::nonNull).map(Gap::fromDescription).collect(Collectors.toList());
        return SynthesizedContext.builder()
            .taskId(record.getTaskId())
            .body(record.getSynthesizedContext())
            .sourcesUsed(record.getSourcesUsed() == null ? List.of() : List.copyOf(record.getSourcesUsed()))
            .qualityScore(record.getQualityScore() == null ? 0.0 : record.getQualityScore())
            .gaps(gaps)
            .builtAt(record.getBuiltAt())
            .prebuilt(true)
            .build();
    }

    private static PrebuiltSummary toSummary(PrebuiltContext record) {
        return PrebuiltSummary.builder()
            .taskId(record.getTaskId())
            .qualityScore(record.getQualityScore() == null ? 0.0 : record.getQualityScore())
            .builtAt(record.getBuiltAt())
            .expiresAt(record.getExpiresAt())
            .gapsCount(record.getGaps() == null ? 0 : record.getGaps().size())
            .status(record.getStatus())
            .build();
    }

    private <T> T access(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("[STORAGE] Storage operation failed | operation={} | error={}", operation, e.getMessage(), e);
            throw new StorageException("Prebuilt context " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
