package com.devscontext.data.repository;

import com.devscontext.data.entity.ContextStatus;
import com.devscontext.data.entity.PrebuiltContext;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface PrebuiltContextRepository extends JpaRepository<PrebuiltContext, String> {

    /**
     * Rows with {@code status} still inside their TTL. A row expiring exactly
     * at {@code now} counts as live, matching {@link PrebuiltContext#isExpiredAt(Instant)}.
     */
    @Query("SELECT COUNT(p) FROM PrebuiltContext p WHERE p.status = :status AND p.expiresAt >= :now")
    long countLive(@Param("status") ContextStatus status, @Param("now") Instant now);

    long countByStatus(ContextStatus status);

    /**
     * Rows flagged {@code flagged} by maintenance plus {@code live} rows past their
     * TTL that maintenance has not reached yet.
     */
    @Query("SELECT COUNT(p) FROM PrebuiltContext p WHERE p.status = :flagged OR (p.status = :live AND p.expiresAt < :now)")
    long countPastTtl(@Param("flagged") ContextStatus flagged, @Param("live") ContextStatus live, @Param("now") Instant now);

    @Query("SELECT AVG(p.qualityScore) FROM PrebuiltContext p")
    Double averageQualityScore();

    @Query("SELECT MAX(p.builtAt) FROM PrebuiltContext p")
    Instant findLatestBuiltAt();

    List<PrebuiltContext> findAllByOrderByBuiltAtDesc();

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM PrebuiltContext p WHERE p.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE PrebuiltContext p SET p.status = :status WHERE p.expiresAt < :now AND p.status <> :status")
    int updateStatusWhereExpired(@Param("now") Instant now, @Param("status") ContextStatus status);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE PrebuiltContext p SET p.status = :status WHERE p.taskId = :taskId")
    int updateStatus(@Param("taskId") String taskId, @Param("status") ContextStatus status);

    default int markExpired(Instant now) {
        return updateStatusWhereExpired(now, ContextStatus.EXPIRED);
    }

    default long countActive(Instant now) {
        return countLive(ContextStatus.ACTIVE, now);
    }

    /** Stale rows are left out, so active, expired and stale never overlap. */
    default long countExpired(Instant now) {
        return countPastTtl(ContextStatus.EXPIRED, ContextStatus.ACTIVE, now);
    }

    default int markStale(String taskId) {
        return updateStatus(taskId, ContextStatus.STALE);
    }
}
