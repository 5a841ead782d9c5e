package com.intelhub.backend.db.repository;

import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface IntelligenceItemRepository extends JpaRepository<IntelligenceItem, UUID>,
        JpaSpecificationExecutor<IntelligenceItem> {

    Long countByState(ItemState state);

    Page<IntelligenceItem> findByStateIn(Collection<ItemState> states, Pageable pageable);

    // Claim candidates: fresh items, then failed items whose backoff has elapsed
    @Query("SELECT i.uuid FROM IntelligenceItem i WHERE i.state = com.intelhub.backend.db.entity.ItemState.PENDING " +
            "OR (i.state = com.intelhub.backend.db.entity.ItemState.FAILED AND i.attempts < :maxAttempts " +
            "AND i.nextAttemptAt IS NOT NULL AND i.nextAttemptAt <= :now) ORDER BY i.collectedAt ASC")
    List<UUID> findClaimableUuids(@Param("maxAttempts") int maxAttempts, @Param("now") LocalDateTime now, Pageable pageable);

    /**
     * Atomic claim. Moves a claimable item to ANALYZING under a lease; returns 0 when another
     * worker got there first or the item is not claimable.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IntelligenceItem i SET i.state = com.intelhub.backend.db.entity.ItemState.ANALYZING, " +
            "i.leaseOwner = :owner, i.leaseExpiresAt = :leaseExpiresAt, i.attempts = i.attempts + 1, " +
            "i.nextAttemptAt = NULL, i.version = i.version + 1 " +
            "WHERE i.uuid = :uuid AND (i.state = com.intelhub.backend.db.entity.ItemState.PENDING " +
            "OR (i.state = com.intelhub.backend.db.entity.ItemState.FAILED AND i.attempts < :maxAttempts " +
            "AND i.nextAttemptAt IS NOT NULL AND i.nextAttemptAt <= :now))")
    int claim(@Param("uuid") UUID uuid,
              @Param("owner") String owner,
              @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
              @Param("maxAttempts") int maxAttempts,
              @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IntelligenceItem i SET i.state = com.intelhub.backend.db.entity.ItemState.FAILED, " +
            "i.leaseOwner = NULL, i.leaseExpiresAt = NULL, i.lastError = :error, " +
            "i.nextAttemptAt = CASE WHEN i.attempts < :maxAttempts THEN :now ELSE NULL END, " +
            "i.version = i.version + 1 " +
            "WHERE i.state = com.intelhub.backend.db.entity.ItemState.ANALYZING AND i.leaseExpiresAt < :now")
    int releaseExpiredLeases(@Param("now") LocalDateTime now,
                             @Param("maxAttempts") int maxAttempts,
                             @Param("error") String error);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IntelligenceItem i SET i.state = com.intelhub.backend.db.entity.ItemState.PENDING, " +
            "i.attempts = 0, i.nextAttemptAt = NULL, i.lastError = NULL, i.version = i.version + 1 " +
            "WHERE i.uuid = :uuid AND i.state = com.intelhub.backend.db.entity.ItemState.FAILED")
    int resetFailed(@Param("uuid") UUID uuid);

    @Query("SELECT i.appendix.maxRateScore FROM IntelligenceItem i WHERE i.state = com.intelhub.backend.db.entity.ItemState.ARCHIVED " +
            "AND i.appendix.archivedAt BETWEEN :start AND :end")
    List<Double> findArchivedMaxScoresBetween(@Param("start") LocalDateTime start, @Param("end") LocalDateTime end);

    @Query("SELECT i.uuid FROM IntelligenceItem i WHERE i.state = com.intelhub.backend.db.entity.ItemState.ARCHIVED")
    List<UUID> findArchivedUuids();

    // [uuid, maxRateScore] of every archived item
    @Query("SELECT i.uuid, i.appendix.maxRateScore FROM IntelligenceItem i " +
            "WHERE i.state = com.intelhub.backend.db.entity.ItemState.ARCHIVED")
    List<Object[]> findArchivedScores();
}
