package com.intelhub.backend.ai.repository;

import com.intelhub.backend.ai.entity.AiUsageLog;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AiUsageLogRepository extends JpaRepository<AiUsageLog, Long> {

    List<AiUsageLog> findByItemUuid(UUID itemUuid);

    @Query("SELECT a FROM AiUsageLog a WHERE a.success = false ORDER BY a.usedAt DESC")
    List<AiUsageLog> findFailedOperations(Pageable pageable);

    @Query("SELECT COUNT(a) FROM AiUsageLog a WHERE a.operation = :operation AND a.usedAt >= :since")
    Long countOperationUsageSince(@Param("operation") AiUsageLog.Operation operation, @Param("since") LocalDateTime since);

    @Query("SELECT COUNT(a) FROM AiUsageLog a WHERE a.operation = :operation AND a.success = false AND a.usedAt >= :since")
    Long countOperationFailuresSince(@Param("operation") AiUsageLog.Operation operation, @Param("since") LocalDateTime since);

    @Query("SELECT SUM(a.tokenCount) FROM AiUsageLog a WHERE a.operation = :operation AND a.usedAt >= :since")
    Long sumTokensByOperationSince(@Param("operation") AiUsageLog.Operation operation, @Param("since") LocalDateTime since);
}
