package com.taskpilot.repository;

import com.taskpilot.model.entity.UsageLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface UsageLogRepository extends JpaRepository<UsageLog, UUID> {
    @Query("SELECT COUNT(u) FROM UsageLog u WHERE u.userId = :userId AND u.createdAt >= :since")
    Long countByUserIdSince(@Param("userId") String userId, @Param("since") OffsetDateTime since);

    @Query("SELECT COUNT(u) FROM UsageLog u WHERE u.userId = :userId AND u.status = :status AND u.createdAt >= :since")
    Long countByUserIdAndStatusSince(@Param("userId") String userId,
                                     @Param("status") String status,
                                     @Param("since") OffsetDateTime since);

    @Query("SELECT COALESCE(SUM(u.toolCallCount), 0) FROM UsageLog u WHERE u.userId = :userId AND u.createdAt >= :since")
    Long sumToolCallsByUserIdSince(@Param("userId") String userId, @Param("since") OffsetDateTime since);

    @Query("SELECT COALESCE(AVG(u.responseTimeMs), 0) FROM UsageLog u WHERE u.userId = :userId AND u.createdAt >= :since")
    Double avgResponseTimeMsByUserIdSince(@Param("userId") String userId, @Param("since") OffsetDateTime since);
}
