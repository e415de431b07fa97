package com.taskpilot.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One row per chat turn that reached the model.
 */
@Entity
@Table(name = "usage_logs")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class UsageLog {

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_LIMIT_REACHED = "LIMIT_REACHED";
    public static final String STATUS_ERROR = "ERROR";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "conversation_id")
    private Long conversationId;

    @Column(nullable = false)
    private String model;

    @Column(name = "tool_call_count")
    @Builder.Default
    private Integer toolCallCount = 0;

    @Column(name = "tool_rounds")
    @Builder.Default
    private Integer toolRounds = 0;

    @Column(name = "response_time_ms")
    @Builder.Default
    private Long responseTimeMs = 0L;

    @Builder.Default
    private String status = STATUS_SUCCESS;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
