package com.taskpilot.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "conversations", indexes = @Index(name = "ix_conversations_owner", columnList = "owner_id"))
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class Conversation {

    public static final int TITLE_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    /** Set once from the first user message; never changed afterwards. */
    @Column(length = 100, updatable = false)
    private String title;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    // Refreshed explicitly on every appended message.
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public static String deriveTitle(String seedMessage) {
        if (seedMessage == null) {
            return null;
        }
        String trimmed = seedMessage.trim();
        if (trimmed.codePointCount(0, trimmed.length()) <= TITLE_LENGTH) {
            return trimmed;
        }
        // Counted in code points so a surrogate pair is never split.
        return trimmed.substring(0, trimmed.offsetByCodePoints(0, TITLE_LENGTH));
    }
}
