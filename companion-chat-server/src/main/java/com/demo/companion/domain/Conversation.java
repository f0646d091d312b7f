package com.demo.companion.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Conversation Entity - exactly one per user, created lazily on the first turn.
 *
 * clearedAt is a visibility boundary: history reads skip messages created at
 * or before it, nothing is physically deleted.
 */
@Entity
@Table(name = "conversations", indexes = {
    @Index(name = "idx_conversations_user_id", columnList = "userId", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, unique = true, length = 100)
    private String userId;

    @Column(nullable = false)
    private int totalMessages;

    @Column(nullable = false)
    private long totalTokensUsed;

    private Instant lastMessageAt;

    private Instant clearedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
