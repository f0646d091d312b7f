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
 * Chat message persisted per turn. Immutable once written.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_conversation_created", columnList = "conversationId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36, updatable = false)
    private String conversationId;

    @Convert(converter = MessageRoleConverter.class)
    @Column(nullable = false, length = 20, updatable = false)
    private MessageRole role;

    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private String content;

    private Integer inputTokens;

    private Integer outputTokens;

    private Integer cachedTokens;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String contextSnapshot;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
