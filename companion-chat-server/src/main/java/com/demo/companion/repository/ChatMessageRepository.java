package com.demo.companion.repository;

import com.demo.companion.domain.ChatMessage;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Repository for chat messages
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, String> {

    List<ChatMessage> findByConversationIdOrderByCreatedAtDesc(String conversationId, Pageable pageable);

    List<ChatMessage> findByConversationIdAndCreatedAtAfterOrderByCreatedAtDesc(
        String conversationId, Instant after, Pageable pageable);

    /**
     * The most recent {@code limit} messages created after {@code clearedAt}
     * (all messages when it is null), returned oldest first.
     */
    default List<ChatMessage> findVisible(String conversationId, Instant clearedAt, int limit) {
        Pageable page = PageRequest.of(0, limit);
        List<ChatMessage> newestFirst = clearedAt == null
                ? findByConversationIdOrderByCreatedAtDesc(conversationId, page)
                : findByConversationIdAndCreatedAtAfterOrderByCreatedAtDesc(conversationId, clearedAt, page);
        List<ChatMessage> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }
}
