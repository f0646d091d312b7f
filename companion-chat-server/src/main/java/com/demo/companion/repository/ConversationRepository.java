package com.demo.companion.repository;

import com.demo.companion.domain.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for Conversation entities
 */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {

    /**
     * Find the single conversation of a user
     */
    Optional<Conversation> findByUserId(String userId);

    /**
     * Apply one committed turn to the running counters in a single statement,
     * so concurrent commits never lose an increment.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Conversation c " +
           "SET c.totalTokensUsed = c.totalTokensUsed + :tokens, " +
           "c.totalMessages = c.totalMessages + :messages, " +
           "c.lastMessageAt = :now, " +
           "c.updatedAt = :now " +
           "WHERE c.id = :id")
    int recordTurn(
        @Param("id") String id,
        @Param("tokens") long tokens,
        @Param("messages") int messages,
        @Param("now") Instant now
    );
}
