package com.demo.companion.service;

import com.demo.companion.domain.ChatMessage;
import com.demo.companion.domain.CommittedTurn;
import com.demo.companion.domain.MessageRole;
import com.demo.companion.domain.TokenUsage;
import com.demo.companion.exception.TurnPersistenceException;
import com.demo.companion.repository.ChatMessageRepository;
import com.demo.companion.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes a finished turn: user message, assistant message, then the
 * conversation counters. The three writes are separate store calls and are
 * never retried, the completion behind them has already been paid for.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TurnCommitter {

    static final int MESSAGES_PER_TURN = 2;

    private final ChatMessageRepository chatMessageRepository;
    private final ConversationRepository conversationRepository;
    private final Clock clock;

    public CommittedTurn commit(String conversationId, String userText, String assistantText,
                                TokenUsage usage, String contextSnapshot) {
        Instant userCreatedAt = clock.instant();
        ChatMessage userMessage;
        try {
            userMessage = chatMessageRepository.save(buildMessage(
                    conversationId, MessageRole.USER, userText, usage, null, userCreatedAt));
        } catch (DataAccessException e) {
            log.error("Failed to store user message: conversationId={}", conversationId, e);
            throw new TurnPersistenceException(false, e);
        }

        try {
            Instant assistantCreatedAt = clock.instant();
            if (!assistantCreatedAt.isAfter(userCreatedAt)) {
                // keep the pair strictly ordered even on a coarse clock
                assistantCreatedAt = userCreatedAt.plusMillis(1);
            }
            ChatMessage assistantMessage = chatMessageRepository.save(buildMessage(
                    conversationId, MessageRole.ASSISTANT, assistantText, usage, contextSnapshot, assistantCreatedAt));

            int updated = conversationRepository.recordTurn(
                    conversationId, usage.billedTokens(), MESSAGES_PER_TURN, assistantCreatedAt);
            if (updated == 0) {
                throw new TurnPersistenceException(true,
                        new IllegalStateException("Conversation not found: " + conversationId));
            }

            log.info("Turn committed: conversationId={}, userMessageId={}, assistantMessageId={}, tokens={}",
                    conversationId, userMessage.getId(), assistantMessage.getId(), usage.billedTokens());
            return new CommittedTurn(userMessage.getId(), assistantMessage.getId(), assistantCreatedAt);
        } catch (DataAccessException e) {
            log.error("Turn partially stored, outcome indeterminate: conversationId={}, userMessageId={}",
                    conversationId, userMessage.getId(), e);
            throw new TurnPersistenceException(true, e);
        }
    }

    private ChatMessage buildMessage(String conversationId, MessageRole role, String content,
                                     TokenUsage usage, String contextSnapshot, Instant createdAt) {
        return ChatMessage.builder()
                .conversationId(conversationId)
                .role(role)
                .content(content)
                .inputTokens(usage.getInputTokens())
                .outputTokens(usage.getOutputTokens())
                .cachedTokens(usage.getCacheReadInputTokens())
                .contextSnapshot(contextSnapshot)
                .createdAt(createdAt)
                .build();
    }
}
