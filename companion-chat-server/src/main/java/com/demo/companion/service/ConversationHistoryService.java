package com.demo.companion.service;

import com.demo.companion.domain.ChatMessage;
import com.demo.companion.domain.Conversation;
import com.demo.companion.domain.ConversationHistory;
import com.demo.companion.repository.ChatMessageRepository;
import com.demo.companion.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationHistoryService {

    static final int HISTORY_PAGE = 100;

    private final ConversationRepository conversationRepository;
    private final ChatMessageRepository chatMessageRepository;

    /**
     * Most recent visible messages of the user's conversation, oldest first.
     * A user without a conversation gets a null id and no messages.
     */
    public ConversationHistory getConversationHistory(String userId) {
        Optional<Conversation> conversation = conversationRepository.findByUserId(userId);
        if (conversation.isEmpty()) {
            return ConversationHistory.builder().build();
        }

        Conversation found = conversation.get();
        List<ConversationHistory.Entry> entries = chatMessageRepository
                .findVisible(found.getId(), found.getClearedAt(), HISTORY_PAGE)
                .stream()
                .map(this::toEntry)
                .toList();

        log.debug("History read: userId={}, conversationId={}, messages={}", userId, found.getId(), entries.size());
        return ConversationHistory.builder()
                .conversationId(found.getId())
                .messages(entries)
                .build();
    }

    private ConversationHistory.Entry toEntry(ChatMessage message) {
        return new ConversationHistory.Entry(
                message.getId(),
                message.getRole().name().toLowerCase(Locale.ROOT),
                message.getContent(),
                message.getCreatedAt());
    }
}
