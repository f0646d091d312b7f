package com.demo.companion.infrastructure;

import com.demo.companion.domain.ChatContext;
import com.demo.companion.domain.CommittedTurn;
import com.demo.companion.domain.CompletionResult;
import com.demo.companion.domain.PromptRequest;
import com.demo.companion.domain.TurnResult;
import com.demo.companion.service.CompletionClient;
import com.demo.companion.service.ContextAssembler;
import com.demo.companion.service.PromptBuilder;
import com.demo.companion.service.TurnCommitter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one chat turn end to end under the user's turn lock:
 * load context, maybe refresh check-ins, build the prompt, call the model,
 * commit both messages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatOrchestrator {

    private final UserTurnLock turnLock;
    private final ContextAssembler contextAssembler;
    private final PromptBuilder promptBuilder;
    private final CompletionClient completionClient;
    private final TurnCommitter turnCommitter;
    private final ObjectMapper objectMapper;

    public TurnResult handleUserMessage(String userId, String message) {
        return turnLock.withLock(userId, () -> runTurn(userId, message));
    }

    private TurnResult runTurn(String userId, String message) {
        ChatContext context = contextAssembler.loadContext(userId);

        boolean refreshed = contextAssembler.shouldRefresh(context);
        if (refreshed) {
            log.info("Refreshing check-ins after a long gap: userId={}, lastMessageAt={}",
                    userId, context.getLastMessageAt());
            contextAssembler.refreshCheckIns(context);
        }

        PromptRequest prompt = promptBuilder.build(context, message, refreshed);
        CompletionResult completion = completionClient.complete(prompt);

        CommittedTurn committed = turnCommitter.commit(
                context.getConversationId(),
                message,
                completion.getText(),
                completion.getUsage(),
                snapshot(context, refreshed));

        return TurnResult.builder()
                .assistantMessage(completion.getText())
                .messageId(committed.getAssistantMessageId())
                .timestamp(committed.getCommittedAt())
                .tokens(completion.getUsage())
                .contextRefreshed(refreshed)
                .build();
    }

    private String snapshot(ChatContext context, boolean refreshed) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("contextRefreshed", refreshed);
        snapshot.put("checkInCount", context.getRecentCheckIns().size());
        snapshot.put("historySize", context.getHistory().size());
        snapshot.put("lastMessageAt", context.getLastMessageAt());
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.warn("Context snapshot not serializable, storing none: userId={}, error={}",
                    context.getUserId(), e.getMessage());
            return null;
        }
    }
}
