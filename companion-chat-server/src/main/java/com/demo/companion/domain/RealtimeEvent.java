package com.demo.companion.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Realtime frame in both directions: {"event": name, "data": {...}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RealtimeEvent {

    public static final String SEND_MESSAGE = "sendMessage";
    public static final String CONNECTED = "connected";
    public static final String TYPING = "typing";
    public static final String MESSAGE_RESPONSE = "messageResponse";
    public static final String ERROR = "error";

    private String event;
    private Object data;

    public static RealtimeEvent connected(String userId) {
        return new RealtimeEvent(CONNECTED, Map.of(
                "message", "Connected to chat",
                "userId", userId
        ));
    }

    public static RealtimeEvent typing(boolean typing) {
        return new RealtimeEvent(TYPING, Map.of("typing", typing));
    }

    public static RealtimeEvent messageResponse(TurnResult result) {
        TokenUsage usage = result.getTokens() != null ? result.getTokens() : TokenUsage.zero();
        Map<String, Object> tokens = new LinkedHashMap<>();
        tokens.put("inputTokens", usage.getInputTokens());
        tokens.put("outputTokens", usage.getOutputTokens());
        tokens.put("cacheCreationInputTokens", usage.getCacheCreationInputTokens());
        tokens.put("cacheReadInputTokens", usage.getCacheReadInputTokens());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("role", MessageRole.ASSISTANT.toUpstream());
        data.put("content", result.getAssistantMessage());
        data.put("messageId", result.getMessageId());
        data.put("timestamp", result.getTimestamp() != null ? result.getTimestamp().toString() : null);
        data.put("tokens", tokens);
        data.put("contextRefreshed", result.isContextRefreshed());
        return new RealtimeEvent(MESSAGE_RESPONSE, data);
    }

    public static RealtimeEvent error(String message) {
        return new RealtimeEvent(ERROR, Map.of("message", message));
    }
}
