package com.demo.companion.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * What a completed turn hands back to the realtime layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResult {
    private String assistantMessage;
    private String messageId;
    private Instant timestamp;
    private TokenUsage tokens;
    private boolean contextRefreshed;
}
