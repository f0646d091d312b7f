package com.demo.companion.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token accounting reported by the completion API for one call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {
    private int inputTokens;
    private int outputTokens;
    private int cacheCreationInputTokens;
    private int cacheReadInputTokens;

    public static TokenUsage zero() {
        return new TokenUsage(0, 0, 0, 0);
    }

    /**
     * Input plus output, the amount added to a conversation's running total.
     */
    public long billedTokens() {
        return (long) inputTokens + outputTokens;
    }
}
