package com.demo.companion.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-neutral prompt: the two system tiers plus the ordered exchange.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptRequest {

    @Builder.Default
    private List<SystemBlock> system = new ArrayList<>();

    @Builder.Default
    private List<PromptMessage> messages = new ArrayList<>();

    public String staticTier() {
        return system.isEmpty() ? null : system.get(0).getText();
    }

    public String dynamicTier() {
        return system.size() < 2 ? null : system.get(1).getText();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SystemBlock {
        private String text;
        // eligible for provider-side prompt caching
        private boolean cached;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PromptMessage {
        private MessageRole role;
        private String content;
    }
}
