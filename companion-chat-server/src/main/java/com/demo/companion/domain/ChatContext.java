package com.demo.companion.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one turn needs to know about the user, assembled per turn and
 * never cached across turns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatContext {
    private String userId;
    private String conversationId;
    private Instant lastMessageAt;
    private ProfileFacts profile;

    @Builder.Default
    private List<HistoryEntry> history = new ArrayList<>();

    @Builder.Default
    private List<CheckInSummary> recentCheckIns = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProfileFacts {
        private String name;

        @Builder.Default
        private List<String> struggles = new ArrayList<>();

        private Instant significantDate;
        private String significantNote;
        private boolean inTherapy;
        private String therapyDetails;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CheckInSummary {
        private Instant date;
        private double overallMood;

        @Builder.Default
        private List<CheckInStep> steps = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryEntry {
        private MessageRole role;
        private String content;
        private Instant createdAt;
    }
}
