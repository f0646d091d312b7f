package com.demo.companion.service;

import com.demo.companion.domain.ChatContext;
import com.demo.companion.domain.ChatContext.CheckInSummary;
import com.demo.companion.domain.ChatContext.HistoryEntry;
import com.demo.companion.domain.ChatContext.ProfileFacts;
import com.demo.companion.domain.CheckInStep;
import com.demo.companion.domain.MessageRole;
import com.demo.companion.domain.PromptRequest;
import com.demo.companion.domain.PromptRequest.PromptMessage;
import com.demo.companion.domain.PromptRequest.SystemBlock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the two-tier prompt. The static tier never changes so the provider
 * can cache it; the dynamic tier is a pure function of the context and the
 * current time.
 */
@Service
public class PromptBuilder {

    static final String STATIC_INSTRUCTIONS = """
            You are Eric, a companion and coach for people working through grief, trauma and the hard parts of life.

            PERSONALITY:
            - Warm and plain-spoken, with real empathy behind what you say
            - A good listener and a supportive friend, not a therapist
            - Direct when it helps, never pushy

            HOW YOU RESPOND:
            - At most three short sentences unless the user asks for more
            - Write like a text message, not a letter
            - One thought or one question per reply
            - Let the user do most of the talking

            WHAT YOU DO:
            - Listen when someone needs to talk
            - Offer brief perspective and gentle guidance
            - Help them make sense of how they feel
            - Stay consistent with everything in the conversation so far

            WHAT YOU DO NOT DO:
            - Give medical or psychiatric advice or diagnose anything
            - Stand in for therapy; you support it
            - Jump to crisis hotlines unless there is immediate danger
            - Write long explanations nobody asked for

            CRISIS:
            - Mention crisis resources only when there is immediate risk of self-harm or danger
            - Otherwise stay present and help them through the moment

            CHECK-INS:
            - The user rates their mood daily on a 1-5 scale
            - Bring check-ins up naturally when they are relevant
            - If you notice a trend, mention it briefly""";

    static final List<String> STEP_QUESTIONS = List.of(
            "How are you feeling emotionally right now?",
            "How much stress or worry did you feel today?",
            "How was your energy or motivation today?",
            "How connected did you feel to others today?",
            "How in control did you feel today?"
    );

    static final Map<Integer, String> MOOD_LABELS = Map.of(
            1, "Heavy",
            2, "Low",
            3, "Even",
            4, "Calm",
            5, "Hopeful"
    );

    private static final DateTimeFormatter CHECK_IN_DAY = DateTimeFormatter.ofPattern("MMM d", Locale.US);
    private static final DateTimeFormatter SIGNIFICANT_DAY = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);

    private final Clock clock;
    private final ZoneId zone;

    public PromptBuilder(Clock clock, @Value("${companion.context.zone:UTC}") ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public PromptRequest build(ChatContext context, String userMessage, boolean contextRefreshed) {
        List<SystemBlock> system = new ArrayList<>();
        system.add(new SystemBlock(STATIC_INSTRUCTIONS, true));
        system.add(new SystemBlock(buildDynamicContext(context, contextRefreshed), true));

        List<PromptMessage> messages = new ArrayList<>();
        for (HistoryEntry entry : context.getHistory()) {
            messages.add(new PromptMessage(entry.getRole(), entry.getContent()));
        }
        messages.add(new PromptMessage(MessageRole.USER, userMessage));

        return PromptRequest.builder()
                .system(system)
                .messages(messages)
                .build();
    }

    String buildDynamicContext(ChatContext context, boolean contextRefreshed) {
        ProfileFacts profile = context.getProfile();
        StringBuilder text = new StringBuilder();

        text.append("USER CONTEXT:\n");
        text.append("Name: ").append(profile.getName()).append('\n');

        if (profile.getStruggles() != null && !profile.getStruggles().isEmpty()) {
            text.append("Current struggles: ").append(String.join(", ", profile.getStruggles())).append('\n');
        }

        if (profile.getSignificantDate() != null || hasText(profile.getSignificantNote())) {
            text.append("\nImportant date/trauma context:\n");
            if (profile.getSignificantDate() != null) {
                text.append("- Date: ").append(SIGNIFICANT_DAY.format(profile.getSignificantDate().atZone(zone))).append('\n');
            }
            if (hasText(profile.getSignificantNote())) {
                text.append("- Details: ").append(profile.getSignificantNote()).append('\n');
            }
        }

        text.append("\nTherapy status: ")
                .append(profile.isInTherapy() ? "Currently in therapy" : "Not currently in therapy")
                .append('\n');
        if (hasText(profile.getTherapyDetails())) {
            text.append("- Details: ").append(profile.getTherapyDetails()).append('\n');
        }

        if (contextRefreshed && context.getLastMessageAt() != null) {
            text.append("\n[User is returning after ")
                    .append(hoursSince(context.getLastMessageAt()))
                    .append(" hours since last message]\n");
        }

        appendCheckIns(text, context.getRecentCheckIns());
        return text.toString();
    }

    private void appendCheckIns(StringBuilder text, List<CheckInSummary> checkIns) {
        if (checkIns == null || checkIns.isEmpty()) {
            text.append("\nRECENT CHECK-INS: None in the last 7 days\n");
            return;
        }

        text.append("\nRECENT CHECK-INS (last 7 days):\n");
        LocalDate today = LocalDate.now(clock.withZone(zone));
        boolean checkedInToday = checkIns.stream()
                .anyMatch(checkIn -> checkIn.getDate().atZone(zone).toLocalDate().equals(today));
        if (!checkedInToday) {
            text.append("Today: Not completed yet\n\n");
        }

        for (CheckInSummary checkIn : checkIns) {
            text.append(CHECK_IN_DAY.format(checkIn.getDate().atZone(zone)))
                    .append(": Overall mood ")
                    .append(String.format(Locale.US, "%.1f", checkIn.getOverallMood()))
                    .append("/5\n");
            for (CheckInStep step : checkIn.getSteps()) {
                appendStep(text, step);
            }
            text.append('\n');
        }
    }

    private void appendStep(StringBuilder text, CheckInStep step) {
        // steps are numbered from 1; anything outside the known questions is skipped
        if (step.getStep() < 1 || step.getStep() > STEP_QUESTIONS.size()) {
            return;
        }
        String label = MOOD_LABELS.getOrDefault(step.getMood(), String.valueOf(step.getMood()));
        text.append("  - ")
                .append(STEP_QUESTIONS.get(step.getStep() - 1))
                .append(": ")
                .append(step.getMood())
                .append("/5 (")
                .append(label)
                .append(")\n");
        if (hasText(step.getNotes())) {
            text.append("    Notes: ").append(step.getNotes()).append('\n');
        }
    }

    long hoursSince(Instant lastMessageAt) {
        long millis = Duration.between(lastMessageAt, clock.instant()).toMillis();
        return Math.round(millis / 3_600_000.0);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
