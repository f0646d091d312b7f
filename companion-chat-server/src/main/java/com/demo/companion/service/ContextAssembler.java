package com.demo.companion.service;

import com.demo.companion.domain.ChatContext;
import com.demo.companion.domain.ChatContext.CheckInSummary;
import com.demo.companion.domain.ChatContext.HistoryEntry;
import com.demo.companion.domain.ChatContext.ProfileFacts;
import com.demo.companion.domain.ChatMessage;
import com.demo.companion.domain.CheckIn;
import com.demo.companion.domain.CheckInStep;
import com.demo.companion.domain.Conversation;
import com.demo.companion.domain.Profile;
import com.demo.companion.domain.UserAccount;
import com.demo.companion.exception.ProfileMissingException;
import com.demo.companion.repository.ChatMessageRepository;
import com.demo.companion.repository.CheckInRepository;
import com.demo.companion.repository.ConversationRepository;
import com.demo.companion.repository.ProfileRepository;
import com.demo.companion.repository.UserAccountRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Gathers profile facts, visible history and recent check-ins for one turn.
 */
@Service
@Slf4j
public class ContextAssembler {

    static final int HISTORY_LIMIT = 1000;
    static final Duration CHECK_IN_WINDOW = Duration.ofDays(7);

    private static final TypeReference<List<CheckInStep>> STEP_LIST = new TypeReference<>() {};

    private final UserAccountRepository userAccountRepository;
    private final ProfileRepository profileRepository;
    private final ConversationRepository conversationRepository;
    private final ChatMessageRepository chatMessageRepository;
    private final CheckInRepository checkInRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration refreshWindow;

    public ContextAssembler(
            UserAccountRepository userAccountRepository,
            ProfileRepository profileRepository,
            ConversationRepository conversationRepository,
            ChatMessageRepository chatMessageRepository,
            CheckInRepository checkInRepository,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${companion.context.refresh-window:8h}") Duration refreshWindow) {
        this.userAccountRepository = userAccountRepository;
        this.profileRepository = profileRepository;
        this.conversationRepository = conversationRepository;
        this.chatMessageRepository = chatMessageRepository;
        this.checkInRepository = checkInRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.refreshWindow = refreshWindow;
    }

    public ChatContext loadContext(String userId) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProfileMissingException(userId));
        Profile profile = profileRepository.findByUserId(userId)
                .orElseThrow(() -> new ProfileMissingException(userId));

        Conversation conversation = findOrCreateConversation(userId);

        List<HistoryEntry> history = chatMessageRepository
                .findVisible(conversation.getId(), conversation.getClearedAt(), HISTORY_LIMIT)
                .stream()
                .map(this::toHistoryEntry)
                .toList();

        ChatContext context = ChatContext.builder()
                .userId(userId)
                .conversationId(conversation.getId())
                .lastMessageAt(conversation.getLastMessageAt())
                .profile(toProfileFacts(user, profile))
                .history(new ArrayList<>(history))
                .recentCheckIns(fetchRecentCheckIns(userId))
                .build();

        log.debug("Context loaded: userId={}, conversationId={}, history={}, checkIns={}",
                userId, conversation.getId(), history.size(), context.getRecentCheckIns().size());
        return context;
    }

    /**
     * True when the previous message is at least one refresh window old.
     */
    public boolean shouldRefresh(ChatContext context) {
        if (context.getLastMessageAt() == null) {
            return false;
        }
        Duration elapsed = Duration.between(context.getLastMessageAt(), clock.instant());
        return elapsed.compareTo(refreshWindow) >= 0;
    }

    /**
     * Re-read the check-in window. Profile and history are left as loaded.
     */
    public ChatContext refreshCheckIns(ChatContext context) {
        context.setRecentCheckIns(fetchRecentCheckIns(context.getUserId()));
        return context;
    }

    private Conversation findOrCreateConversation(String userId) {
        return conversationRepository.findByUserId(userId)
                .orElseGet(() -> createConversation(userId));
    }

    private Conversation createConversation(String userId) {
        try {
            Conversation created = conversationRepository.saveAndFlush(
                    Conversation.builder().userId(userId).build());
            log.info("Conversation created: userId={}, conversationId={}", userId, created.getId());
            return created;
        } catch (DataIntegrityViolationException e) {
            // another turn for the same user created it first
            log.debug("Conversation creation raced, re-reading: userId={}", userId);
            return conversationRepository.findByUserId(userId).orElseThrow(() -> e);
        }
    }

    private List<CheckInSummary> fetchRecentCheckIns(String userId) {
        Instant since = clock.instant().minus(CHECK_IN_WINDOW);
        List<CheckInSummary> summaries = new ArrayList<>();
        for (CheckIn checkIn : checkInRepository.findCompletedSince(userId, since)) {
            summaries.add(CheckInSummary.builder()
                    .date(checkIn.getDate())
                    .overallMood(checkIn.getOverallMood())
                    .steps(parseSteps(checkIn))
                    .build());
        }
        return summaries;
    }

    List<CheckInStep> parseSteps(CheckIn checkIn) {
        String json = checkIn.getStepsJson();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isArray() || node.isEmpty()) {
                return new ArrayList<>();
            }
            return new ArrayList<>(objectMapper.convertValue(node, STEP_LIST));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable check-in steps: checkInId={}, error={}", checkIn.getId(), e.getMessage());
            return new ArrayList<>();
        }
    }

    private ProfileFacts toProfileFacts(UserAccount user, Profile profile) {
        return ProfileFacts.builder()
                .name(user.getName())
                .struggles(profile.getStruggles() != null
                        ? new ArrayList<>(profile.getStruggles())
                        : new ArrayList<>())
                .significantDate(profile.getStruggleTimestamp())
                .significantNote(profile.getStruggleNotes())
                .inTherapy(profile.isInTherapy())
                .therapyDetails(profile.getTherapyDetails())
                .build();
    }

    private HistoryEntry toHistoryEntry(ChatMessage message) {
        return HistoryEntry.builder()
                .role(message.getRole())
                .content(message.getContent())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
