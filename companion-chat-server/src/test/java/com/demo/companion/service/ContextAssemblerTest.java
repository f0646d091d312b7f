package com.demo.companion.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.demo.companion.MutableClock;
import com.demo.companion.TestObjects;
import com.demo.companion.domain.ChatContext;
import com.demo.companion.domain.ChatMessage;
import com.demo.companion.domain.CheckIn;
import com.demo.companion.domain.Conversation;
import com.demo.companion.domain.MessageRole;
import com.demo.companion.domain.Profile;
import com.demo.companion.domain.UserAccount;
import com.demo.companion.exception.PreconditionException;
import com.demo.companion.exception.ProfileMissingException;
import com.demo.companion.repository.ChatMessageRepository;
import com.demo.companion.repository.CheckInRepository;
import com.demo.companion.repository.ConversationRepository;
import com.demo.companion.repository.ProfileRepository;
import com.demo.companion.repository.UserAccountRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

class ContextAssemblerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T15:00:00Z");

    private UserAccountRepository userAccountRepository;
    private ProfileRepository profileRepository;
    private ConversationRepository conversationRepository;
    private ChatMessageRepository chatMessageRepository;
    private CheckInRepository checkInRepository;
    private MutableClock clock;
    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        userAccountRepository = mock(UserAccountRepository.class);
        profileRepository = mock(ProfileRepository.class);
        conversationRepository = mock(ConversationRepository.class);
        chatMessageRepository = mock(ChatMessageRepository.class);
        checkInRepository = mock(CheckInRepository.class);
        clock = new MutableClock(NOW);
        assembler = new ContextAssembler(userAccountRepository, profileRepository, conversationRepository,
                chatMessageRepository, checkInRepository, TestObjects.objectMapper(), clock, Duration.ofHours(8));

        when(userAccountRepository.findById("u1")).thenReturn(Optional.of(new UserAccount("u1", "Sam")));
        when(profileRepository.findByUserId("u1")).thenReturn(Optional.of(Profile.builder()
                .id("p1").userId("u1").struggles(List.of("grief")).inTherapy(false).build()));
    }

    @Test
    void missingProfileIsAPrecondition() {
        when(profileRepository.findByUserId("u1")).thenReturn(Optional.empty());

        PreconditionException error = assertThrows(ProfileMissingException.class, () -> assembler.loadContext("u1"));

        assertEquals("User or profile not found", error.getMessage());
        verify(conversationRepository, never()).saveAndFlush(any());
    }

    @Test
    void missingUserIsAPrecondition() {
        when(userAccountRepository.findById("ghost")).thenReturn(Optional.empty());
        assertThrows(ProfileMissingException.class, () -> assembler.loadContext("ghost"));
    }

    @Test
    void createsConversationOnFirstTurn() {
        when(conversationRepository.findByUserId("u1")).thenReturn(Optional.empty());
        when(conversationRepository.saveAndFlush(any(Conversation.class)))
                .thenAnswer(invocation -> {
                    Conversation created = invocation.getArgument(0);
                    created.setId("conv-new");
                    return created;
                });

        ChatContext context = assembler.loadContext("u1");

        assertEquals("conv-new", context.getConversationId());
        assertEquals("Sam", context.getProfile().getName());
        assertTrue(context.getHistory().isEmpty());
        assertEquals(null, context.getLastMessageAt());
    }

    @Test
    void creationRaceResolvesByReReading() {
        Conversation winner = Conversation.builder().id("conv-winner").userId("u1").build();
        when(conversationRepository.findByUserId("u1")).thenReturn(Optional.empty(), Optional.of(winner));
        when(conversationRepository.saveAndFlush(any(Conversation.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        ChatContext context = assembler.loadContext("u1");

        assertEquals("conv-winner", context.getConversationId());
        verify(conversationRepository, times(2)).findByUserId("u1");
    }

    @Test
    void loadsVisibleHistoryAfterClearedAt() {
        Instant clearedAt = NOW.minus(Duration.ofDays(3));
        Conversation conversation = Conversation.builder()
                .id("conv-1").userId("u1").clearedAt(clearedAt).lastMessageAt(NOW.minusSeconds(60)).build();
        when(conversationRepository.findByUserId("u1")).thenReturn(Optional.of(conversation));
        when(chatMessageRepository.findVisible("conv-1", clearedAt, ContextAssembler.HISTORY_LIMIT)).thenReturn(List.of(
                message(MessageRole.USER, "hello", NOW.minusSeconds(120)),
                message(MessageRole.ASSISTANT, "hi Sam", NOW.minusSeconds(119))));

        ChatContext context = assembler.loadContext("u1");

        assertEquals(2, context.getHistory().size());
        assertEquals("hello", context.getHistory().get(0).getContent());
        assertEquals(MessageRole.ASSISTANT, context.getHistory().get(1).getRole());
    }

    @Test
    void normalizesUnreadableCheckInSteps() {
        when(conversationRepository.findByUserId("u1"))
                .thenReturn(Optional.of(Conversation.builder().id("conv-1").userId("u1").build()));
        when(chatMessageRepository.findVisible(eq("conv-1"), isNull(), anyInt())).thenReturn(List.of());
        when(checkInRepository.findCompletedSince("u1", NOW.minus(Duration.ofDays(7)))).thenReturn(List.of(
                checkIn("c1", "[{\"step\":1,\"mood\":4,\"notes\":\"ok\"}]"),
                checkIn("c2", "{\"step\":1}"),
                checkIn("c3", "[]"),
                checkIn("c4", "not json"),
                checkIn("c5", null),
                checkIn("c6", "[1,2,3]")));

        ChatContext context = assembler.loadContext("u1");

        assertEquals(6, context.getRecentCheckIns().size());
        assertEquals(1, context.getRecentCheckIns().get(0).getSteps().size());
        assertEquals("ok", context.getRecentCheckIns().get(0).getSteps().get(0).getNotes());
        for (int i = 1; i < 6; i++) {
            assertTrue(context.getRecentCheckIns().get(i).getSteps().isEmpty());
        }
    }

    @Test
    void refreshIsFalseWithoutPriorMessage() {
        assertFalse(assembler.shouldRefresh(ChatContext.builder().build()));
    }

    @Test
    void refreshBoundaryIsInclusive() {
        assertFalse(assembler.shouldRefresh(contextLastMessage(NOW.minus(Duration.ofHours(8)).plusMillis(1))));
        assertTrue(assembler.shouldRefresh(contextLastMessage(NOW.minus(Duration.ofHours(8)))));
        assertTrue(assembler.shouldRefresh(contextLastMessage(NOW.minus(Duration.ofDays(8)))));
    }

    @Test
    void refreshReplacesOnlyCheckIns() {
        ChatContext context = contextLastMessage(NOW.minus(Duration.ofDays(1)));
        List<ChatContext.HistoryEntry> history = context.getHistory();
        when(checkInRepository.findCompletedSince(eq("u1"), any(Instant.class)))
                .thenReturn(List.of(checkIn("c1", "[]")));

        ChatContext refreshed = assembler.refreshCheckIns(context);

        assertSame(history, refreshed.getHistory());
        assertEquals(1, refreshed.getRecentCheckIns().size());
        verify(profileRepository, never()).findByUserId(any());
    }

    private ChatContext contextLastMessage(Instant lastMessageAt) {
        return ChatContext.builder().userId("u1").lastMessageAt(lastMessageAt).build();
    }

    private ChatMessage message(MessageRole role, String content, Instant createdAt) {
        return ChatMessage.builder().id(content).conversationId("conv-1").role(role)
                .content(content).createdAt(createdAt).build();
    }

    private CheckIn checkIn(String id, String steps) {
        return CheckIn.builder().id(id).userId("u1").date(NOW.minus(Duration.ofDays(1)))
                .overallMood(3.0).completed(true).stepsJson(steps).build();
    }
}
