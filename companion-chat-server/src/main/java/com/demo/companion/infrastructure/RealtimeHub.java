package com.demo.companion.infrastructure;

import com.demo.companion.domain.ConnectionWrapper;
import com.demo.companion.domain.GroupEnvelope;
import com.demo.companion.domain.RealtimeEvent;
import com.demo.companion.domain.SendMessageRequest;
import com.demo.companion.domain.TurnResult;
import com.demo.companion.exception.ChatException;
import com.demo.companion.service.InboundMessageValidator;
import com.demo.companion.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers events to user groups and drives inbound chat turns.
 *
 * A group emission goes to every open local connection of the user and is
 * mirrored through the relay so other instances reach theirs.
 */
@Component
@Slf4j
public class RealtimeHub {

    private final ConnectionRegistry registry;
    private final BroadcastRelay relay;
    private final ChatOrchestrator orchestrator;
    private final InboundMessageValidator validator;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Executor turnExecutor;
    private final Duration turnTimeout;

    public RealtimeHub(ConnectionRegistry registry,
                       BroadcastRelay relay,
                       ChatOrchestrator orchestrator,
                       InboundMessageValidator validator,
                       MetricsService metricsService,
                       ObjectMapper objectMapper,
                       @Qualifier("turnExecutor") Executor turnExecutor,
                       @Value("${companion.realtime.turn-timeout:180s}") Duration turnTimeout) {
        this.registry = registry;
        this.relay = relay;
        this.orchestrator = orchestrator;
        this.validator = validator;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.turnExecutor = turnExecutor;
        this.turnTimeout = turnTimeout;
    }

    @PostConstruct
    public void start() {
        relay.subscribe(envelope -> deliverLocally(envelope.getUserId(), envelope.toEvent()));
        if (!relay.isEnabled()) {
            log.warn("Realtime hub running without broadcast relay, events reach local connections only");
        }
    }

    /**
     * Validate and run one sendMessage. Never throws: every failure ends as an
     * error event to the originating connection. The returned future completes
     * after typing has stopped.
     */
    public CompletableFuture<Void> handleSendMessage(ConnectionWrapper connection, SendMessageRequest request) {
        String userId = connection.getUserId();
        try {
            validator.validate(userId, request);
        } catch (ChatException e) {
            metricsService.recordRejectedMessage(userId, e.getMessage());
            sendTo(connection, RealtimeEvent.error(e.getMessage()));
            return CompletableFuture.completedFuture(null);
        }

        registry.touchPresence(connection);
        metricsService.recordTurnStarted(userId);
        MetricsService.TimerSample sample = metricsService.startTimer();
        emitToGroup(userId, RealtimeEvent.typing(true));

        CompletableFuture<TurnResult> turn;
        try {
            turn = CompletableFuture.supplyAsync(
                    () -> orchestrator.handleUserMessage(userId, request.getMessage()), turnExecutor);
        } catch (RejectedExecutionException e) {
            turn = CompletableFuture.failedFuture(new ChatException("Server is busy, please try again", e));
        }

        return turn.orTimeout(turnTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    try {
                        if (error == null) {
                            emitToGroup(userId, RealtimeEvent.messageResponse(result));
                            metricsService.recordTurnCompleted(userId, sample, result.getTokens().billedTokens());
                        } else {
                            reportFailure(connection, error);
                        }
                    } finally {
                        emitToGroup(userId, RealtimeEvent.typing(false));
                    }
                    return null;
                });
    }

    /**
     * Deliver locally and mirror to the other instances.
     */
    public void emitToGroup(String userId, RealtimeEvent event) {
        deliverLocally(userId, event);
        if (relay.isEnabled()) {
            relay.publish(GroupEnvelope.of(userId, event));
        }
    }

    public void sendTo(ConnectionWrapper connection, RealtimeEvent event) {
        String payload = serialize(event);
        if (payload != null) {
            send(connection, payload);
        }
    }

    public boolean isUserConnected(String userId) {
        return registry.isUserConnected(userId);
    }

    void deliverLocally(String userId, RealtimeEvent event) {
        List<ConnectionWrapper> members = registry.localGroup(userId);
        if (members.isEmpty()) {
            return;
        }
        String payload = serialize(event);
        if (payload == null) {
            return;
        }
        for (ConnectionWrapper member : members) {
            send(member, payload);
        }
    }

    private void reportFailure(ConnectionWrapper connection, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        String userId = connection.getUserId();

        if (cause instanceof TimeoutException) {
            metricsService.recordTurnFailed(userId, "timeout");
            sendTo(connection, RealtimeEvent.error("Response timed out, please try again"));
        } else if (cause instanceof ChatException chatException) {
            metricsService.recordTurnFailed(userId, cause.getClass().getSimpleName());
            log.warn("Turn failed: userId={}, error={}", userId, cause.getMessage());
            sendTo(connection, RealtimeEvent.error(chatException.getMessage()));
        } else {
            metricsService.recordTurnFailed(userId, "unexpected");
            log.error("Unexpected turn failure: userId={}", userId, cause);
            sendTo(connection, RealtimeEvent.error("Failed to process message"));
        }
    }

    private void send(ConnectionWrapper connection, String payload) {
        if (!connection.isOpen()) {
            log.debug("Skipping closed connection: connectionId={}", connection.getConnectionId());
            return;
        }
        try {
            connection.getWsSession().sendMessage(new TextMessage(payload));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to deliver event: connectionId={}, userId={}, error={}",
                    connection.getConnectionId(), connection.getUserId(), e.getMessage());
            metricsService.recordError("DELIVERY_ERROR", "RealtimeHub");
        }
    }

    private String serialize(RealtimeEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: event={}", event.getEvent(), e);
            return null;
        }
    }
}
