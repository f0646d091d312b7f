package com.demo.companion.handler;

import com.demo.companion.domain.ConnectionState;
import com.demo.companion.domain.ConnectionWrapper;
import com.demo.companion.domain.RealtimeEvent;
import com.demo.companion.domain.SendMessageRequest;
import com.demo.companion.infrastructure.ConnectionRegistry;
import com.demo.companion.infrastructure.RealtimeHub;
import com.demo.companion.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * WebSocket transport for /ws/chat. Identity comes from the handshake and is
 * trusted as already validated upstream.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String USER_ID_PARAM = "userId";
    static final String USER_ID_HEADER = "X-User-Id";

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry registry;
    private final RealtimeHub hub;
    private final MetricsService metricsService;
    private final int sendTimeLimitMillis;
    private final int sendBufferLimitBytes;

    public ChatWebSocketHandler(ObjectMapper objectMapper,
                                ConnectionRegistry registry,
                                RealtimeHub hub,
                                MetricsService metricsService,
                                @Value("${companion.realtime.send-time-limit-ms:10000}") int sendTimeLimitMillis,
                                @Value("${companion.realtime.send-buffer-limit-bytes:524288}") int sendBufferLimitBytes) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.hub = hub;
        this.metricsService = metricsService;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String userId = extractUserId(wsSession);
        if (userId == null) {
            log.warn("Rejecting connection without identity: wsId={}", wsSession.getId());
            metricsService.recordConnection(null, false);
            wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("Missing userId"));
            return;
        }

        ConnectionWrapper connection = ConnectionWrapper.builder()
                .connectionId(wsSession.getId())
                .userId(userId)
                .wsSession(new ConcurrentWebSocketSessionDecorator(wsSession, sendTimeLimitMillis, sendBufferLimitBytes))
                .connectedAt(Instant.now())
                .state(ConnectionState.CONNECTING)
                .build();
        connection.transitionTo(ConnectionState.AUTHENTICATED);

        registry.register(connection);
        metricsService.recordConnection(userId, true);
        hub.sendTo(connection, RealtimeEvent.connected(userId));
        connection.transitionTo(ConnectionState.ACTIVE);

        log.info("WebSocket connected: wsId={}, userId={}", wsSession.getId(), userId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        ConnectionWrapper connection = registry.find(wsSession.getId()).orElse(null);
        if (connection == null) {
            log.warn("Message on unregistered connection ignored: wsId={}", wsSession.getId());
            return;
        }

        RealtimeEvent inbound;
        try {
            inbound = objectMapper.readValue(message.getPayload(), RealtimeEvent.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed frame: wsId={}, error={}", wsSession.getId(), e.getMessage());
            hub.sendTo(connection, RealtimeEvent.error("Malformed message"));
            return;
        }
        if (inbound == null) {
            hub.sendTo(connection, RealtimeEvent.error("Malformed message"));
            return;
        }

        String event = inbound.getEvent() != null ? inbound.getEvent() : "";
        switch (event) {
            case RealtimeEvent.SEND_MESSAGE -> {
                if (!(inbound.getData() instanceof Map)) {
                    hub.sendTo(connection, RealtimeEvent.error("Malformed message"));
                    return;
                }
                SendMessageRequest request;
                try {
                    request = objectMapper.convertValue(inbound.getData(), SendMessageRequest.class);
                } catch (IllegalArgumentException e) {
                    hub.sendTo(connection, RealtimeEvent.error("Malformed message"));
                    return;
                }
                hub.handleSendMessage(connection, request);
            }
            default -> {
                log.warn("Unknown event: wsId={}, event={}", wsSession.getId(), event);
                hub.sendTo(connection, RealtimeEvent.error("Unknown event: " + event));
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        registry.unregister(wsSession.getId()).ifPresent(connection -> {
            metricsService.recordDisconnection(connection.getUserId());
            log.info("WebSocket closed: wsId={}, userId={}, status={}",
                    wsSession.getId(), connection.getUserId(), status);
        });
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("WebSocket transport error: wsId={}", wsSession.getId(), exception);
        metricsService.recordError("TRANSPORT_ERROR", "ChatWebSocketHandler");
    }

    String extractUserId(WebSocketSession wsSession) {
        URI uri = wsSession.getUri();
        if (uri != null) {
            String fromQuery = UriComponentsBuilder.fromUri(uri).build()
                    .getQueryParams().getFirst(USER_ID_PARAM);
            if (StringUtils.hasText(fromQuery)) {
                return UriUtils.decode(fromQuery, StandardCharsets.UTF_8).trim();
            }
        }
        String fromHeader = wsSession.getHandshakeHeaders().getFirst(USER_ID_HEADER);
        return StringUtils.hasText(fromHeader) ? fromHeader.trim() : null;
    }
}
