package com.demo.companion.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.demo.companion.TestObjects;
import com.demo.companion.domain.ConnectionState;
import com.demo.companion.domain.ConnectionWrapper;
import com.demo.companion.domain.RealtimeEvent;
import com.demo.companion.domain.SendMessageRequest;
import com.demo.companion.infrastructure.BackboneConnection;
import com.demo.companion.infrastructure.ConnectionRegistry;
import com.demo.companion.infrastructure.RealtimeHub;
import com.demo.companion.service.MetricsService;
import java.net.URI;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class ChatWebSocketHandlerTest {

    private ConnectionRegistry registry;
    private RealtimeHub hub;
    private MetricsService metricsService;
    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(new BackboneConnection("", "node-a"));
        hub = mock(RealtimeHub.class);
        metricsService = new MetricsService();
        handler = new ChatWebSocketHandler(TestObjects.objectMapper(), registry, hub, metricsService, 10000, 524288);
    }

    @Test
    void closesConnectionWithoutIdentity() throws Exception {
        WebSocketSession session = session("ws-1", "ws://localhost/ws/chat", new HttpHeaders());

        handler.afterConnectionEstablished(session);

        verify(session).close(argThat((CloseStatus status) ->
                status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        assertEquals(0, registry.getActiveConnectionCount());
        verify(hub, never()).sendTo(any(), any());
        assertEquals(1, metricsService.getCounterValue("realtime.connections.rejected"));
    }

    @Test
    void admitsConnectionFromQueryParameter() throws Exception {
        WebSocketSession session = session("ws-1", "ws://localhost/ws/chat?userId=user%2042", new HttpHeaders());

        handler.afterConnectionEstablished(session);

        ConnectionWrapper connection = registry.find("ws-1").orElseThrow();
        assertEquals("user 42", connection.getUserId());
        assertEquals(ConnectionState.ACTIVE, connection.getState());
        ArgumentCaptor<RealtimeEvent> sent = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(hub).sendTo(any(ConnectionWrapper.class), sent.capture());
        assertEquals(RealtimeEvent.CONNECTED, sent.getValue().getEvent());
        assertEquals(Map.of("message", "Connected to chat", "userId", "user 42"), sent.getValue().getData());
    }

    @Test
    void admitsConnectionFromHeader() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-User-Id", "u7");

        handler.afterConnectionEstablished(session("ws-2", "ws://localhost/ws/chat", headers));

        assertTrue(registry.isUserConnected("u7"));
    }

    @Test
    void dispatchesSendMessage() throws Exception {
        WebSocketSession session = session("ws-1", "ws://localhost/ws/chat?userId=u1", new HttpHeaders());
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session, new TextMessage(
                "{\"event\":\"sendMessage\",\"data\":{\"userId\":\"u1\",\"message\":\"hello\"}}"));

        ArgumentCaptor<SendMessageRequest> request = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(hub).handleSendMessage(any(ConnectionWrapper.class), request.capture());
        assertEquals("u1", request.getValue().getUserId());
        assertEquals("hello", request.getValue().getMessage());
    }

    @Test
    void unknownEventAndMalformedFrameGetErrors() throws Exception {
        WebSocketSession session = session("ws-1", "ws://localhost/ws/chat?userId=u1", new HttpHeaders());
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session, new TextMessage("{\"event\":\"dance\",\"data\":{}}"));
        handler.handleTextMessage(session, new TextMessage("not json at all"));
        handler.handleTextMessage(session, new TextMessage("null"));
        handler.handleTextMessage(session, new TextMessage("{\"event\":\"sendMessage\",\"data\":\"hello\"}"));
        handler.handleTextMessage(session, new TextMessage("{\"event\":\"sendMessage\"}"));

        verify(hub).sendTo(any(ConnectionWrapper.class), argThat((RealtimeEvent event) ->
                RealtimeEvent.ERROR.equals(event.getEvent())
                        && Map.of("message", "Unknown event: dance").equals(event.getData())));
        verify(hub, times(4)).sendTo(any(ConnectionWrapper.class), argThat((RealtimeEvent event) ->
                RealtimeEvent.ERROR.equals(event.getEvent())
                        && Map.of("message", "Malformed message").equals(event.getData())));
        verify(hub, never()).handleSendMessage(any(), any());
    }

    @Test
    void disconnectLeavesGroup() throws Exception {
        WebSocketSession session = session("ws-1", "ws://localhost/ws/chat?userId=u1", new HttpHeaders());
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertEquals(0, registry.getActiveConnectionCount());
        assertEquals(1, metricsService.getCounterValue("realtime.disconnections"));
    }

    private WebSocketSession session(String id, String uri, HttpHeaders headers) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.getUri()).thenReturn(URI.create(uri));
        when(session.getHandshakeHeaders()).thenReturn(headers);
        when(session.isOpen()).thenReturn(true);
        return session;
    }
}
