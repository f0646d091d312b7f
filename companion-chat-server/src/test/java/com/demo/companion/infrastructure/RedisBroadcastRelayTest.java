package com.demo.companion.infrastructure;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.demo.companion.TestObjects;
import com.demo.companion.domain.GroupEnvelope;
import com.demo.companion.domain.RealtimeEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;

class RedisBroadcastRelayTest {

    private final ObjectMapper objectMapper = TestObjects.objectMapper();
    private StringRedisTemplate template;
    private RedisBroadcastRelay relay;
    private List<GroupEnvelope> received;

    @BeforeEach
    void setUp() {
        template = mock(StringRedisTemplate.class);
        BackboneConnection backbone = mock(BackboneConnection.class);
        when(backbone.getNodeId()).thenReturn("node-a");
        when(backbone.isAvailable()).thenReturn(true);
        when(backbone.redisTemplate()).thenReturn(Optional.of(template));

        relay = new RedisBroadcastRelay(backbone, objectMapper);
        received = new ArrayList<>();
        relay.subscribe(received::add);
    }

    @Test
    void publishStampsOriginNodeAndSendsJsonOnChannel() throws Exception {
        relay.publish(GroupEnvelope.of("u1", RealtimeEvent.typing(true)));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(template).convertAndSend(eq("realtime:group-events"), body.capture());
        JsonNode json = objectMapper.readTree(body.getValue());
        assertEquals("node-a", json.get("originNodeId").asText());
        assertEquals("u1", json.get("userId").asText());
        assertEquals(RealtimeEvent.TYPING, json.get("event").asText());
        assertTrue(json.get("data").get("typing").asBoolean());
    }

    @Test
    void publishFailureIsNotPropagated() {
        doThrow(new RedisConnectionFailureException("down")).when(template).convertAndSend(anyString(), anyString());

        assertDoesNotThrow(() -> relay.publish(GroupEnvelope.of("u1", RealtimeEvent.typing(false))));
    }

    @Test
    void envelopeFromAnotherNodeReachesSubscribers() throws Exception {
        GroupEnvelope envelope = GroupEnvelope.of("u1", RealtimeEvent.error("boom"));
        envelope.setOriginNodeId("node-b");

        relay.onMessage(message(objectMapper.writeValueAsString(envelope)), null);

        assertEquals(1, received.size());
        assertEquals("u1", received.get(0).getUserId());
        assertEquals(RealtimeEvent.ERROR, received.get(0).getEvent());
        assertEquals(Map.of("message", "boom"), received.get(0).getData());
    }

    @Test
    void envelopeFromOwnNodeIsDropped() throws Exception {
        GroupEnvelope envelope = GroupEnvelope.of("u1", RealtimeEvent.typing(true));
        envelope.setOriginNodeId("node-a");

        relay.onMessage(message(objectMapper.writeValueAsString(envelope)), null);

        assertTrue(received.isEmpty());
    }

    @Test
    void unreadableBodyIsDropped() {
        assertDoesNotThrow(() -> relay.onMessage(message("{not json"), null));

        assertTrue(received.isEmpty());
    }

    private static DefaultMessage message(String body) {
        return new DefaultMessage(
                "realtime:group-events".getBytes(StandardCharsets.UTF_8),
                body.getBytes(StandardCharsets.UTF_8));
    }
}
