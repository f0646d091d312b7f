package com.demo.companion.infrastructure;

import com.demo.companion.domain.GroupEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Redis pub/sub relay: every instance publishes and listens on one channel.
 */
@Component
@Slf4j
public class RedisBroadcastRelay implements BroadcastRelay, MessageListener {

    static final String CHANNEL = "realtime:group-events";

    private final BackboneConnection backbone;
    private final ObjectMapper objectMapper;
    private final List<Consumer<GroupEnvelope>> consumers = new CopyOnWriteArrayList<>();

    public RedisBroadcastRelay(BackboneConnection backbone, ObjectMapper objectMapper) {
        this.backbone = backbone;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void start() {
        backbone.listenerContainer().ifPresent(container -> {
            container.addMessageListener(this, new ChannelTopic(CHANNEL));
            log.info("Subscribed to broadcast channel: channel={}, nodeId={}", CHANNEL, backbone.getNodeId());
        });
    }

    @Override
    public boolean isEnabled() {
        return backbone.isAvailable();
    }

    @Override
    public void publish(GroupEnvelope envelope) {
        backbone.redisTemplate().ifPresent(template -> {
            envelope.setOriginNodeId(backbone.getNodeId());
            try {
                template.convertAndSend(CHANNEL, objectMapper.writeValueAsString(envelope));
                log.debug("Relayed group event: userId={}, event={}", envelope.getUserId(), envelope.getEvent());
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize group event: userId={}, event={}",
                        envelope.getUserId(), envelope.getEvent(), e);
            } catch (RuntimeException e) {
                // local members already received it; other instances miss this event
                log.error("Failed to relay group event: userId={}, event={}",
                        envelope.getUserId(), envelope.getEvent(), e);
            }
        });
    }

    @Override
    public void subscribe(Consumer<GroupEnvelope> consumer) {
        consumers.add(consumer);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        GroupEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, GroupEnvelope.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable group event: error={}", e.getMessage());
            return;
        }

        if (backbone.getNodeId().equals(envelope.getOriginNodeId())) {
            return;
        }
        for (Consumer<GroupEnvelope> consumer : consumers) {
            try {
                consumer.accept(envelope);
            } catch (RuntimeException e) {
                log.error("Group event consumer failed: userId={}, event={}",
                        envelope.getUserId(), envelope.getEvent(), e);
            }
        }
    }
}
