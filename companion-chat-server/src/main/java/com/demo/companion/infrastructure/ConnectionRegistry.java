package com.demo.companion.infrastructure;

import com.demo.companion.domain.ConnectionState;
import com.demo.companion.domain.ConnectionWrapper;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local membership of user groups plus, with the backbone up, a shared
 * presence set per user so any instance can answer "is this user connected".
 */
@Component
@Slf4j
public class ConnectionRegistry {

    static final String PRESENCE_KEY = "presence:user:{userId}";
    static final Duration PRESENCE_TTL = Duration.ofMinutes(30);

    private final BackboneConnection backbone;
    private final ConcurrentHashMap<String, ConnectionWrapper> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Map<String, ConnectionWrapper>> groups = new ConcurrentHashMap<>();

    public ConnectionRegistry(BackboneConnection backbone) {
        this.backbone = backbone;
    }

    /**
     * Admit an authenticated connection to its user's group.
     */
    public void register(ConnectionWrapper connection) {
        connections.put(connection.getConnectionId(), connection);
        groups.computeIfAbsent(connection.getUserId(), k -> new ConcurrentHashMap<>())
                .put(connection.getConnectionId(), connection);
        touchPresence(connection);

        log.info("Connection registered: connectionId={}, userId={}, total={}",
                connection.getConnectionId(), connection.getUserId(), connections.size());
    }

    public Optional<ConnectionWrapper> unregister(String connectionId) {
        ConnectionWrapper connection = connections.remove(connectionId);
        if (connection == null) {
            return Optional.empty();
        }
        connection.transitionTo(ConnectionState.CLOSED);
        groups.computeIfPresent(connection.getUserId(), (userId, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });

        presence(connection.getUserId()).ifPresent(set -> {
            try {
                set.remove(presenceEntry(connection));
            } catch (RuntimeException e) {
                log.warn("Failed to remove presence: userId={}, error={}", connection.getUserId(), e.getMessage());
            }
        });

        log.info("Connection unregistered: connectionId={}, userId={}, duration={}s",
                connectionId, connection.getUserId(),
                Duration.between(connection.getConnectedAt(), Instant.now()).getSeconds());
        return Optional.of(connection);
    }

    public Optional<ConnectionWrapper> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * Open local members of a user's group.
     */
    public List<ConnectionWrapper> localGroup(String userId) {
        Map<String, ConnectionWrapper> members = groups.get(userId);
        if (members == null) {
            return List.of();
        }
        List<ConnectionWrapper> open = new ArrayList<>();
        for (ConnectionWrapper member : members.values()) {
            if (member.isOpen()) {
                open.add(member);
            }
        }
        return open;
    }

    public boolean hasLocalConnection(String userId) {
        return !localGroup(userId).isEmpty();
    }

    public boolean isUserConnected(String userId) {
        if (hasLocalConnection(userId)) {
            return true;
        }
        return presence(userId).map(set -> {
            try {
                return !set.isEmpty();
            } catch (RuntimeException e) {
                log.warn("Presence lookup failed, answering from local state: userId={}, error={}",
                        userId, e.getMessage());
                return false;
            }
        }).orElse(false);
    }

    /**
     * Refresh the shared presence entry of a live connection.
     */
    public void touchPresence(ConnectionWrapper connection) {
        presence(connection.getUserId()).ifPresent(set -> {
            try {
                set.add(presenceEntry(connection));
                set.expire(PRESENCE_TTL);
            } catch (RuntimeException e) {
                log.warn("Failed to record presence: userId={}, error={}", connection.getUserId(), e.getMessage());
            }
        });
    }

    public int getActiveConnectionCount() {
        return connections.size();
    }

    private Optional<RSet<String>> presence(String userId) {
        return backbone.redissonClient()
                .map((RedissonClient client) -> client.<String>getSet(PRESENCE_KEY.replace("{userId}", userId)));
    }

    private String presenceEntry(ConnectionWrapper connection) {
        return backbone.getNodeId() + ":" + connection.getConnectionId();
    }
}
