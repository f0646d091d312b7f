package com.demo.companion.infrastructure;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Optional;
import java.util.UUID;

/**
 * Optional Redis backbone shared by all instances.
 *
 * Built once at startup from {@code companion.backbone.url}. When the URL is
 * empty or Redis cannot be reached, the instance runs on its own: every
 * accessor returns empty and callers fall back to local behaviour.
 */
@Component
@Slf4j
public class BackboneConnection {

    private final String url;
    private final String nodeId;

    private LettuceConnectionFactory connectionFactory;
    private RedisMessageListenerContainer listenerContainer;
    private StringRedisTemplate redisTemplate;
    private RedissonClient redissonClient;

    public BackboneConnection(
            @Value("${companion.backbone.url:}") String url,
            @Value("${companion.node-id:}") String nodeId) {
        this.url = url;
        this.nodeId = nodeId != null && !nodeId.isBlank()
                ? nodeId
                : "node-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @PostConstruct
    public void connect() {
        if (url == null || url.isBlank()) {
            log.warn("No broadcast backbone configured (companion.backbone.url is empty), running in single-instance mode");
            return;
        }

        try {
            URI uri = URI.create(url);
            boolean ssl = "rediss".equalsIgnoreCase(uri.getScheme());
            int port = uri.getPort() > 0 ? uri.getPort() : 6379;
            String password = extractPassword(uri);

            RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), port);
            if (password != null) {
                standalone.setPassword(password);
            }
            LettuceClientConfiguration.LettuceClientConfigurationBuilder clientConfig = LettuceClientConfiguration.builder();
            if (ssl) {
                clientConfig.useSsl();
            }
            connectionFactory = new LettuceConnectionFactory(standalone, clientConfig.build());
            connectionFactory.afterPropertiesSet();
            connectionFactory.start();
            try (RedisConnection connection = connectionFactory.getConnection()) {
                connection.ping();
            }

            redisTemplate = new StringRedisTemplate(connectionFactory);

            listenerContainer = new RedisMessageListenerContainer();
            listenerContainer.setConnectionFactory(connectionFactory);
            listenerContainer.afterPropertiesSet();
            listenerContainer.start();

            Config config = new Config();
            SingleServerConfig server = config.useSingleServer()
                    .setAddress((ssl ? "rediss://" : "redis://") + uri.getHost() + ":" + port)
                    .setConnectionPoolSize(32)
                    .setConnectionMinimumIdleSize(4)
                    .setConnectTimeout(10000)
                    .setTimeout(3000)
                    .setRetryAttempts(3)
                    .setRetryInterval(1500);
            if (password != null) {
                server.setPassword(password);
            }
            redissonClient = Redisson.create(config);

            log.info("Broadcast backbone connected: host={}, port={}, nodeId={}", uri.getHost(), port, nodeId);
        } catch (Exception e) {
            log.warn("Broadcast backbone unreachable at startup, running in single-instance mode: error={}",
                    e.getMessage(), e);
            shutdown();
        }
    }

    public boolean isAvailable() {
        return redissonClient != null && redisTemplate != null && listenerContainer != null;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Optional<StringRedisTemplate> redisTemplate() {
        return isAvailable() ? Optional.of(redisTemplate) : Optional.empty();
    }

    public Optional<RedisMessageListenerContainer> listenerContainer() {
        return isAvailable() ? Optional.of(listenerContainer) : Optional.empty();
    }

    public Optional<RedissonClient> redissonClient() {
        return isAvailable() ? Optional.of(redissonClient) : Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        if (listenerContainer != null) {
            try {
                listenerContainer.destroy();
            } catch (Exception e) {
                log.warn("Error stopping backbone listener container", e);
            }
            listenerContainer = null;
        }
        if (redissonClient != null) {
            try {
                redissonClient.shutdown();
            } catch (RuntimeException e) {
                log.warn("Error shutting down Redisson client", e);
            }
            redissonClient = null;
        }
        if (connectionFactory != null) {
            try {
                connectionFactory.destroy();
            } catch (RuntimeException e) {
                log.warn("Error closing backbone connection factory", e);
            }
            connectionFactory = null;
        }
        redisTemplate = null;
    }

    private static String extractPassword(URI uri) {
        String userInfo = uri.getUserInfo();
        if (userInfo == null || userInfo.isEmpty()) {
            return null;
        }
        int colon = userInfo.indexOf(':');
        return colon >= 0 ? userInfo.substring(colon + 1) : userInfo;
    }
}
