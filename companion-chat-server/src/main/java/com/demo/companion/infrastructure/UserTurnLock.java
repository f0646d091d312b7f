package com.demo.companion.infrastructure;

import com.demo.companion.exception.TurnInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes turns of the same user across all instances. Different users
 * never contend.
 *
 * Uses a Redisson lock while the backbone is up (its watchdog keeps the lease
 * alive for long completions) and a per-user local lock otherwise.
 */
@Component
@Slf4j
public class UserTurnLock {

    private static final String LOCK_KEY = "lock:turn:{userId}";

    private final BackboneConnection backbone;
    private final Duration waitTimeout;
    private final ConcurrentHashMap<String, LocalLock> localLocks = new ConcurrentHashMap<>();

    public UserTurnLock(
            BackboneConnection backbone,
            @Value("${companion.realtime.lock-wait:5m}") Duration waitTimeout) {
        this.backbone = backbone;
        this.waitTimeout = waitTimeout;
    }

    public <T> T withLock(String userId, Supplier<T> turn) {
        Optional<RLock> distributed = distributedLock(userId);
        if (distributed.isPresent()) {
            return withDistributedLock(userId, distributed.get(), turn);
        }
        return withLocalLock(userId, turn);
    }

    private <T> T withDistributedLock(String userId, RLock lock, Supplier<T> turn) {
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnInProgressException("Interrupted while waiting for the previous message", e);
        } catch (RuntimeException e) {
            log.warn("Distributed turn lock unavailable, using local lock: userId={}, error={}", userId, e.getMessage());
            return withLocalLock(userId, turn);
        }
        if (!acquired) {
            throw new TurnInProgressException("Your previous message is still being processed");
        }

        try {
            return turn.get();
        } finally {
            try {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                }
            } catch (RuntimeException e) {
                // lease expires on its own once the watchdog stops renewing it
                log.warn("Failed to release turn lock: userId={}, error={}", userId, e.getMessage());
            }
        }
    }

    private <T> T withLocalLock(String userId, Supplier<T> turn) {
        LocalLock entry = localLocks.compute(userId, (k, existing) -> {
            LocalLock local = existing != null ? existing : new LocalLock();
            local.holders++;
            return local;
        });

        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TurnInProgressException("Interrupted while waiting for the previous message", e);
            }
            if (!acquired) {
                throw new TurnInProgressException("Your previous message is still being processed");
            }
            try {
                return turn.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            localLocks.computeIfPresent(userId, (k, local) -> --local.holders == 0 ? null : local);
        }
    }

    int localLockCount() {
        return localLocks.size();
    }

    private Optional<RLock> distributedLock(String userId) {
        return backbone.redissonClient()
                .map((RedissonClient client) -> client.getLock(LOCK_KEY.replace("{userId}", userId)));
    }

    private static class LocalLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute
        private int holders;
    }
}
