package com.demo.companion.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-backed metrics: counters and gauges are kept in memory and every
 * update is written to the log at debug level.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    // ===== Primitives =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0))
                .updateAndGet(current -> Math.max(0, current - 1));
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void recordTimer(String name, Duration duration) {
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    public TimerSample startTimer() {
        return new TimerSample();
    }

    // ===== Connections =====

    public void recordConnection(String userId, boolean accepted) {
        incrementCounter(accepted ? "realtime.connections.accepted" : "realtime.connections.rejected");
        if (accepted) {
            incrementGauge("realtime.connections.active");
        }
        log.info("Realtime connection: userId={}, accepted={}", userId, accepted);
    }

    public void recordDisconnection(String userId) {
        incrementCounter("realtime.disconnections");
        decrementGauge("realtime.connections.active");
        log.info("Realtime disconnection: userId={}", userId);
    }

    // ===== Turns =====

    public void recordTurnStarted(String userId) {
        incrementCounter("chat.turns.started");
        log.debug("Turn started: userId={}", userId);
    }

    public void recordTurnCompleted(String userId, TimerSample sample, long billedTokens) {
        Duration duration = sample.stop();
        incrementCounter("chat.turns.completed");
        recordTimer("chat.turns.duration", duration);
        log.info("Turn completed: userId={}, duration={}ms, tokens={}", userId, duration.toMillis(), billedTokens);
    }

    public void recordTurnFailed(String userId, String errorType) {
        incrementCounter("chat.turns.failed");
        incrementCounter("chat.turns.failed." + errorType);
        log.warn("Turn failed: userId={}, errorType={}", userId, errorType);
    }

    public void recordRejectedMessage(String userId, String reason) {
        incrementCounter("chat.messages.rejected");
        log.info("Message rejected: userId={}, reason={}", userId, reason);
    }

    // ===== Upstream =====

    public void recordUpstreamAttempt(int attempt, String outcome) {
        incrementCounter("upstream.attempts");
        incrementCounter("upstream.attempts." + outcome.toLowerCase());
        log.debug("Upstream attempt: attempt={}, outcome={}", attempt, outcome);
    }

    // ===== Errors =====

    public void recordError(String errorType, String component) {
        incrementCounter("errors." + component + "." + errorType);
        log.warn("Error recorded: type={}, component={}", errorType, component);
    }

    // ===== Reads =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public static class TimerSample {
        private final Instant start = Instant.now();

        public Duration stop() {
            return Duration.between(start, Instant.now());
        }
    }
}
