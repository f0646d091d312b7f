package com.demo.companion.service;

import com.demo.companion.domain.CompletionResult;
import com.demo.companion.domain.PromptRequest;
import com.demo.companion.domain.UpstreamAttempt;
import com.demo.companion.exception.UpstreamTerminalException;
import com.demo.companion.exception.UpstreamTransientException;
import com.demo.companion.infrastructure.AnthropicMessagesApi;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Calls the completion API with bounded exponential backoff.
 *
 * Terminal rejections fail immediately; everything else is retried up to
 * {@code maxAttempts} times, waiting base, 2*base, 4*base... between attempts.
 * Another attempt starts only if the wait plus the worst-case attempt time
 * (connect plus read timeout) still fits inside the overall deadline.
 */
@Service
@Slf4j
public class CompletionClient {

    private final AnthropicMessagesApi messagesApi;
    private final UpstreamErrorClassifier classifier;
    private final BackoffSleeper sleeper;
    private final MetricsService metricsService;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration backoffBase;
    private final Duration overallTimeout;
    private final Duration attemptTimeout;

    public CompletionClient(
            AnthropicMessagesApi messagesApi,
            UpstreamErrorClassifier classifier,
            BackoffSleeper sleeper,
            MetricsService metricsService,
            Clock clock,
            @Value("${companion.completion.max-attempts:3}") int maxAttempts,
            @Value("${companion.completion.backoff-base:2s}") Duration backoffBase,
            @Value("${companion.completion.overall-timeout:150s}") Duration overallTimeout,
            @Value("${companion.completion.connect-timeout:10s}") Duration connectTimeout,
            @Value("${companion.completion.read-timeout:45s}") Duration readTimeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("companion.completion.max-attempts must be at least 1");
        }
        Duration attemptTimeout = connectTimeout.plus(readTimeout);
        if (attemptTimeout.compareTo(overallTimeout) > 0) {
            throw new IllegalArgumentException(
                    "companion.completion connect-timeout plus read-timeout must fit inside overall-timeout");
        }
        this.messagesApi = messagesApi;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.metricsService = metricsService;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.backoffBase = backoffBase;
        this.overallTimeout = overallTimeout;
        this.attemptTimeout = attemptTimeout;
    }

    public CompletionResult complete(PromptRequest prompt) {
        Instant deadline = clock.instant().plus(overallTimeout);
        UpstreamAttempt last = null;
        int attempt = 0;

        while (attempt < maxAttempts) {
            attempt++;
            log.info("Calling completion API: attempt={}/{}", attempt, maxAttempts);
            last = messagesApi.send(prompt);
            UpstreamErrorClassifier.Outcome outcome = classifier.classify(last);
            metricsService.recordUpstreamAttempt(attempt, outcome.name());

            if (outcome == UpstreamErrorClassifier.Outcome.SUCCESS) {
                return last.getResult();
            }
            if (outcome == UpstreamErrorClassifier.Outcome.TERMINAL) {
                log.error("Completion API rejected request: attempt={}, {}", attempt, last.describe());
                throw new UpstreamTerminalException(last.getStatusCode(), last.describe());
            }

            log.warn("Completion attempt failed: attempt={}/{}, {}", attempt, maxAttempts, last.describe());
            if (attempt == maxAttempts) {
                break;
            }

            Duration delay = backoffBase.multipliedBy(1L << (attempt - 1));
            if (clock.instant().plus(delay).plus(attemptTimeout).isAfter(deadline)) {
                log.warn("Giving up on completion: another attempt after {}ms backoff could pass the overall deadline",
                        delay.toMillis());
                break;
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamTransientException(attempt, "interrupted during backoff", e);
            }
        }

        throw new UpstreamTransientException(attempt, last.describe(), last.getFailure());
    }
}
