package com.demo.companion.service;

import com.demo.companion.domain.UpstreamAttempt;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether a completion attempt succeeded, may be retried, or must be
 * given up on.
 */
@Component
public class UpstreamErrorClassifier {

    public enum Outcome {
        SUCCESS,
        RETRYABLE,
        TERMINAL
    }

    // bad request, bad credentials, forbidden
    private static final Set<Integer> TERMINAL_STATUSES = Set.of(400, 401, 403);

    public Outcome classify(UpstreamAttempt attempt) {
        if (attempt.getResult() != null) {
            return Outcome.SUCCESS;
        }
        if (attempt.getFailure() == null && TERMINAL_STATUSES.contains(attempt.getStatusCode())) {
            return Outcome.TERMINAL;
        }
        return Outcome.RETRYABLE;
    }
}
