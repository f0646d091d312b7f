package com.demo.companion.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a single call to the completion API: a parsed result, an HTTP
 * rejection, or a failure before any usable response arrived.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpstreamAttempt {
    private final int statusCode;
    private final CompletionResult result;
    private final String errorBody;
    private final Exception failure;

    public static UpstreamAttempt succeeded(int statusCode, CompletionResult result) {
        return new UpstreamAttempt(statusCode, result, null, null);
    }

    public static UpstreamAttempt rejected(int statusCode, String errorBody) {
        return new UpstreamAttempt(statusCode, null, errorBody, null);
    }

    public static UpstreamAttempt failed(int statusCode, Exception failure) {
        return new UpstreamAttempt(statusCode, null, null, failure);
    }

    public static UpstreamAttempt failed(Exception failure) {
        return failed(0, failure);
    }

    public String describe() {
        if (result != null) {
            return "status=" + statusCode;
        }
        if (failure != null) {
            return "status=" + statusCode + ", failure=" + failure.getClass().getSimpleName()
                    + ": " + failure.getMessage();
        }
        return "status=" + statusCode + ", body=" + errorBody;
    }
}
