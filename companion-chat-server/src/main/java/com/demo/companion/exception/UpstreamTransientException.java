package com.demo.companion.exception;

import lombok.Getter;

/**
 * Completion API kept failing with retryable errors until attempts or the
 * overall deadline ran out.
 */
@Getter
public class UpstreamTransientException extends ChatException {

    private final int attempts;
    private final String detail;

    public UpstreamTransientException(int attempts, String detail, Throwable cause) {
        super("The assistant is temporarily unavailable, please try again", cause);
        this.attempts = attempts;
        this.detail = detail;
    }
}
