package com.demo.companion.exception;

/**
 * The previous message of the same user is still being processed.
 */
public class TurnInProgressException extends ChatException {

    public TurnInProgressException(String message) {
        super(message);
    }

    public TurnInProgressException(String message, Throwable cause) {
        super(message, cause);
    }
}
