package com.demo.companion.exception;

import lombok.Getter;

/**
 * Storing a turn failed after the completion was consumed. When
 * {@code indeterminate} is set, part of the turn may already be stored.
 */
@Getter
public class TurnPersistenceException extends ChatException {

    private final boolean indeterminate;

    public TurnPersistenceException(boolean indeterminate, Throwable cause) {
        super("Failed to save the conversation, please try again", cause);
        this.indeterminate = indeterminate;
    }
}
