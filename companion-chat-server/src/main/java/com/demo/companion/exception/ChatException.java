package com.demo.companion.exception;

/**
 * Root of every failure a chat turn can surface. The message is safe to show
 * to the end user.
 */
public class ChatException extends RuntimeException {

    public ChatException(String message) {
        super(message);
    }

    public ChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
