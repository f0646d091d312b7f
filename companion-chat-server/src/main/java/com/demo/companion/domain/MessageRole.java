package com.demo.companion.domain;

import java.util.Locale;

/**
 * Closed set of message authors. Stored as the enum name, sent upstream in
 * lower case.
 */
public enum MessageRole {
    USER,
    ASSISTANT;

    /**
     * Role value in the completion API's vocabulary.
     */
    public String toUpstream() {
        return switch (this) {
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    /**
     * Parse a stored or upstream role value. Anything outside the two known
     * roles is a data-integrity fault.
     */
    public static MessageRole parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role is missing");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            default -> throw new IllegalArgumentException("Unknown message role: " + value);
        };
    }
}
