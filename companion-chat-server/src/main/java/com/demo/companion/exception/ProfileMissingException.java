package com.demo.companion.exception;

import lombok.Getter;

/**
 * The user, or the onboarding profile chatting depends on, does not exist.
 */
@Getter
public class ProfileMissingException extends PreconditionException {

    private final String userId;

    public ProfileMissingException(String userId) {
        super("User or profile not found");
        this.userId = userId;
    }
}
