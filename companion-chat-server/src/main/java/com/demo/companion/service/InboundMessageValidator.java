package com.demo.companion.service;

import com.demo.companion.domain.SendMessageRequest;
import com.demo.companion.exception.AuthorizationException;
import com.demo.companion.exception.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Checks an inbound sendMessage against the identity bound at connect time.
 */
@Component
public class InboundMessageValidator {

    public void validate(String authenticatedUserId, SendMessageRequest request) {
        if (request == null) {
            throw new ValidationException("Message cannot be empty");
        }
        if (request.getUserId() == null || !request.getUserId().equals(authenticatedUserId)) {
            throw new AuthorizationException("Unauthorized: userId mismatch");
        }
        if (request.getMessage() == null || request.getMessage().trim().isEmpty()) {
            throw new ValidationException("Message cannot be empty");
        }
    }
}
