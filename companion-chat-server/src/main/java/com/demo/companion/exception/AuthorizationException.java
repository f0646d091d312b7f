package com.demo.companion.exception;

public class AuthorizationException extends ChatException {

    public AuthorizationException(String message) {
        super(message);
    }
}
