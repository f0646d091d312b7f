package com.demo.companion.exception;

public class ValidationException extends ChatException {

    public ValidationException(String message) {
        super(message);
    }
}
