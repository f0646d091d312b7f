package com.demo.companion.exception;

public class PreconditionException extends ChatException {

    public PreconditionException(String message) {
        super(message);
    }
}
