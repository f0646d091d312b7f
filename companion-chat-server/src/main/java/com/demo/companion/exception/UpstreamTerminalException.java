package com.demo.companion.exception;

import lombok.Getter;

/**
 * Completion API rejected the request in a way retrying cannot fix.
 */
@Getter
public class UpstreamTerminalException extends ChatException {

    private final int statusCode;
    private final String detail;

    public UpstreamTerminalException(int statusCode, String detail) {
        super("The assistant could not process this message");
        this.statusCode = statusCode;
        this.detail = detail;
    }
}
