package com.strumbot.exception;

/**
 * Base type for failures raised while watching streams or delivering notifications.
 */
public class StrumbotException extends RuntimeException {

    public StrumbotException(String message) {
        super(message);
    }

    public StrumbotException(String message, Throwable cause) {
        super(message, cause);
    }
}
