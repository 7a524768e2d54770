package com.supportchat.application.exceptions;

/**
 * The user's context could not be locked in time; nothing was applied and the request may be retried.
 */
public class UserContextBusyException extends RuntimeException {

    public UserContextBusyException(String message) {
        super(message);
    }

    public UserContextBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
