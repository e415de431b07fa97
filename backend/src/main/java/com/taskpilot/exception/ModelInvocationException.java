package com.taskpilot.exception;

/**
 * The model service itself failed (transport, timeout, quota, unreadable reply).
 * Fatal to the current turn; the caller only ever sees a generic failure.
 */
public class ModelInvocationException extends RuntimeException {
    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
