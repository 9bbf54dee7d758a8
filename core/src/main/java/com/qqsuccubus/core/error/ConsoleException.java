package com.qqsuccubus.core.error;

/**
 * Base type for errors raised at the boundaries of the console: catalog lookup,
 * monitoring transport, configuration and request validation.
 * <p>
 * Messages are user-visible; they are returned to API callers as-is.
 * </p>
 */
public abstract class ConsoleException extends RuntimeException {

    protected ConsoleException(String message) {
        super(message);
    }

    protected ConsoleException(String message, Throwable cause) {
        super(message, cause);
    }
}
