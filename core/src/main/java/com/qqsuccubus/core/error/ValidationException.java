package com.qqsuccubus.core.error;

/**
 * Request parameters are missing or invalid. Raised before any external call is made.
 */
public class ValidationException extends ConsoleException {

    public ValidationException(String message) {
        super(message);
    }
}
