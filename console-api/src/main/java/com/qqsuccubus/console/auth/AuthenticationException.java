package com.qqsuccubus.console.auth;

import com.qqsuccubus.core.error.ConsoleException;

/**
 * Credentials or bearer token were rejected.
 */
public class AuthenticationException extends ConsoleException {

    public AuthenticationException(String message) {
        super(message);
    }
}
