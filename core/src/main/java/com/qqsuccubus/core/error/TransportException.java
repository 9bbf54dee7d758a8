package com.qqsuccubus.core.error;

/**
 * A call to an external collaborator (monitoring backend, Cloud Run control plane) failed:
 * network error, rejected credentials or a payload that could not be read.
 */
public class TransportException extends ConsoleException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
