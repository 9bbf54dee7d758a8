package com.qqsuccubus.core.error;

/**
 * A required external identifier or secret is missing from the configuration.
 */
public class ConfigurationException extends ConsoleException {

    public ConfigurationException(String message) {
        super(message);
    }
}
