package com.wailer.error;

/**
 * The application is wired incorrectly: an unknown message type name, a type
 * class that cannot be instantiated, an unknown backend, a missing setting.
 */
public class ConfigurationException extends WailerException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
