package com.novemberain.mongo.connection;

/**
 * Thrown when a configuration cannot be turned into a connection descriptor.
 * Always raised before any network activity.
 */
public class ConnectionConfigException extends Exception {

    private static final long serialVersionUID = 1L;

    public ConnectionConfigException(String message) {
        super(message);
    }

    public ConnectionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
