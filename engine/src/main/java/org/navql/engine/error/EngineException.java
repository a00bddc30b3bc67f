package org.navql.engine.error;

/**
 * Exception thrown when the database rejects a query or the connection fails.
 * Always wraps the driver error; never retried.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
