package org.navql.engine.error;

/**
 * Exception thrown when a capability check fails before a query is issued.
 */
public class PermissionException extends RuntimeException {

    public PermissionException(String message) {
        super(message);
    }
}
