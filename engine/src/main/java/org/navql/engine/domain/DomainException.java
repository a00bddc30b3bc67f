package org.navql.engine.domain;

/**
 * Exception thrown when a literal is not valid for a domain.
 */
public class DomainException extends IllegalArgumentException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
