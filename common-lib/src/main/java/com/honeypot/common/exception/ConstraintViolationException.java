package com.honeypot.common.exception;

/**
 * A unique key collided on an insert path that has no merge policy,
 * e.g. creating a session with an identifier that is already in use.
 */
public class ConstraintViolationException extends LedgerException {

    public ConstraintViolationException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
