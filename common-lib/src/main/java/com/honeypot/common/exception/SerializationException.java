package com.honeypot.common.exception;

/**
 * A JSON-encoded column (signal labels, keyword lists, structured details) could not be
 * written or could not be parsed back.
 */
public class SerializationException extends LedgerException {

    public SerializationException(String component, String message) {
        super(component, message);
    }

    public SerializationException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
