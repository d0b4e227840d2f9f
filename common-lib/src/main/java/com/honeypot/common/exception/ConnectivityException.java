package com.honeypot.common.exception;

/**
 * The durable store or the cache could not be reached: pool exhaustion, network failure or a
 * timeout.
 */
public class ConnectivityException extends LedgerException {

    public ConnectivityException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
