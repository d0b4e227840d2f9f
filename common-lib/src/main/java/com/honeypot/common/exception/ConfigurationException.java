package com.honeypot.common.exception;

/** Missing or invalid connection parameters detected at startup. */
public class ConfigurationException extends LedgerException {

    public ConfigurationException(String component, String message) {
        super(component, message);
    }
}
