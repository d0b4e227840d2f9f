package com.honeypot.common.exception;

/**
 * Root of the ledger's unchecked error taxonomy.
 *
 * <p>Absence is never an exception: lookups that find nothing complete empty. Everything that
 * does surface as a {@code LedgerException} propagates to the caller untouched; the ledger
 * performs no internal retry.
 */
public class LedgerException extends RuntimeException {

    private final String component;

    public LedgerException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public LedgerException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
