package com.honeypot.ledger.support;

import com.honeypot.common.exception.ConnectivityException;
import com.honeypot.common.exception.ConstraintViolationException;
import com.honeypot.common.exception.LedgerException;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcTransientException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Maps driver and Spring Data exceptions onto the ledger taxonomy.
 *
 * <ul>
 *   <li>unique / integrity violations → {@link ConstraintViolationException}</li>
 *   <li>resource failures, pool acquisition timeouts, transient errors, refused connections
 *       → {@link ConnectivityException}</li>
 *   <li>{@link LedgerException}s and anything unrecognised pass through unchanged</li>
 * </ul>
 *
 * <p>Usage inside a reactive chain:
 * <pre>
 *     .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "create session"))
 * </pre>
 */
public final class LedgerErrorTranslator {

    private LedgerErrorTranslator() {}

    public static Function<Throwable, Throwable> forOperation(String component, String operation) {
        return e -> translate(component, operation, e);
    }

    public static Throwable translate(String component, String operation, Throwable e) {
        if (e instanceof LedgerException) {
            return e;
        }
        if (e instanceof DataIntegrityViolationException
                || e instanceof R2dbcDataIntegrityViolationException) {
            return new ConstraintViolationException(component, operation + " violated a unique constraint", e);
        }
        if (isConnectivityFailure(e)) {
            return new ConnectivityException(component, operation + " could not reach its backing store", e);
        }
        return e;
    }

    private static boolean isConnectivityFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof DataAccessResourceFailureException
                    || t instanceof TransientDataAccessException
                    || t instanceof R2dbcTransientException
                    || t instanceof R2dbcNonTransientResourceException
                    || t instanceof TimeoutException
                    || t instanceof ConnectException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
