package com.honeypot.ledger.config;

import com.honeypot.common.exception.ConfigurationException;

import java.time.Duration;

/**
 * Durable-store connection parameters.
 *
 * <p>Defaults (local development only):
 * <ul>
 *   <li>host {@value #DEFAULT_HOST}, port {@value #DEFAULT_PORT}</li>
 *   <li>database {@value #DEFAULT_DATABASE}, user {@value #DEFAULT_USER}</li>
 *   <li>pool {@value #DEFAULT_POOL_MIN_SIZE}..{@value #DEFAULT_POOL_MAX_SIZE} connections</li>
 *   <li>acquire / statement timeout {@value #DEFAULT_TIMEOUT_SECONDS}s</li>
 * </ul>
 */
public record StoreSettings(
    String host,
    int port,
    String database,
    String user,
    String password,
    int poolMinSize,
    int poolMaxSize,
    Duration timeout
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 5432;
    public static final String DEFAULT_DATABASE = "honeypot";
    public static final String DEFAULT_USER = "postgres";
    public static final int DEFAULT_POOL_MIN_SIZE = 5;
    public static final int DEFAULT_POOL_MAX_SIZE = 20;
    public static final long DEFAULT_TIMEOUT_SECONDS = 60;

    private static final String COMPONENT = "store-settings";

    public static StoreSettings defaults(String password) {
        return new StoreSettings(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_DATABASE, DEFAULT_USER, password,
                                 DEFAULT_POOL_MIN_SIZE, DEFAULT_POOL_MAX_SIZE,
                                 Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS));
    }

    /**
     * @throws ConfigurationException on the first invalid parameter
     */
    public StoreSettings validate() {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException(COMPONENT, "host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException(COMPONENT, "port out of range: " + port);
        }
        if (database == null || database.isBlank()) {
            throw new ConfigurationException(COMPONENT, "database must not be blank");
        }
        if (user == null || user.isBlank()) {
            throw new ConfigurationException(COMPONENT, "user must not be blank");
        }
        if (poolMinSize < 1 || poolMaxSize < poolMinSize) {
            throw new ConfigurationException(COMPONENT,
                "pool bounds invalid: min=" + poolMinSize + " max=" + poolMaxSize);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException(COMPONENT, "timeout must be positive: " + timeout);
        }
        return this;
    }

    @Override
    public String toString() {
        return "StoreSettings[host=" + host + ", port=" + port + ", database=" + database
            + ", user=" + user + ", pool=" + poolMinSize + ".." + poolMaxSize + ", timeout=" + timeout + "]";
    }
}
