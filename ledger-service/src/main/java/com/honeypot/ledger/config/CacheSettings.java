package com.honeypot.ledger.config;

import com.honeypot.common.exception.ConfigurationException;

import java.time.Duration;

/**
 * Ephemeral-cache connection parameters. Defaults: {@value #DEFAULT_HOST}:{@value #DEFAULT_PORT},
 * logical db {@value #DEFAULT_DATABASE}, entry TTL {@value #DEFAULT_TTL_SECONDS}s.
 */
public record CacheSettings(
    String host,
    int port,
    int database,
    Duration entryTtl,
    Duration commandTimeout
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_DATABASE = 0;
    public static final long DEFAULT_TTL_SECONDS = 3600;

    private static final String COMPONENT = "cache-settings";

    public static CacheSettings defaults() {
        return new CacheSettings(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_DATABASE,
                                 Duration.ofSeconds(DEFAULT_TTL_SECONDS), Duration.ofSeconds(5));
    }

    public CacheSettings validate() {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException(COMPONENT, "host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException(COMPONENT, "port out of range: " + port);
        }
        if (database < 0 || database > 15) {
            throw new ConfigurationException(COMPONENT, "logical database index out of range: " + database);
        }
        if (entryTtl == null || entryTtl.isZero() || entryTtl.isNegative()) {
            throw new ConfigurationException(COMPONENT, "entry TTL must be positive: " + entryTtl);
        }
        if (commandTimeout == null || commandTimeout.isZero() || commandTimeout.isNegative()) {
            throw new ConfigurationException(COMPONENT, "command timeout must be positive: " + commandTimeout);
        }
        return this;
    }
}
