package com.honeypot.common.model;

import java.util.Arrays;

/**
 * Enumerations whose persisted (and wire) form differs from the Java constant name.
 *
 * <p>The persisted form is what lands in the durable store's string columns and what the
 * boundary JSON carries; {@link #fromValue(Class, String)} is the single inverse mapping.
 */
public interface PersistedValue {

    String value();

    /**
     * Resolves the constant whose {@link #value()} equals {@code raw}.
     * Falls back to a case-insensitive constant-name match so hand-written fixtures still resolve.
     *
     * @throws IllegalArgumentException when nothing matches
     */
    static <E extends Enum<E> & PersistedValue> E fromValue(Class<E> type, String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Null value for " + type.getSimpleName());
        }
        return Arrays.stream(type.getEnumConstants())
            .filter(e -> e.value().equals(raw) || e.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown " + type.getSimpleName() + " value: " + raw));
    }

    /** Null-tolerant variant used when mapping optional columns. */
    static <E extends Enum<E> & PersistedValue> E fromNullableValue(Class<E> type, String raw) {
        return raw == null ? null : fromValue(type, raw);
    }

    /** Null-tolerant persisted form used when writing optional columns. */
    static String valueOf(PersistedValue constant) {
        return constant == null ? null : constant.value();
    }
}
