package com.honeypot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an engagement. Anything other than {@link #ACTIVE} is terminal.
 */
public enum SessionStatus implements PersistedValue {

    ACTIVE("active"),
    COMPLETED("completed"),
    TERMINATED("terminated"),
    BURNED("burned");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    @JsonCreator
    public static SessionStatus fromValue(String raw) {
        return PersistedValue.fromValue(SessionStatus.class, raw);
    }
}
