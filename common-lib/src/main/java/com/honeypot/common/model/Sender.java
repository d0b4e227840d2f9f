package com.honeypot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Author of a ledger message. */
public enum Sender implements PersistedValue {

    SCAMMER("scammer"),
    AGENT("agent");

    private final String value;

    Sender(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Sender fromValue(String raw) {
        return PersistedValue.fromValue(Sender.class, raw);
    }
}
