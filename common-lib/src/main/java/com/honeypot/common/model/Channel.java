package com.honeypot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Messaging channel an engagement runs over. */
public enum Channel implements PersistedValue {

    SMS("SMS"),
    WHATSAPP("WhatsApp"),
    EMAIL("Email"),
    CHAT("Chat");

    private final String value;

    Channel(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Channel fromValue(String raw) {
        return PersistedValue.fromValue(Channel.class, raw);
    }
}
