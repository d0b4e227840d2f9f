package com.honeypot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Persona variant the agent plays for the whole session. */
public enum PersonaType implements PersistedValue {

    ELDERLY_UNCLE("ELDERLY_UNCLE"),
    BUSY_PROFESSIONAL("BUSY_PROFESSIONAL");

    private final String value;

    PersonaType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PersonaType fromValue(String raw) {
        return PersistedValue.fromValue(PersonaType.class, raw);
    }
}
