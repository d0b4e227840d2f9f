package com.honeypot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Manipulation tactic categories recognised in scammer turns. */
public enum TacticType implements PersistedValue {

    URGENCY_PRESSURE("urgency_pressure"),
    AUTHORITY_CLAIM("authority_claim"),
    PAYMENT_REDIRECT("payment_redirect"),
    ACCOUNT_THREAT("account_threat"),
    VERIFICATION_SCAM("verification_scam");

    private final String value;

    TacticType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TacticType fromValue(String raw) {
        return PersistedValue.fromValue(TacticType.class, raw);
    }
}
