package com.honeypot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of intelligence artifact pulled out of scammer text.
 *
 * <p>Each type carries two names: the persisted {@link #value()} used in the
 * {@code extracted_intelligence.artifact_type} column and the {@link #externalLabel()} used as
 * the key of the artifact map in agent responses and the final callback payload.
 */
public enum ArtifactType implements PersistedValue {

    UPI_ID("upi_id", "upiIds"),
    BANK_ACCOUNT("bank_account", "bankAccounts"),
    PHONE_NUMBER("phone_number", "phoneNumbers"),
    PHISHING_LINK("phishing_link", "phishingLinks"),
    SUSPICIOUS_KEYWORD("suspicious_keyword", "suspiciousKeywords");

    private final String value;
    private final String externalLabel;

    ArtifactType(String value, String externalLabel) {
        this.value = value;
        this.externalLabel = externalLabel;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public String externalLabel() {
        return externalLabel;
    }

    @JsonCreator
    public static ArtifactType fromValue(String raw) {
        return PersistedValue.fromValue(ArtifactType.class, raw);
    }
}
