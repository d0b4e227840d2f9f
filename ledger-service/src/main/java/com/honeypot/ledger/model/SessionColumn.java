package com.honeypot.ledger.model;

/**
 * Closed allow-list of session columns a {@link SessionPatch} may write.
 *
 * <p>Partial updates are assembled only from these constants, so a caller can never address a
 * column outside this list. Identity, persona, channel, counters and creation time are absent on
 * purpose: they are fixed at creation or maintained by the ledger itself.
 */
public enum SessionColumn {

    CURRENT_STATE("currentState"),
    STATUS("status"),
    SCAM_DETECTED("scamDetected"),
    FINAL_CONFIDENCE("finalConfidence"),
    EXPOSURE_RISK("exposureRisk"),
    ENGAGEMENT_DURATION_SECONDS("engagementDurationSeconds"),
    COMPLETED_AT("completedAt"),
    CALLBACK_SENT("callbackSent"),
    CALLBACK_SENT_AT("callbackSentAt"),
    CALLBACK_RESPONSE("callbackResponse");

    private final String property;

    SessionColumn(String property) {
        this.property = property;
    }

    /** Property name on {@link Session}; the mapping layer resolves it to the snake_case column. */
    public String property() {
        return property;
    }
}
