package com.honeypot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Adversarial conversation state tracked turn by turn by the decision loop.
 *
 * <ul>
 *   <li>UNKNOWN: nothing classified yet</li>
 *   <li>PROBING: testing whether the counterpart is a scammer</li>
 *   <li>ENGAGING: playing along to keep the scammer talking</li>
 *   <li>DRAINING: actively pulling payment identifiers and links</li>
 *   <li>EXITING: winding the conversation down</li>
 *   <li>TERMINATED: conversation over</li>
 * </ul>
 */
public enum ConversationState implements PersistedValue {

    UNKNOWN("UNKNOWN"),
    PROBING("PROBING"),
    ENGAGING("ENGAGING"),
    DRAINING("DRAINING"),
    EXITING("EXITING"),
    TERMINATED("TERMINATED");

    private final String value;

    ConversationState(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConversationState fromValue(String raw) {
        return PersistedValue.fromValue(ConversationState.class, raw);
    }
}
