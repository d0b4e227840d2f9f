package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.Channel;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.PersonaType;

import java.util.Objects;

/**
 * Everything needed to open a session. Unset optional fields fall back to the documented
 * defaults: SMS, {@code en}/{@code IN}, {@link PersonaType#ELDERLY_UNCLE},
 * initial confidence {@value #DEFAULT_INITIAL_CONFIDENCE}, state {@link ConversationState#UNKNOWN}.
 */
public record SessionCreateRequest(
    @JsonProperty("sessionId")         String sessionId,
    @JsonProperty("channel")           Channel channel,
    @JsonProperty("language")          String language,
    @JsonProperty("locale")            String locale,
    @JsonProperty("persona")           PersonaType persona,
    @JsonProperty("initialConfidence") Double initialConfidence,
    @JsonProperty("initialState")      ConversationState initialState
) {
    public static final double DEFAULT_INITIAL_CONFIDENCE = 0.35;

    public SessionCreateRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        channel           = channel != null ? channel : Channel.SMS;
        language          = language != null ? language : "en";
        locale            = locale != null ? locale : "IN";
        persona           = persona != null ? persona : PersonaType.ELDERLY_UNCLE;
        initialConfidence = initialConfidence != null ? initialConfidence : DEFAULT_INITIAL_CONFIDENCE;
        initialState      = initialState != null ? initialState : ConversationState.UNKNOWN;
    }

    public static SessionCreateRequest of(String sessionId, Channel channel, PersonaType persona) {
        return new SessionCreateRequest(sessionId, channel, null, null, persona, null, null);
    }
}
