package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.Channel;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.PersonaType;
import com.honeypot.common.model.SessionStatus;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Typed view of a persisted session. Also the snapshot shape kept in the ephemeral cache.
 */
public record SessionDTO(
    @JsonProperty("id")                         UUID id,
    @JsonProperty("sessionId")                  String sessionId,
    @JsonProperty("channel")                    Channel channel,
    @JsonProperty("language")                   String language,
    @JsonProperty("locale")                     String locale,
    @JsonProperty("persona")                    PersonaType persona,
    @JsonProperty("initialConfidence")          double initialConfidence,
    @JsonProperty("status")                     SessionStatus status,
    @JsonProperty("currentState")               ConversationState currentState,
    @JsonProperty("scamDetected")               boolean scamDetected,
    @JsonProperty("finalConfidence")            Double finalConfidence,
    @JsonProperty("exposureRisk")               Double exposureRisk,
    @JsonProperty("totalMessagesExchanged")     int totalMessagesExchanged,
    @JsonProperty("engagementDurationSeconds")  int engagementDurationSeconds,
    @JsonProperty("intelligenceExtractedCount") int intelligenceExtractedCount,
    @JsonProperty("createdAt")                  LocalDateTime createdAt,
    @JsonProperty("updatedAt")                  LocalDateTime updatedAt,
    @JsonProperty("completedAt")                LocalDateTime completedAt,
    @JsonProperty("callbackSent")               boolean callbackSent,
    @JsonProperty("callbackSentAt")             LocalDateTime callbackSentAt,
    @JsonProperty("callbackResponse")           Map<String, Object> callbackResponse
) {
    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}
