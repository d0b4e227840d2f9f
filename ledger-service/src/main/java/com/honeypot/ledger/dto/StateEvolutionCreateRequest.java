package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.ConversationState;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Scoring-layer output for one turn. {@code previous*} fields are {@code null} on the first turn;
 * {@code signalsDetected} may be {@code null} and is then stored as an empty list.
 */
public record StateEvolutionCreateRequest(
    @JsonProperty("sessionId")               UUID sessionId,
    @JsonProperty("messageId")               UUID messageId,
    @JsonProperty("turnNumber")              int turnNumber,
    @JsonProperty("previousState")           ConversationState previousState,
    @JsonProperty("currentState")            ConversationState currentState,
    @JsonProperty("stateTransitionOccurred") boolean stateTransitionOccurred,
    @JsonProperty("turnsInCurrentState")     int turnsInCurrentState,
    @JsonProperty("previousConfidence")      Double previousConfidence,
    @JsonProperty("currentConfidence")       double currentConfidence,
    @JsonProperty("confidenceDelta")         Double confidenceDelta,
    @JsonProperty("confidenceTrend")         String confidenceTrend,
    @JsonProperty("exposureRisk")            double exposureRisk,
    @JsonProperty("exposureDelta")           Double exposureDelta,
    @JsonProperty("tone")                    ToneVector tone,
    @JsonProperty("driftRate")               Double driftRate,
    @JsonProperty("initiative")              Double initiative,
    @JsonProperty("signalsDetected")         List<String> signalsDetected
) {
    public StateEvolutionCreateRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(currentState, "currentState");
        tone = tone != null ? tone : ToneVector.EMPTY;
    }
}
