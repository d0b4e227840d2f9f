package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.ConversationState;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Stored per-turn snapshot. {@code signalsDetected} is never {@code null}.
 */
public record StateEvolutionDTO(
    @JsonProperty("id")                      UUID id,
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
    @JsonProperty("signalsDetected")         List<String> signalsDetected,
    @JsonProperty("timestamp")               LocalDateTime timestamp
) {}
