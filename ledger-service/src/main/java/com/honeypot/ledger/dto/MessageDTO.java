package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.Sender;

import java.time.LocalDateTime;
import java.util.UUID;

public record MessageDTO(
    @JsonProperty("id")                    UUID id,
    @JsonProperty("sessionId")             UUID sessionId,
    @JsonProperty("sender")                Sender sender,
    @JsonProperty("text")                  String text,
    @JsonProperty("turnNumber")            int turnNumber,
    @JsonProperty("timestamp")             LocalDateTime timestamp,
    @JsonProperty("responseDelaySeconds")  Integer responseDelaySeconds,
    @JsonProperty("rawLlmResponse")        String rawLlmResponse,
    @JsonProperty("finalResponse")         String finalResponse,
    @JsonProperty("stateAtMessage")        ConversationState stateAtMessage,
    @JsonProperty("confidenceAtMessage")   Double confidenceAtMessage,
    @JsonProperty("exposureRiskAtMessage") Double exposureRiskAtMessage,
    @JsonProperty("createdAt")             LocalDateTime createdAt
) {}
