package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.Sender;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * One turn to append. {@code timestamp} defaults to the server clock (UTC) when {@code null}.
 * {@code turnNumber} is stored exactly as given.
 */
public record MessageCreateRequest(
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
    @JsonProperty("exposureRiskAtMessage") Double exposureRiskAtMessage
) {
    public MessageCreateRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(text, "text");
    }

    public static MessageCreateRequest scammer(UUID sessionId, String text, int turnNumber) {
        return new MessageCreateRequest(sessionId, Sender.SCAMMER, text, turnNumber,
                                        null, null, null, null, null, null, null);
    }

    public static MessageCreateRequest agent(UUID sessionId, String rawLlmResponse, String finalResponse,
                                             int turnNumber, Integer responseDelaySeconds,
                                             ConversationState state, Double confidence, Double exposureRisk) {
        return new MessageCreateRequest(sessionId, Sender.AGENT, finalResponse, turnNumber, null,
                                        responseDelaySeconds, rawLlmResponse, finalResponse,
                                        state, confidence, exposureRisk);
    }
}
