package com.honeypot.common.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Final result delivered to the evaluation platform once an engagement ends.
 * Same artifact map shape as {@link AgentResponse#extractedIntelligence()}.
 */
public record FinalCallbackPayload(
    @JsonProperty("sessionId")              String sessionId,
    @JsonProperty("scamDetected")           boolean scamDetected,
    @JsonProperty("totalMessagesExchanged") int totalMessagesExchanged,
    @JsonProperty("extractedIntelligence")  Map<String, List<String>> extractedIntelligence,
    @JsonProperty("agentNotes")             String agentNotes
) {}
