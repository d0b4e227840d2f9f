package com.honeypot.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response envelope returned to the messaging front end after each turn.
 *
 * <p>{@code extractedIntelligence} maps an artifact's external label
 * (e.g. {@code upiIds}) to the values seen so far.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentResponse(
    @JsonProperty("status")                String status,
    @JsonProperty("scamDetected")          boolean scamDetected,
    @JsonProperty("agentMessage")          String agentMessage,
    @JsonProperty("shouldContinue")        boolean shouldContinue,
    @JsonProperty("extractedIntelligence") Map<String, List<String>> extractedIntelligence,
    @JsonProperty("agentNotes")            String agentNotes
) {
    public static AgentResponse success(boolean scamDetected, String agentMessage, boolean shouldContinue,
                                        Map<String, List<String>> extractedIntelligence, String agentNotes) {
        return new AgentResponse("success", scamDetected, agentMessage, shouldContinue,
                                 extractedIntelligence, agentNotes);
    }
}
