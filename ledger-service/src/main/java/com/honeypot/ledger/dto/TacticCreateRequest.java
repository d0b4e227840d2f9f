package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.TacticType;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** {@code threatLevel} defaults to {@code medium}; a {@code null} keyword list is stored empty. */
public record TacticCreateRequest(
    @JsonProperty("sessionId")         UUID sessionId,
    @JsonProperty("tacticType")        TacticType tacticType,
    @JsonProperty("tacticDescription") String tacticDescription,
    @JsonProperty("detectedAtTurn")    int detectedAtTurn,
    @JsonProperty("messageText")       String messageText,
    @JsonProperty("keywordsUsed")      List<String> keywordsUsed,
    @JsonProperty("threatLevel")       String threatLevel
) {
    public static final String DEFAULT_THREAT_LEVEL = "medium";

    public TacticCreateRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(tacticType, "tacticType");
        threatLevel = threatLevel != null ? threatLevel : DEFAULT_THREAT_LEVEL;
    }
}
