package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.TacticType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record TacticDTO(
    @JsonProperty("id")                UUID id,
    @JsonProperty("sessionId")         UUID sessionId,
    @JsonProperty("tacticType")        TacticType tacticType,
    @JsonProperty("tacticDescription") String tacticDescription,
    @JsonProperty("detectedAtTurn")    Integer detectedAtTurn,
    @JsonProperty("messageText")       String messageText,
    @JsonProperty("keywordsUsed")      List<String> keywordsUsed,
    @JsonProperty("threatLevel")       String threatLevel,
    @JsonProperty("timestamp")         LocalDateTime timestamp
) {}
