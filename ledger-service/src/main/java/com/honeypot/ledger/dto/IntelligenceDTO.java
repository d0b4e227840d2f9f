package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.ArtifactType;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record IntelligenceDTO(
    @JsonProperty("id")                     UUID id,
    @JsonProperty("sessionId")              UUID sessionId,
    @JsonProperty("artifactType")           ArtifactType artifactType,
    @JsonProperty("artifactValue")          String artifactValue,
    @JsonProperty("extractedFromMessageId") UUID extractedFromMessageId,
    @JsonProperty("extractedAtTurn")        Integer extractedAtTurn,
    @JsonProperty("extractionMethod")       String extractionMethod,
    @JsonProperty("confirmed")              boolean confirmed,
    @JsonProperty("confirmationCount")      int confirmationCount,
    @JsonProperty("confidenceScore")        double confidenceScore,
    @JsonProperty("firstSeenAt")            LocalDateTime firstSeenAt,
    @JsonProperty("lastSeenAt")             LocalDateTime lastSeenAt,
    @JsonProperty("contextSnippet")         String contextSnippet,
    @JsonProperty("metadata")               Map<String, Object> metadata
) {
    /** {@code true} when this row was created by the call that returned it. */
    @JsonIgnore
    public boolean isFirstSighting() {
        return confirmationCount == 1;
    }
}
