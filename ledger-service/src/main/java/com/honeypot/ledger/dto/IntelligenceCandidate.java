package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.ArtifactType;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An artifact proposed by the detection layer. On a first extraction every field is stored;
 * on re-extraction of the same (session, type, value) only the confirmation bookkeeping moves.
 */
public record IntelligenceCandidate(
    @JsonProperty("sessionId")              UUID sessionId,
    @JsonProperty("artifactType")           ArtifactType artifactType,
    @JsonProperty("artifactValue")          String artifactValue,
    @JsonProperty("extractedFromMessageId") UUID extractedFromMessageId,
    @JsonProperty("extractedAtTurn")        Integer extractedAtTurn,
    @JsonProperty("extractionMethod")       String extractionMethod,
    @JsonProperty("confidenceScore")        Double confidenceScore,
    @JsonProperty("contextSnippet")         String contextSnippet,
    @JsonProperty("metadata")               Map<String, Object> metadata
) {
    public static final String DEFAULT_EXTRACTION_METHOD = "regex";
    public static final double DEFAULT_CONFIDENCE_SCORE = 0.5;

    public IntelligenceCandidate {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(artifactType, "artifactType");
        Objects.requireNonNull(artifactValue, "artifactValue");
        extractionMethod = extractionMethod != null ? extractionMethod : DEFAULT_EXTRACTION_METHOD;
        confidenceScore  = confidenceScore != null ? confidenceScore : DEFAULT_CONFIDENCE_SCORE;
    }

    public static IntelligenceCandidate of(UUID sessionId, ArtifactType type, String value,
                                           UUID messageId, int turn) {
        return new IntelligenceCandidate(sessionId, type, value, messageId, turn, null, null, null, null);
    }
}
