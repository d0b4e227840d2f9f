package com.honeypot.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.honeypot.common.model.ArtifactType;

import java.util.Map;
import java.util.UUID;

/**
 * Per-session artifact tally. {@code byType} contains every {@link ArtifactType}, zero when unseen.
 */
public record IntelligenceSummaryDTO(
    @JsonProperty("sessionId")          UUID sessionId,
    @JsonProperty("totalArtifacts")     int totalArtifacts,
    @JsonProperty("confirmedArtifacts") int confirmedArtifacts,
    @JsonProperty("byType")             Map<ArtifactType, Integer> byType
) {}
