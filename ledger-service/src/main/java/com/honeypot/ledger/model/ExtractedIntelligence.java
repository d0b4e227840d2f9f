package com.honeypot.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Deduplicated intelligence artifact. Natural key: ({@code sessionId}, {@code artifactType},
 * {@code artifactValue}), enforced by {@code uq_intelligence_per_session}.
 *
 * <p>Written only through
 * {@link com.honeypot.ledger.repository.ExtractedIntelligenceRepository#upsert}: re-extraction
 * bumps {@code confirmationCount}, flips {@code confirmed} and refreshes {@code lastSeenAt};
 * every other column keeps the value of the first extraction.
 *
 * <p>{@code metadata} is a JSON-serialised {@code Map<String, Object>}.
 */
@Data
@NoArgsConstructor
@Table("extracted_intelligence")
public class ExtractedIntelligence {

    @Id
    private UUID id;

    private UUID sessionId;

    private String artifactType;

    private String artifactValue;

    private UUID extractedFromMessageId;

    private Integer extractedAtTurn;

    private String extractionMethod;

    private Boolean confirmed;

    private Integer confirmationCount;

    private Double confidenceScore;

    private LocalDateTime firstSeenAt;

    private LocalDateTime lastSeenAt;

    private String contextSnippet;

    /** JSON-serialised {@code Map<String, Object>} */
    private String metadata;
}
