package com.honeypot.ledger.repository;

import com.honeypot.ledger.model.ExtractedIntelligence;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface ExtractedIntelligenceRepository extends ReactiveCrudRepository<ExtractedIntelligence, UUID> {

    /**
     * Atomic UPSERT on the natural key (session_id, artifact_type, artifact_value).
     *
     * <p>First extraction inserts with {@code confirmation_count = 1, confirmed = false} and bumps
     * the session's {@code intelligence_extracted_count}. A repeat extraction only increments
     * {@code confirmation_count}, sets {@code confirmed} and refreshes {@code last_seen_at}; the
     * candidate's other values are discarded. Concurrent duplicates serialise on the unique index,
     * so each call increments the count exactly once and never creates a second row.
     *
     * @return the inserted or merged row
     */
    @Query("""
        WITH upserted AS (
            INSERT INTO extracted_intelligence
                (session_id, artifact_type, artifact_value,
                 extracted_from_message_id, extracted_at_turn, extraction_method,
                 confirmed, confirmation_count, confidence_score, context_snippet, metadata)
            VALUES
                (:sessionId, :artifactType, :artifactValue,
                 :messageId, :turnNumber, :extractionMethod,
                 false, 1, :confidenceScore, :contextSnippet, :metadata)
            ON CONFLICT (session_id, artifact_type, artifact_value) DO UPDATE SET
                confirmation_count = extracted_intelligence.confirmation_count + 1,
                confirmed          = true,
                last_seen_at       = clock_timestamp() AT TIME ZONE 'UTC'
            RETURNING *
        ), counted AS (
            UPDATE sessions
            SET intelligence_extracted_count = intelligence_extracted_count + 1,
                updated_at                   = now() AT TIME ZONE 'UTC'
            WHERE id = :sessionId
              AND EXISTS (SELECT 1 FROM upserted WHERE confirmation_count = 1)
        )
        SELECT * FROM upserted
        """)
    Mono<ExtractedIntelligence> upsert(UUID sessionId, String artifactType, String artifactValue,
                                       UUID messageId, Integer turnNumber, String extractionMethod,
                                       double confidenceScore, String contextSnippet, String metadata);

    Flux<ExtractedIntelligence> findBySessionIdOrderByFirstSeenAtAsc(UUID sessionId);

    Flux<ExtractedIntelligence> findBySessionIdAndConfirmedTrueOrderByConfirmationCountDesc(UUID sessionId);
}
