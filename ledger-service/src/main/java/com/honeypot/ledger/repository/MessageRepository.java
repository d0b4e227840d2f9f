package com.honeypot.ledger.repository;

import com.honeypot.ledger.model.Message;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface MessageRepository extends ReactiveCrudRepository<Message, UUID> {

    /**
     * Inserts one message and bumps the owning session's {@code total_messages_exchanged} in the
     * same statement, so the counter can never drift from the ledger.
     *
     * <p>{@code turnNumber} is stored exactly as supplied, with no uniqueness or gap check.
     */
    @Query("""
        WITH inserted AS (
            INSERT INTO messages
                (session_id, sender, text, turn_number, timestamp,
                 response_delay_seconds, raw_llm_response, final_response,
                 state_at_message, confidence_at_message, exposure_risk_at_message, created_at)
            VALUES
                (:sessionId, :sender, :text, :turnNumber, :timestamp,
                 :responseDelaySeconds, :rawLlmResponse, :finalResponse,
                 :stateAtMessage, :confidenceAtMessage, :exposureRiskAtMessage, now() AT TIME ZONE 'UTC')
            RETURNING *
        ), counted AS (
            UPDATE sessions
            SET total_messages_exchanged = total_messages_exchanged + 1,
                updated_at               = now() AT TIME ZONE 'UTC'
            WHERE id = :sessionId
        )
        SELECT * FROM inserted
        """)
    Mono<Message> append(UUID sessionId, String sender, String text, int turnNumber,
                         LocalDateTime timestamp, Integer responseDelaySeconds,
                         String rawLlmResponse, String finalResponse, String stateAtMessage,
                         Double confidenceAtMessage, Double exposureRiskAtMessage);

    @Query("""
        SELECT * FROM messages
        WHERE session_id = :sessionId
        ORDER BY turn_number ASC, created_at ASC
        LIMIT :limit
        """)
    Flux<Message> findHistory(UUID sessionId, int limit);

    Mono<Message> findFirstBySessionIdAndSenderOrderByTurnNumberDesc(UUID sessionId, String sender);
}
