package com.honeypot.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only conversation turn. {@code turnNumber} is assigned by the caller and stored as
 * given; rows are never updated after insert.
 *
 * <p>{@code rawLlmResponse} / {@code finalResponse} are only filled for agent messages and hold
 * the text before and after post-processing (typos, truncation).
 */
@Data
@NoArgsConstructor
@Table("messages")
public class Message {

    @Id
    private UUID id;

    private UUID sessionId;

    private String sender;

    private String text;

    private Integer turnNumber;

    private LocalDateTime timestamp;

    private Integer responseDelaySeconds;

    private String rawLlmResponse;

    private String finalResponse;

    // ── snapshot at authoring time ──────────────────────────────────────────

    private String stateAtMessage;
    private Double confidenceAtMessage;
    private Double exposureRiskAtMessage;

    private LocalDateTime createdAt;
}
