package com.honeypot.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One engagement with a suspected scammer over a single channel.
 *
 * <p>Two identities: {@code sessionId} is the opaque identifier supplied by the messaging front
 * end, {@code id} is generated by the store and used as the foreign key of every child ledger.
 *
 * <p>Enum-valued columns ({@code channel}, {@code persona}, {@code status}, {@code currentState})
 * hold the persisted string form of their {@code com.honeypot.common.model} enum.
 * {@code callbackResponse} is a JSON-serialised {@code Map<String, Object>}.
 *
 * <p>{@code finalConfidence} and {@code completedAt} stay {@code null} while the session is active.
 */
@Data
@NoArgsConstructor
@Table("sessions")
public class Session {

    @Id
    private UUID id;

    private String sessionId;

    private String channel;
    private String language;
    private String locale;
    private String persona;

    private Double initialConfidence;

    private String status;
    private String currentState;

    private Boolean scamDetected;
    private Double finalConfidence;
    private Double exposureRisk;

    // ── aggregate counters ──────────────────────────────────────────────────

    private Integer totalMessagesExchanged;
    private Integer engagementDurationSeconds;
    private Integer intelligenceExtractedCount;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;

    // ── outbound callback record ────────────────────────────────────────────

    private Boolean callbackSent;
    private LocalDateTime callbackSentAt;

    /** JSON-serialised {@code Map<String, Object>} */
    private String callbackResponse;
}
