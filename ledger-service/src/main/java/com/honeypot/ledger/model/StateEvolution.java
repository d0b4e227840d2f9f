package com.honeypot.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-turn snapshot of conversation state, confidence, exposure risk and the tone vector.
 *
 * <p>{@code previous*} columns are {@code null} on the first turn only.
 * {@code signalsDetected} is a JSON-serialised {@code List<String>}, {@code []} when none.
 */
@Data
@NoArgsConstructor
@Table("state_evolution")
public class StateEvolution {

    @Id
    private UUID id;

    private UUID sessionId;

    private UUID messageId;

    private Integer turnNumber;

    // ── state ───────────────────────────────────────────────────────────────

    private String previousState;
    private String currentState;
    private Boolean stateTransitionOccurred;
    private Integer turnsInCurrentState;

    // ── confidence ──────────────────────────────────────────────────────────

    private Double previousConfidence;
    private Double currentConfidence;
    private Double confidenceDelta;
    private String confidenceTrend;

    // ── exposure ────────────────────────────────────────────────────────────

    private Double exposureRisk;
    private Double exposureDelta;

    // ── tone vector (each 0.0 – 1.0, nullable) ──────────────────────────────

    private Double toneConfusion;
    private Double toneAnxiety;
    private Double toneUrgency;
    private Double toneCompliance;
    private Double toneCognitiveLoad;

    private Double driftRate;
    private Double initiative;

    /** JSON-serialised {@code List<String>} */
    private String signalsDetected;

    private LocalDateTime timestamp;
}
