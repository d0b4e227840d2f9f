package com.honeypot.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Post-engagement quality metrics, one row per session, written once by the evaluation
 * collaborator.
 */
@Data
@NoArgsConstructor
@Table("evaluation_metrics")
public class EvaluationMetrics {

    @Id
    private UUID id;

    private UUID sessionId;

    // ── engagement quality ──────────────────────────────────────────────────

    private Double engagementDepthScore;
    private Double conversationNaturalnessScore;
    private Double extractionEfficiency;

    // ── detection ───────────────────────────────────────────────────────────

    private Double scamDetectionConfidence;
    private Double falsePositiveRisk;

    // ── realism ─────────────────────────────────────────────────────────────

    private Double averageResponseDelay;
    private Double toneDriftSmoothness;
    private Integer stateTransitionCount;
    private Integer prematureExits;

    // ── intelligence quality ────────────────────────────────────────────────

    private Integer uniqueArtifactsExtracted;
    private Integer confirmedArtifactsExtracted;
    private Integer highConfidenceArtifacts;

    // ── behaviour ───────────────────────────────────────────────────────────

    private Integer typoCount;
    private Integer messageTruncations;
    private Integer repetitions;
    private Integer clarificationQuestionsAsked;

    private Double overallQualityScore;

    private LocalDateTime calculatedAt;
}
