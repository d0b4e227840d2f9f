package com.honeypot.ledger.model;

import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.SessionStatus;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Sparse update of a session: every component is optional and {@code null} means "leave the
 * column untouched". There is no way to null out a column through a patch.
 *
 * <p>{@code finalConfidence} and {@code completedAt} may only travel together with a terminal
 * {@code status}, which keeps them unset for as long as the session is active.
 */
@Builder(toBuilder = true)
public record SessionPatch(
    ConversationState currentState,
    SessionStatus status,
    Boolean scamDetected,
    Double finalConfidence,
    Double exposureRisk,
    Integer engagementDurationSeconds,
    LocalDateTime completedAt,
    Boolean callbackSent,
    LocalDateTime callbackSentAt,
    Map<String, Object> callbackResponse
) {
    public static final SessionPatch EMPTY = SessionPatch.builder().build();

    public SessionPatch {
        boolean closingFields = finalConfidence != null || completedAt != null;
        if (closingFields && (status == null || !status.isTerminal())) {
            throw new IllegalArgumentException(
                "finalConfidence/completedAt require a terminal status in the same patch, got status=" + status);
        }
        if (finalConfidence != null && (finalConfidence < 0.0 || finalConfidence > 1.0)) {
            throw new IllegalArgumentException("finalConfidence out of [0,1]: " + finalConfidence);
        }
        if (exposureRisk != null && (exposureRisk < 0.0 || exposureRisk > 1.0)) {
            throw new IllegalArgumentException("exposureRisk out of [0,1]: " + exposureRisk);
        }
    }

    public boolean isEmpty() {
        return currentState == null && status == null && scamDetected == null
            && finalConfidence == null && exposureRisk == null && engagementDurationSeconds == null
            && completedAt == null && callbackSent == null && callbackSentAt == null
            && callbackResponse == null;
    }

    /**
     * Present fields keyed by column, in declaration order, with enums normalised to their
     * persisted string form and the callback response encoded as JSON.
     */
    public Map<SessionColumn, Object> assignments(JsonColumnCodec codec) {
        Map<SessionColumn, Object> set = new EnumMap<>(SessionColumn.class);
        putIfPresent(set, SessionColumn.CURRENT_STATE, currentState != null ? currentState.value() : null);
        putIfPresent(set, SessionColumn.STATUS, status != null ? status.value() : null);
        putIfPresent(set, SessionColumn.SCAM_DETECTED, scamDetected);
        putIfPresent(set, SessionColumn.FINAL_CONFIDENCE, finalConfidence);
        putIfPresent(set, SessionColumn.EXPOSURE_RISK, exposureRisk);
        putIfPresent(set, SessionColumn.ENGAGEMENT_DURATION_SECONDS, engagementDurationSeconds);
        putIfPresent(set, SessionColumn.COMPLETED_AT, completedAt);
        putIfPresent(set, SessionColumn.CALLBACK_SENT, callbackSent);
        putIfPresent(set, SessionColumn.CALLBACK_SENT_AT, callbackSentAt);
        putIfPresent(set, SessionColumn.CALLBACK_RESPONSE, codec.writeMap(callbackResponse));
        return set;
    }

    private static void putIfPresent(Map<SessionColumn, Object> set, SessionColumn column, Object value) {
        if (value != null) {
            set.put(column, value);
        }
    }
}
