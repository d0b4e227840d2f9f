package com.honeypot.ledger.service;

import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.model.Channel;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.PersonaType;
import com.honeypot.common.model.SessionStatus;
import com.honeypot.ledger.dto.SessionCreateRequest;
import com.honeypot.ledger.dto.SessionDTO;
import com.honeypot.ledger.dto.SystemLogEntry;
import com.honeypot.ledger.model.Session;
import com.honeypot.ledger.model.SessionColumn;
import com.honeypot.ledger.model.SessionPatch;
import com.honeypot.ledger.repository.SessionRepository;
import com.honeypot.ledger.support.LedgerErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Update;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static com.honeypot.common.model.PersistedValue.fromNullableValue;
import static org.springframework.data.relational.core.query.Criteria.where;
import static org.springframework.data.relational.core.query.Query.query;

/**
 * Lifecycle of a session record: create, read by either identity, sparse update, list active.
 *
 * <p>Absence is never an error here: lookups and updates against an unknown session complete
 * empty. Partial updates only ever touch the columns named by {@link SessionColumn}.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
    private static final String COMPONENT = "session-store";

    private final SessionRepository repository;
    private final R2dbcEntityTemplate template;
    private final JsonColumnCodec codec;
    private final SystemLogSink systemLog;
    private final SessionChangeListener changeListener;

    public SessionStore(SessionRepository repository,
                        R2dbcEntityTemplate template,
                        JsonColumnCodec codec,
                        SystemLogSink systemLog,
                        SessionChangeListener changeListener) {
        this.repository     = repository;
        this.template       = template;
        this.codec          = codec;
        this.systemLog      = systemLog;
        this.changeListener = changeListener;
    }

    /**
     * Opens a session in status {@code active}.
     *
     * @return the persisted record, or a {@code ConstraintViolationException} when the caller's
     *         session id is already taken
     */
    public Mono<SessionDTO> createSession(SessionCreateRequest request) {
        Mono<SessionDTO> created = Mono.fromCallable(() -> toEntity(request))
            .flatMap(repository::save)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "create session " + request.sessionId()))
            .doOnSuccess(s -> log.info("Session created. sessionId={} id={} channel={} persona={}",
                                       s.sessionId(), s.id(), s.channel(), s.persona()))
            .doOnError(e -> log.error("Failed to create session. sessionId={}", request.sessionId(), e));

        return systemLog.emitAfter(created, s -> SystemLogEntry.info(
            s.id(), COMPONENT, "session_created", "Session opened",
            Map.of("sessionId", s.sessionId(), "channel", s.channel().value(), "persona", s.persona().value())));
    }

    public Mono<SessionDTO> getBySessionId(String sessionId) {
        return repository.findBySessionId(sessionId)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read session " + sessionId));
    }

    public Mono<SessionDTO> getByInternalId(UUID id) {
        return repository.findById(id)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read session " + id));
    }

    /**
     * Applies the present fields of {@code patch} and returns the post-update record.
     * An empty patch is a plain read. Completes empty when no session has this id.
     * Cached copies of the session are dropped before the updated record is emitted.
     */
    public Mono<SessionDTO> updateSession(String sessionId, SessionPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return getBySessionId(sessionId);
        }

        Mono<SessionDTO> updated = Mono.defer(() -> {
                Update update = Update.update("updatedAt", LocalDateTime.now(ZoneOffset.UTC));
                for (Map.Entry<SessionColumn, Object> assignment : patch.assignments(codec).entrySet()) {
                    update = update.set(assignment.getKey().property(), assignment.getValue());
                }
                return template.update(Session.class)
                    .matching(query(where("sessionId").is(sessionId)))
                    .apply(update);
            })
            .flatMap(rows -> rows == 0 ? Mono.<Session>empty() : repository.findBySessionId(sessionId))
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "update session " + sessionId))
            .doOnSuccess(s -> {
                if (s == null) {
                    log.warn("Update skipped, session not found. sessionId={}", sessionId);
                } else {
                    log.debug("Session updated. sessionId={} status={} state={}",
                              sessionId, s.status(), s.currentState());
                }
            })
            .flatMap(s -> changeListener.sessionChanged(sessionId).thenReturn(s));

        if (patch.status() == null) {
            return updated;
        }
        return systemLog.emitAfter(updated, s -> SystemLogEntry.info(
            s.id(), COMPONENT, "session_status_changed", "Session status set to " + s.status().value(),
            Map.of("sessionId", s.sessionId(), "status", s.status().value())));
    }

    /** Records the outcome of the final callback delivery. */
    public Mono<SessionDTO> markCallbackSent(String sessionId, Map<String, Object> responsePayload) {
        SessionPatch patch = SessionPatch.builder()
            .callbackSent(true)
            .callbackSentAt(LocalDateTime.now(ZoneOffset.UTC))
            .callbackResponse(responsePayload)
            .build();
        return updateSession(sessionId, patch)
            .doOnSuccess(s -> {
                if (s != null) {
                    log.info("Callback recorded. sessionId={}", sessionId);
                }
            });
    }

    /** Sessions still in status {@code active}, newest first. */
    public Flux<SessionDTO> listActiveSessions() {
        return repository.findByStatusOrderByCreatedAtDesc(SessionStatus.ACTIVE.value())
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "list active sessions"));
    }

    // ── Entity Mapping ──────────────────────────────────────────────────────

    private Session toEntity(SessionCreateRequest request) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        Session entity = new Session();
        entity.setSessionId(request.sessionId());
        entity.setChannel(request.channel().value());
        entity.setLanguage(request.language());
        entity.setLocale(request.locale());
        entity.setPersona(request.persona().value());
        entity.setInitialConfidence(request.initialConfidence());
        entity.setStatus(SessionStatus.ACTIVE.value());
        entity.setCurrentState(request.initialState().value());
        entity.setScamDetected(false);
        entity.setTotalMessagesExchanged(0);
        entity.setEngagementDurationSeconds(0);
        entity.setIntelligenceExtractedCount(0);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        entity.setCallbackSent(false);
        return entity;
    }

    SessionDTO toDto(Session s) {
        return new SessionDTO(
            s.getId(),
            s.getSessionId(),
            fromNullableValue(Channel.class, s.getChannel()),
            s.getLanguage(),
            s.getLocale(),
            fromNullableValue(PersonaType.class, s.getPersona()),
            orZero(s.getInitialConfidence()),
            fromNullableValue(SessionStatus.class, s.getStatus()),
            fromNullableValue(ConversationState.class, s.getCurrentState()),
            Boolean.TRUE.equals(s.getScamDetected()),
            s.getFinalConfidence(),
            s.getExposureRisk(),
            orZero(s.getTotalMessagesExchanged()),
            orZero(s.getEngagementDurationSeconds()),
            orZero(s.getIntelligenceExtractedCount()),
            s.getCreatedAt(),
            s.getUpdatedAt(),
            s.getCompletedAt(),
            Boolean.TRUE.equals(s.getCallbackSent()),
            s.getCallbackSentAt(),
            codec.readMap(s.getCallbackResponse()));
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
