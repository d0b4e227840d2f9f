package com.honeypot.ledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.exception.ConnectivityException;
import com.honeypot.common.exception.ConstraintViolationException;
import com.honeypot.common.model.Channel;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.PersonaType;
import com.honeypot.common.model.SessionStatus;
import com.honeypot.ledger.dto.SessionCreateRequest;
import com.honeypot.ledger.model.Session;
import com.honeypot.ledger.model.SessionPatch;
import com.honeypot.ledger.model.SystemLog;
import com.honeypot.ledger.repository.SessionRepository;
import com.honeypot.ledger.repository.SystemLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.r2dbc.core.ReactiveUpdateOperation;
import org.springframework.data.relational.core.query.Query;
import org.springframework.data.relational.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionStoreTest {

    @Mock SessionRepository repository;
    @Mock R2dbcEntityTemplate template;
    @Mock ReactiveUpdateOperation.ReactiveUpdate updateOperation;
    @Mock ReactiveUpdateOperation.TerminatingUpdate terminatingUpdate;
    @Mock SystemLogRepository systemLogRepository;
    @Mock SessionChangeListener changeListener;

    private SessionStore store;

    @BeforeEach
    void setUp() {
        JsonColumnCodec codec = new JsonColumnCodec(new ObjectMapper());
        store = new SessionStore(repository, template, codec, new SystemLogSink(systemLogRepository, codec), changeListener);
    }

    private static Session persisted(String sessionId, String status, String state) {
        Session s = new Session();
        s.setId(UUID.randomUUID());
        s.setSessionId(sessionId);
        s.setChannel("WhatsApp");
        s.setLanguage("en");
        s.setLocale("IN");
        s.setPersona("ELDERLY_UNCLE");
        s.setInitialConfidence(0.35);
        s.setStatus(status);
        s.setCurrentState(state);
        s.setScamDetected(false);
        s.setTotalMessagesExchanged(0);
        s.setEngagementDurationSeconds(0);
        s.setIntelligenceExtractedCount(0);
        s.setCreatedAt(LocalDateTime.of(2025, 2, 1, 10, 0));
        s.setUpdatedAt(LocalDateTime.of(2025, 2, 1, 10, 0));
        s.setCallbackSent(false);
        return s;
    }

    private void stubSaveAssigningId() {
        when(repository.save(any(Session.class))).thenAnswer(inv -> {
            Session s = inv.getArgument(0);
            s.setId(UUID.randomUUID());
            return Mono.just(s);
        });
    }

    private void stubUpdateAffecting(long rows) {
        when(template.update(Session.class)).thenReturn(updateOperation);
        when(updateOperation.matching(any(Query.class))).thenReturn(terminatingUpdate);
        when(terminatingUpdate.apply(any(Update.class))).thenReturn(Mono.just(rows));
        if (rows > 0) {
            when(changeListener.sessionChanged("wa-1")).thenReturn(Mono.empty());
        }
    }

    private static Map<String, Object> assignmentsOf(Update update) {
        Map<String, Object> byColumn = new HashMap<>();
        update.getAssignments().forEach((column, value) -> byColumn.put(column.toString(), value));
        return byColumn;
    }

    // ── createSession ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("createSession()")
    class Create {

        @Test
        @DisplayName("new session starts active in UNKNOWN with the default confidence")
        void defaults() {
            stubSaveAssigningId();
            when(systemLogRepository.save(any(SystemLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(store.createSession(SessionCreateRequest.of("wa-1", Channel.WHATSAPP, null)))
                .assertNext(s -> {
                    assertNotNull(s.id());
                    assertEquals("wa-1", s.sessionId());
                    assertEquals(Channel.WHATSAPP, s.channel());
                    assertEquals(PersonaType.ELDERLY_UNCLE, s.persona());
                    assertEquals(SessionStatus.ACTIVE, s.status());
                    assertEquals(ConversationState.UNKNOWN, s.currentState());
                    assertEquals(0.35, s.initialConfidence());
                    assertEquals(0, s.totalMessagesExchanged());
                    assertNull(s.finalConfidence());
                    assertNull(s.completedAt());
                    assertNotNull(s.createdAt());
                    assertTrue(s.isActive());
                })
                .verifyComplete();

            ArgumentCaptor<Session> saved = ArgumentCaptor.forClass(Session.class);
            verify(repository).save(saved.capture());
            assertEquals("WhatsApp", saved.getValue().getChannel());
            assertEquals("active", saved.getValue().getStatus());
        }

        @Test
        @DisplayName("caller-chosen initial state is kept")
        void initialState() {
            stubSaveAssigningId();
            when(systemLogRepository.save(any(SystemLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
            SessionCreateRequest request = new SessionCreateRequest(
                "sms-2", Channel.SMS, "hi", "IN", PersonaType.BUSY_PROFESSIONAL, 0.6, ConversationState.PROBING);

            StepVerifier.create(store.createSession(request))
                .assertNext(s -> {
                    assertEquals(ConversationState.PROBING, s.currentState());
                    assertEquals(0.6, s.initialConfidence());
                    assertEquals("hi", s.language());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("writes a session_created audit event")
        void auditEvent() {
            stubSaveAssigningId();
            when(systemLogRepository.save(any(SystemLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(store.createSession(SessionCreateRequest.of("wa-3", Channel.WHATSAPP, null)))
                .expectNextCount(1)
                .verifyComplete();

            ArgumentCaptor<SystemLog> event = ArgumentCaptor.forClass(SystemLog.class);
            verify(systemLogRepository).save(event.capture());
            assertEquals("session_created", event.getValue().getEventType());
            assertEquals("INFO", event.getValue().getLogLevel());
            assertNotNull(event.getValue().getSessionId());
        }

        @Test
        @DisplayName("duplicate session id → ConstraintViolationException, no audit event")
        void duplicate() {
            when(repository.save(any(Session.class)))
                .thenReturn(Mono.error(new DuplicateKeyException("sessions_session_id_key")));

            StepVerifier.create(store.createSession(SessionCreateRequest.of("wa-1", Channel.WHATSAPP, null)))
                .expectError(ConstraintViolationException.class)
                .verify();

            verifyNoInteractions(systemLogRepository);
        }

        @Test
        @DisplayName("a failing audit write does not fail creation")
        void auditFailureIsNonFatal() {
            stubSaveAssigningId();
            when(systemLogRepository.save(any(SystemLog.class)))
                .thenReturn(Mono.error(new IllegalStateException("log table locked")));

            StepVerifier.create(store.createSession(SessionCreateRequest.of("wa-4", Channel.CHAT, null)))
                .assertNext(s -> assertEquals("wa-4", s.sessionId()))
                .verifyComplete();
        }
    }

    // ── reads ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("unknown session id completes empty")
        void unknownSessionId() {
            when(repository.findBySessionId("nope")).thenReturn(Mono.empty());

            StepVerifier.create(store.getBySessionId("nope")).verifyComplete();
        }

        @Test
        @DisplayName("lookup by internal id maps persisted strings back to enums")
        void byInternalId() {
            Session s = persisted("wa-1", "burned", "EXITING");
            when(repository.findById(s.getId())).thenReturn(Mono.just(s));

            StepVerifier.create(store.getByInternalId(s.getId()))
                .assertNext(dto -> {
                    assertEquals(SessionStatus.BURNED, dto.status());
                    assertEquals(ConversationState.EXITING, dto.currentState());
                    assertFalse(dto.isActive());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("active sessions are queried by the persisted status")
        void listActive() {
            Session newer = persisted("wa-2", "active", "PROBING");
            Session older = persisted("wa-1", "active", "ENGAGING");
            when(repository.findByStatusOrderByCreatedAtDesc("active")).thenReturn(Flux.just(newer, older));

            StepVerifier.create(store.listActiveSessions())
                .assertNext(s -> assertEquals("wa-2", s.sessionId()))
                .assertNext(s -> assertEquals("wa-1", s.sessionId()))
                .verifyComplete();
        }

        @Test
        @DisplayName("store outage → ConnectivityException")
        void outage() {
            when(repository.findBySessionId("wa-1"))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

            StepVerifier.create(store.getBySessionId("wa-1"))
                .expectError(ConnectivityException.class)
                .verify();
        }
    }

    // ── updateSession ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("updateSession()")
    class UpdateSession {

        @Test
        @DisplayName("empty patch is a pure read")
        void emptyPatch() {
            Session s = persisted("wa-1", "active", "PROBING");
            when(repository.findBySessionId("wa-1")).thenReturn(Mono.just(s));

            StepVerifier.create(store.updateSession("wa-1", SessionPatch.EMPTY))
                .assertNext(dto -> assertEquals(ConversationState.PROBING, dto.currentState()))
                .verifyComplete();

            verifyNoInteractions(template, changeListener);
        }

        @Test
        @DisplayName("only the present fields are written, plus updatedAt")
        void sparseWrite() {
            stubUpdateAffecting(1);
            Session after = persisted("wa-1", "active", "DRAINING");
            when(repository.findBySessionId("wa-1")).thenReturn(Mono.just(after));

            SessionPatch patch = SessionPatch.builder().currentState(ConversationState.DRAINING).build();

            StepVerifier.create(store.updateSession("wa-1", patch))
                .assertNext(dto -> assertEquals(ConversationState.DRAINING, dto.currentState()))
                .verifyComplete();

            ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
            verify(terminatingUpdate).apply(update.capture());
            Map<String, Object> written = assignmentsOf(update.getValue());
            assertEquals(2, written.size());
            assertEquals("DRAINING", written.get("currentState"));
            assertTrue(written.containsKey("updatedAt"));
            verifyNoInteractions(systemLogRepository);
        }

        @Test
        @DisplayName("a successful write drops cached copies before the record is emitted")
        void notifiesChange() {
            stubUpdateAffecting(1);
            Session after = persisted("wa-1", "completed", "EXITING");
            when(repository.findBySessionId("wa-1")).thenReturn(Mono.just(after));
            when(systemLogRepository.save(any(SystemLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(store.updateSession("wa-1",
                    SessionPatch.builder().status(SessionStatus.COMPLETED).build()))
                .assertNext(dto -> assertEquals(SessionStatus.COMPLETED, dto.status()))
                .verifyComplete();

            InOrder order = inOrder(repository, changeListener);
            order.verify(repository).findBySessionId("wa-1");
            order.verify(changeListener).sessionChanged("wa-1");
        }

        @Test
        @DisplayName("closing the session writes status, confidence and completion time and logs the change")
        void closing() {
            stubUpdateAffecting(1);
            when(systemLogRepository.save(any(SystemLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
            Session after = persisted("wa-1", "completed", "EXITING");
            after.setFinalConfidence(0.92);
            after.setCompletedAt(LocalDateTime.of(2025, 2, 1, 11, 0));
            when(repository.findBySessionId("wa-1")).thenReturn(Mono.just(after));

            LocalDateTime completedAt = LocalDateTime.of(2025, 2, 1, 11, 0);
            SessionPatch patch = SessionPatch.builder()
                .status(SessionStatus.COMPLETED)
                .finalConfidence(0.92)
                .completedAt(completedAt)
                .build();

            StepVerifier.create(store.updateSession("wa-1", patch))
                .assertNext(dto -> {
                    assertEquals(SessionStatus.COMPLETED, dto.status());
                    assertEquals(0.92, dto.finalConfidence());
                })
                .verifyComplete();

            ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
            verify(terminatingUpdate).apply(update.capture());
            Map<String, Object> written = assignmentsOf(update.getValue());
            assertEquals("completed", written.get("status"));
            assertEquals(0.92, written.get("finalConfidence"));
            assertEquals(completedAt, written.get("completedAt"));
            assertFalse(written.containsKey("currentState"));

            ArgumentCaptor<SystemLog> event = ArgumentCaptor.forClass(SystemLog.class);
            verify(systemLogRepository).save(event.capture());
            assertEquals("session_status_changed", event.getValue().getEventType());
        }

        @Test
        @DisplayName("unknown session completes empty without a re-read")
        void unknownSession() {
            stubUpdateAffecting(0);

            StepVerifier.create(store.updateSession("ghost",
                    SessionPatch.builder().scamDetected(true).build()))
                .verifyComplete();

            verify(repository, never()).findBySessionId(any());
            verifyNoInteractions(changeListener);
        }

        @Test
        @DisplayName("markCallbackSent records flag, time and the encoded response")
        void markCallbackSent() {
            stubUpdateAffecting(1);
            Session after = persisted("wa-1", "completed", "EXITING");
            after.setCallbackSent(true);
            after.setCallbackResponse("{\"status\":200}");
            when(repository.findBySessionId("wa-1")).thenReturn(Mono.just(after));

            StepVerifier.create(store.markCallbackSent("wa-1", Map.of("status", 200)))
                .assertNext(dto -> {
                    assertTrue(dto.callbackSent());
                    assertEquals(200, dto.callbackResponse().get("status"));
                })
                .verifyComplete();

            ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
            verify(terminatingUpdate).apply(update.capture());
            Map<String, Object> written = assignmentsOf(update.getValue());
            assertEquals(Boolean.TRUE, written.get("callbackSent"));
            assertEquals("{\"status\":200}", written.get("callbackResponse"));
            assertNotNull(written.get("callbackSentAt"));
        }
    }
}
