package com.honeypot.ledger.controller;

import com.honeypot.common.api.FinalCallbackPayload;
import com.honeypot.common.exception.ConnectivityException;
import com.honeypot.ledger.cache.SessionReader;
import com.honeypot.ledger.dto.IntelligenceDTO;
import com.honeypot.ledger.dto.IntelligenceSummaryDTO;
import com.honeypot.ledger.dto.MessageDTO;
import com.honeypot.ledger.dto.SessionDTO;
import com.honeypot.ledger.dto.StateEvolutionDTO;
import com.honeypot.ledger.dto.SystemLogEntry;
import com.honeypot.ledger.dto.TacticDTO;
import com.honeypot.ledger.model.EvaluationMetrics;
import com.honeypot.ledger.service.CallbackPayloadAssembler;
import com.honeypot.ledger.service.EvaluationMetricsStore;
import com.honeypot.ledger.service.IntelligenceDeduplicator;
import com.honeypot.ledger.service.MessageLedger;
import com.honeypot.ledger.service.SessionStore;
import com.honeypot.ledger.service.StateEvolutionLedger;
import com.honeypot.ledger.service.SystemLogSink;
import com.honeypot.ledger.service.TacticRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;

/**
 * Read-only reporting surface over the ledger. Sessions are addressed by the caller-facing
 * session id; an unknown id yields 404 for single resources and an empty list for collections.
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private static final Logger log = LoggerFactory.getLogger(LedgerController.class);

    private final SessionStore sessionStore;
    private final SessionReader sessionReader;
    private final MessageLedger messageLedger;
    private final StateEvolutionLedger evolutionLedger;
    private final IntelligenceDeduplicator deduplicator;
    private final TacticRecorder tacticRecorder;
    private final SystemLogSink systemLog;
    private final EvaluationMetricsStore metricsStore;
    private final CallbackPayloadAssembler callbackAssembler;

    public LedgerController(SessionStore sessionStore,
                            SessionReader sessionReader,
                            MessageLedger messageLedger,
                            StateEvolutionLedger evolutionLedger,
                            IntelligenceDeduplicator deduplicator,
                            TacticRecorder tacticRecorder,
                            SystemLogSink systemLog,
                            EvaluationMetricsStore metricsStore,
                            CallbackPayloadAssembler callbackAssembler) {
        this.sessionStore      = sessionStore;
        this.sessionReader     = sessionReader;
        this.messageLedger     = messageLedger;
        this.evolutionLedger   = evolutionLedger;
        this.deduplicator      = deduplicator;
        this.tacticRecorder    = tacticRecorder;
        this.systemLog         = systemLog;
        this.metricsStore      = metricsStore;
        this.callbackAssembler = callbackAssembler;
    }

    // ── Sessions ────────────────────────────────────────────────────────────

    @GetMapping("/sessions/active")
    public Flux<SessionDTO> activeSessions() {
        log.info("Active sessions query received");
        return sessionStore.listActiveSessions();
    }

    @GetMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<SessionDTO>> session(@PathVariable String sessionId) {
        log.info("Session query received. sessionId={}", sessionId);
        return sessionReader.readSession(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Session endpoint error. sessionId={}", sessionId, e));
    }

    @GetMapping("/sessions/{sessionId}/messages")
    public Flux<MessageDTO> messages(@PathVariable String sessionId,
                                     @RequestParam(defaultValue = "50") int limit) {
        log.info("Message history requested. sessionId={} limit={}", sessionId, limit);
        return forSession(sessionId, s -> messageLedger.getHistory(s.id(), limit));
    }

    @GetMapping("/sessions/{sessionId}/evolution")
    public Flux<StateEvolutionDTO> evolution(@PathVariable String sessionId,
                                             @RequestParam(defaultValue = "false") boolean transitionsOnly) {
        log.info("State evolution requested. sessionId={} transitionsOnly={}", sessionId, transitionsOnly);
        return forSession(sessionId, s -> transitionsOnly
            ? evolutionLedger.getTransitions(s.id())
            : evolutionLedger.getHistory(s.id()));
    }

    // ── Intelligence ────────────────────────────────────────────────────────

    @GetMapping("/sessions/{sessionId}/intelligence")
    public Flux<IntelligenceDTO> intelligence(@PathVariable String sessionId) {
        log.info("Intelligence requested. sessionId={}", sessionId);
        return forSession(sessionId, s -> deduplicator.getAllForSession(s.id()));
    }

    @GetMapping("/sessions/{sessionId}/intelligence/confirmed")
    public Flux<IntelligenceDTO> confirmedIntelligence(@PathVariable String sessionId) {
        log.info("Confirmed intelligence requested. sessionId={}", sessionId);
        return forSession(sessionId, s -> deduplicator.getConfirmed(s.id()));
    }

    @GetMapping("/sessions/{sessionId}/intelligence/summary")
    public Mono<ResponseEntity<IntelligenceSummaryDTO>> intelligenceSummary(@PathVariable String sessionId) {
        log.info("Intelligence summary requested. sessionId={}", sessionId);
        return sessionStore.getBySessionId(sessionId)
            .flatMap(s -> deduplicator.summarize(s.id()))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/sessions/{sessionId}/tactics")
    public Flux<TacticDTO> tactics(@PathVariable String sessionId) {
        log.info("Tactics requested. sessionId={}", sessionId);
        return forSession(sessionId, s -> tacticRecorder.getTactics(s.id()));
    }

    // ── Audit & evaluation ──────────────────────────────────────────────────

    @GetMapping("/sessions/{sessionId}/logs")
    public Flux<SystemLogEntry> systemLogs(@PathVariable String sessionId) {
        log.info("System logs requested. sessionId={}", sessionId);
        return forSession(sessionId, s -> systemLog.getForSession(s.id()));
    }

    @GetMapping("/sessions/{sessionId}/metrics")
    public Mono<ResponseEntity<EvaluationMetrics>> metrics(@PathVariable String sessionId) {
        log.info("Evaluation metrics requested. sessionId={}", sessionId);
        return sessionStore.getBySessionId(sessionId)
            .flatMap(s -> metricsStore.getForSession(s.id()))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/sessions/{sessionId}/callback-preview")
    public Mono<ResponseEntity<FinalCallbackPayload>> callbackPreview(
            @PathVariable String sessionId,
            @RequestParam(required = false) String agentNotes) {
        log.info("Callback preview requested. sessionId={}", sessionId);
        return callbackAssembler.assemble(sessionId, agentNotes)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Callback preview endpoint error. sessionId={}", sessionId, e));
    }

    // ── Errors ──────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected ledger query. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<Map<String, String>> unavailable(ConnectivityException e) {
        log.error("Ledger store unavailable. component={}", e.getComponent(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    private <T> Flux<T> forSession(String sessionId, Function<SessionDTO, Flux<T>> query) {
        return sessionStore.getBySessionId(sessionId).flatMapMany(query);
    }
}
