package com.honeypot.ledger.service;

import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.PersistedValue;
import com.honeypot.common.model.Sender;
import com.honeypot.ledger.dto.MessageCreateRequest;
import com.honeypot.ledger.dto.MessageDTO;
import com.honeypot.ledger.model.Message;
import com.honeypot.ledger.repository.MessageRepository;
import com.honeypot.ledger.support.LedgerErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Append-only conversation log. Turn numbers are stored as the caller supplies them; ordering,
 * gaps and duplicates are the caller's concern.
 */
@Service
public class MessageLedger {

    private static final Logger log = LoggerFactory.getLogger(MessageLedger.class);
    private static final String COMPONENT = "message-ledger";

    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final MessageRepository repository;
    private final SessionChangeListener changeListener;

    public MessageLedger(MessageRepository repository, SessionChangeListener changeListener) {
        this.repository     = repository;
        this.changeListener = changeListener;
    }

    /**
     * Appends one turn and bumps the session's message counter in the same statement.
     * A {@code null} timestamp becomes the current UTC time.
     */
    public Mono<MessageDTO> appendMessage(MessageCreateRequest request) {
        LocalDateTime timestamp = request.timestamp() != null
            ? request.timestamp()
            : LocalDateTime.now(ZoneOffset.UTC);

        return repository.append(
                request.sessionId(),
                request.sender().value(),
                request.text(),
                request.turnNumber(),
                timestamp,
                request.responseDelaySeconds(),
                request.rawLlmResponse(),
                request.finalResponse(),
                PersistedValue.valueOf(request.stateAtMessage()),
                request.confidenceAtMessage(),
                request.exposureRiskAtMessage())
            .map(MessageLedger::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "append message"))
            .doOnSuccess(m -> log.debug("Message appended. sessionUuid={} turn={} sender={}",
                                        request.sessionId(), request.turnNumber(), request.sender()))
            .doOnError(e -> log.error("Failed to append message. sessionUuid={} turn={}",
                                      request.sessionId(), request.turnNumber(), e))
            .flatMap(m -> changeListener.sessionChanged(m.sessionId()).thenReturn(m));
    }

    public Flux<MessageDTO> getHistory(UUID sessionUuid) {
        return getHistory(sessionUuid, DEFAULT_HISTORY_LIMIT);
    }

    /** At most {@code limit} messages, ascending by turn. */
    public Flux<MessageDTO> getHistory(UUID sessionUuid, int limit) {
        if (limit < 1) {
            return Flux.error(new IllegalArgumentException("limit must be >= 1, got " + limit));
        }
        return repository.findHistory(sessionUuid, limit)
            .map(MessageLedger::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read history"));
    }

    public Mono<MessageDTO> getLastAgentMessage(UUID sessionUuid) {
        return repository.findFirstBySessionIdAndSenderOrderByTurnNumberDesc(sessionUuid, Sender.AGENT.value())
            .map(MessageLedger::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read last agent message"));
    }

    static MessageDTO toDto(Message m) {
        return new MessageDTO(
            m.getId(),
            m.getSessionId(),
            Sender.fromValue(m.getSender()),
            m.getText(),
            m.getTurnNumber() != null ? m.getTurnNumber() : 0,
            m.getTimestamp(),
            m.getResponseDelaySeconds(),
            m.getRawLlmResponse(),
            m.getFinalResponse(),
            PersistedValue.fromNullableValue(ConversationState.class, m.getStateAtMessage()),
            m.getConfidenceAtMessage(),
            m.getExposureRiskAtMessage(),
            m.getCreatedAt());
    }
}
