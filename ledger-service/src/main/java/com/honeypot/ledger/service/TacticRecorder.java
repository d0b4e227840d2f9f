package com.honeypot.ledger.service;

import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.model.TacticType;
import com.honeypot.ledger.dto.TacticCreateRequest;
import com.honeypot.ledger.dto.TacticDTO;
import com.honeypot.ledger.model.ScammerTactic;
import com.honeypot.ledger.repository.ScammerTacticRepository;
import com.honeypot.ledger.support.LedgerErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

@Service
public class TacticRecorder {

    private static final Logger log = LoggerFactory.getLogger(TacticRecorder.class);
    private static final String COMPONENT = "tactic-recorder";

    private final ScammerTacticRepository repository;
    private final JsonColumnCodec codec;

    public TacticRecorder(ScammerTacticRepository repository, JsonColumnCodec codec) {
        this.repository = repository;
        this.codec      = codec;
    }

    public Mono<TacticDTO> recordTactic(TacticCreateRequest request) {
        return Mono.fromCallable(() -> toEntity(request))
            .flatMap(repository::save)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "record tactic"))
            .doOnSuccess(t -> log.info("Tactic recorded. sessionUuid={} type={} turn={} threat={}",
                                       t.sessionId(), t.tacticType(), t.detectedAtTurn(), t.threatLevel()))
            .doOnError(e -> log.error("Failed to record tactic. sessionUuid={} type={}",
                                      request.sessionId(), request.tacticType(), e));
    }

    /** Ascending by detection turn. */
    public Flux<TacticDTO> getTactics(UUID sessionUuid) {
        return repository.findBySessionIdOrderByDetectedAtTurnAsc(sessionUuid)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read tactics"));
    }

    private ScammerTactic toEntity(TacticCreateRequest r) {
        ScammerTactic entity = new ScammerTactic();
        entity.setSessionId(r.sessionId());
        entity.setTacticType(r.tacticType().value());
        entity.setTacticDescription(r.tacticDescription());
        entity.setDetectedAtTurn(r.detectedAtTurn());
        entity.setMessageText(r.messageText());
        entity.setKeywordsUsed(codec.writeList(r.keywordsUsed()));
        entity.setThreatLevel(r.threatLevel());
        entity.setTimestamp(LocalDateTime.now(ZoneOffset.UTC));
        return entity;
    }

    private TacticDTO toDto(ScammerTactic t) {
        return new TacticDTO(
            t.getId(),
            t.getSessionId(),
            TacticType.fromValue(t.getTacticType()),
            t.getTacticDescription(),
            t.getDetectedAtTurn(),
            t.getMessageText(),
            codec.readList(t.getKeywordsUsed()),
            t.getThreatLevel(),
            t.getTimestamp());
    }
}
