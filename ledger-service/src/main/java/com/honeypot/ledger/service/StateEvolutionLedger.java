package com.honeypot.ledger.service;

import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.PersistedValue;
import com.honeypot.ledger.dto.StateEvolutionCreateRequest;
import com.honeypot.ledger.dto.StateEvolutionDTO;
import com.honeypot.ledger.dto.ToneVector;
import com.honeypot.ledger.model.StateEvolution;
import com.honeypot.ledger.repository.StateEvolutionRepository;
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
 * Per-turn trajectory of state, confidence, exposure risk and tone, written by the scoring layer
 * after every turn and read back for trend analysis.
 */
@Service
public class StateEvolutionLedger {

    private static final Logger log = LoggerFactory.getLogger(StateEvolutionLedger.class);
    private static final String COMPONENT = "state-evolution-ledger";

    private final StateEvolutionRepository repository;
    private final JsonColumnCodec codec;

    public StateEvolutionLedger(StateEvolutionRepository repository, JsonColumnCodec codec) {
        this.repository = repository;
        this.codec      = codec;
    }

    public Mono<StateEvolutionDTO> recordEvolution(StateEvolutionCreateRequest request) {
        return Mono.fromCallable(() -> toEntity(request))
            .flatMap(repository::save)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "record evolution"))
            .doOnSuccess(e -> {
                if (e.stateTransitionOccurred()) {
                    log.info("State transition recorded. sessionUuid={} turn={} from={} to={}",
                             e.sessionId(), e.turnNumber(), e.previousState(), e.currentState());
                }
            })
            .doOnError(e -> log.error("Failed to record evolution. sessionUuid={} turn={}",
                                      request.sessionId(), request.turnNumber(), e));
    }

    /** Full trajectory, ascending by turn. */
    public Flux<StateEvolutionDTO> getHistory(UUID sessionUuid) {
        return repository.findBySessionIdOrderByTurnNumberAsc(sessionUuid)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read evolution history"));
    }

    /** Only the turns where the conversation state changed, ascending by turn. */
    public Flux<StateEvolutionDTO> getTransitions(UUID sessionUuid) {
        return repository.findBySessionIdAndStateTransitionOccurredTrueOrderByTurnNumberAsc(sessionUuid)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read state transitions"));
    }

    private StateEvolution toEntity(StateEvolutionCreateRequest r) {
        StateEvolution entity = new StateEvolution();
        entity.setSessionId(r.sessionId());
        entity.setMessageId(r.messageId());
        entity.setTurnNumber(r.turnNumber());
        entity.setPreviousState(PersistedValue.valueOf(r.previousState()));
        entity.setCurrentState(r.currentState().value());
        entity.setStateTransitionOccurred(r.stateTransitionOccurred());
        entity.setTurnsInCurrentState(r.turnsInCurrentState());
        entity.setPreviousConfidence(r.previousConfidence());
        entity.setCurrentConfidence(r.currentConfidence());
        entity.setConfidenceDelta(r.confidenceDelta());
        entity.setConfidenceTrend(r.confidenceTrend());
        entity.setExposureRisk(r.exposureRisk());
        entity.setExposureDelta(r.exposureDelta());
        ToneVector tone = r.tone();
        entity.setToneConfusion(tone.confusion());
        entity.setToneAnxiety(tone.anxiety());
        entity.setToneUrgency(tone.urgency());
        entity.setToneCompliance(tone.compliance());
        entity.setToneCognitiveLoad(tone.cognitiveLoad());
        entity.setDriftRate(r.driftRate());
        entity.setInitiative(r.initiative());
        entity.setSignalsDetected(codec.writeList(r.signalsDetected()));
        entity.setTimestamp(LocalDateTime.now(ZoneOffset.UTC));
        return entity;
    }

    private StateEvolutionDTO toDto(StateEvolution e) {
        return new StateEvolutionDTO(
            e.getId(),
            e.getSessionId(),
            e.getMessageId(),
            e.getTurnNumber() != null ? e.getTurnNumber() : 0,
            PersistedValue.fromNullableValue(ConversationState.class, e.getPreviousState()),
            PersistedValue.fromNullableValue(ConversationState.class, e.getCurrentState()),
            Boolean.TRUE.equals(e.getStateTransitionOccurred()),
            e.getTurnsInCurrentState() != null ? e.getTurnsInCurrentState() : 0,
            e.getPreviousConfidence(),
            e.getCurrentConfidence() != null ? e.getCurrentConfidence() : 0.0,
            e.getConfidenceDelta(),
            e.getConfidenceTrend(),
            e.getExposureRisk() != null ? e.getExposureRisk() : 0.0,
            e.getExposureDelta(),
            new ToneVector(e.getToneConfusion(), e.getToneAnxiety(), e.getToneUrgency(),
                           e.getToneCompliance(), e.getToneCognitiveLoad()),
            e.getDriftRate(),
            e.getInitiative(),
            codec.readList(e.getSignalsDetected()),
            e.getTimestamp());
    }
}
