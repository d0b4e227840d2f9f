package com.honeypot.ledger.service;

import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.model.ArtifactType;
import com.honeypot.ledger.dto.IntelligenceCandidate;
import com.honeypot.ledger.dto.IntelligenceDTO;
import com.honeypot.ledger.dto.IntelligenceSummaryDTO;
import com.honeypot.ledger.dto.SystemLogEntry;
import com.honeypot.ledger.model.ExtractedIntelligence;
import com.honeypot.ledger.repository.ExtractedIntelligenceRepository;
import com.honeypot.ledger.support.LedgerErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Merges repeated sightings of the same artifact within a session into a single row.
 *
 * <p>The first extraction of ({@code session}, {@code type}, {@code value}) inserts a row with
 * {@code confirmationCount = 1}. Every later extraction increments the count, marks the row
 * confirmed and refreshes {@code lastSeenAt}; the fields captured at first sight are kept.
 * The merge is a single {@code INSERT ... ON CONFLICT} statement, so concurrent duplicates need no
 * application-level lock.
 */
@Service
public class IntelligenceDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(IntelligenceDeduplicator.class);
    private static final String COMPONENT = "intelligence-deduplicator";

    private final ExtractedIntelligenceRepository repository;
    private final JsonColumnCodec codec;
    private final SystemLogSink systemLog;
    private final SessionChangeListener changeListener;

    public IntelligenceDeduplicator(ExtractedIntelligenceRepository repository,
                                    JsonColumnCodec codec,
                                    SystemLogSink systemLog,
                                    SessionChangeListener changeListener) {
        this.repository     = repository;
        this.codec          = codec;
        this.systemLog      = systemLog;
        this.changeListener = changeListener;
    }

    /**
     * Inserts or merges one artifact.
     *
     * @return the row as it stands after this call
     */
    public Mono<IntelligenceDTO> extractArtifact(IntelligenceCandidate candidate) {
        Mono<IntelligenceDTO> upserted = Mono.defer(() -> repository.upsert(
                candidate.sessionId(),
                candidate.artifactType().value(),
                candidate.artifactValue(),
                candidate.extractedFromMessageId(),
                candidate.extractedAtTurn(),
                candidate.extractionMethod(),
                candidate.confidenceScore(),
                candidate.contextSnippet(),
                codec.writeMap(candidate.metadata())))
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "extract artifact"))
            .doOnSuccess(i -> {
                if (i.isFirstSighting()) {
                    log.info("Artifact extracted. sessionUuid={} type={} value={}",
                             i.sessionId(), i.artifactType(), i.artifactValue());
                } else {
                    log.info("Artifact confirmed. sessionUuid={} type={} value={} count={}",
                             i.sessionId(), i.artifactType(), i.artifactValue(), i.confirmationCount());
                }
            })
            .doOnError(e -> log.error("Failed to extract artifact. sessionUuid={} type={}",
                                      candidate.sessionId(), candidate.artifactType(), e))
            // only a first sighting moves the session's artifact counter
            .flatMap(i -> i.isFirstSighting()
                ? changeListener.sessionChanged(i.sessionId()).thenReturn(i)
                : Mono.just(i));

        return systemLog.emitAfter(upserted, i -> SystemLogEntry.info(
            i.sessionId(), COMPONENT,
            i.isFirstSighting() ? "artifact_extracted" : "artifact_confirmed",
            (i.isFirstSighting() ? "New " : "Repeated ") + i.artifactType().value(),
            Map.of("artifactType", i.artifactType().value(),
                   "confirmationCount", i.confirmationCount())));
    }

    /** Every artifact of the session, oldest sighting first. */
    public Flux<IntelligenceDTO> getAllForSession(UUID sessionUuid) {
        return repository.findBySessionIdOrderByFirstSeenAtAsc(sessionUuid)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read artifacts"));
    }

    /** Confirmed artifacts only, most corroborated first. */
    public Flux<IntelligenceDTO> getConfirmed(UUID sessionUuid) {
        return repository.findBySessionIdAndConfirmedTrueOrderByConfirmationCountDesc(sessionUuid)
            .map(this::toDto)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read confirmed artifacts"));
    }

    public Mono<IntelligenceSummaryDTO> summarize(UUID sessionUuid) {
        return getAllForSession(sessionUuid)
            .collectList()
            .map(all -> summarize(sessionUuid, all));
    }

    static IntelligenceSummaryDTO summarize(UUID sessionUuid, List<IntelligenceDTO> artifacts) {
        Map<ArtifactType, Integer> byType = new EnumMap<>(ArtifactType.class);
        for (ArtifactType type : ArtifactType.values()) {
            byType.put(type, 0);
        }
        int confirmed = 0;
        for (IntelligenceDTO artifact : artifacts) {
            byType.merge(artifact.artifactType(), 1, Integer::sum);
            if (artifact.confirmed()) {
                confirmed++;
            }
        }
        return new IntelligenceSummaryDTO(sessionUuid, artifacts.size(), confirmed, byType);
    }

    private IntelligenceDTO toDto(ExtractedIntelligence e) {
        return new IntelligenceDTO(
            e.getId(),
            e.getSessionId(),
            ArtifactType.fromValue(e.getArtifactType()),
            e.getArtifactValue(),
            e.getExtractedFromMessageId(),
            e.getExtractedAtTurn(),
            e.getExtractionMethod(),
            Boolean.TRUE.equals(e.getConfirmed()),
            e.getConfirmationCount() != null ? e.getConfirmationCount() : 1,
            e.getConfidenceScore() != null ? e.getConfidenceScore() : 0.0,
            e.getFirstSeenAt(),
            e.getLastSeenAt(),
            e.getContextSnippet(),
            codec.readMap(e.getMetadata()));
    }
}
