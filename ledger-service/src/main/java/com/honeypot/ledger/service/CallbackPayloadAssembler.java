package com.honeypot.ledger.service;

import com.honeypot.common.api.FinalCallbackPayload;
import com.honeypot.common.model.ArtifactType;
import com.honeypot.ledger.dto.IntelligenceDTO;
import com.honeypot.ledger.dto.SessionDTO;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the outbound result payload from ledger state. Delivery itself happens elsewhere;
 * the outcome is recorded through {@link SessionStore#markCallbackSent}.
 */
@Component
public class CallbackPayloadAssembler {

    private final SessionStore sessionStore;
    private final IntelligenceDeduplicator deduplicator;

    public CallbackPayloadAssembler(SessionStore sessionStore, IntelligenceDeduplicator deduplicator) {
        this.sessionStore = sessionStore;
        this.deduplicator = deduplicator;
    }

    /** Empty when the session does not exist. */
    public Mono<FinalCallbackPayload> assemble(String sessionId, String agentNotes) {
        return sessionStore.getBySessionId(sessionId)
            .flatMap(session -> deduplicator.getAllForSession(session.id())
                .collectList()
                .map(artifacts -> assemble(session, artifacts, agentNotes)));
    }

    public static FinalCallbackPayload assemble(SessionDTO session, List<IntelligenceDTO> artifacts,
                                                String agentNotes) {
        return new FinalCallbackPayload(session.sessionId(), session.scamDetected(),
                                        session.totalMessagesExchanged(), artifactMap(artifacts), agentNotes);
    }

    /**
     * Artifact values grouped under their external label. Every label is present, in
     * {@link ArtifactType} order; values keep first-seen order without repeats.
     */
    public static Map<String, List<String>> artifactMap(List<IntelligenceDTO> artifacts) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (ArtifactType type : ArtifactType.values()) {
            grouped.put(type.externalLabel(), new ArrayList<>());
        }
        for (IntelligenceDTO artifact : artifacts) {
            List<String> values = grouped.get(artifact.artifactType().externalLabel());
            if (!values.contains(artifact.artifactValue())) {
                values.add(artifact.artifactValue());
            }
        }
        return grouped;
    }
}
