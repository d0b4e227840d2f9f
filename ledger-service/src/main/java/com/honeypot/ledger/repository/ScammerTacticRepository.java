package com.honeypot.ledger.repository;

import com.honeypot.ledger.model.ScammerTactic;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface ScammerTacticRepository extends ReactiveCrudRepository<ScammerTactic, UUID> {

    Flux<ScammerTactic> findBySessionIdOrderByDetectedAtTurnAsc(UUID sessionId);
}
