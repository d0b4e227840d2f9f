package com.honeypot.ledger.repository;

import com.honeypot.ledger.model.StateEvolution;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface StateEvolutionRepository extends ReactiveCrudRepository<StateEvolution, UUID> {

    Flux<StateEvolution> findBySessionIdOrderByTurnNumberAsc(UUID sessionId);

    Flux<StateEvolution> findBySessionIdAndStateTransitionOccurredTrueOrderByTurnNumberAsc(UUID sessionId);
}
