package com.honeypot.ledger.repository;

import com.honeypot.ledger.model.EvaluationMetrics;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface EvaluationMetricsRepository extends ReactiveCrudRepository<EvaluationMetrics, UUID> {

    Mono<EvaluationMetrics> findBySessionId(UUID sessionId);
}
