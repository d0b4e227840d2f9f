package com.honeypot.ledger.service;

import com.honeypot.ledger.model.EvaluationMetrics;
import com.honeypot.ledger.repository.EvaluationMetricsRepository;
import com.honeypot.ledger.support.LedgerErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.UUID;

/**
 * Write-once store for post-engagement quality metrics. A session has at most one row; a second
 * write fails with {@code ConstraintViolationException}.
 */
@Service
public class EvaluationMetricsStore {

    private static final Logger log = LoggerFactory.getLogger(EvaluationMetricsStore.class);
    private static final String COMPONENT = "evaluation-metrics-store";

    private final EvaluationMetricsRepository repository;

    public EvaluationMetricsStore(EvaluationMetricsRepository repository) {
        this.repository = repository;
    }

    public Mono<EvaluationMetrics> record(EvaluationMetrics metrics) {
        return Mono.fromCallable(() -> {
                Objects.requireNonNull(metrics.getSessionId(), "sessionId");
                if (metrics.getId() != null) {
                    throw new IllegalArgumentException("Metrics are write-once, id must be unset: " + metrics.getId());
                }
                if (metrics.getCalculatedAt() == null) {
                    metrics.setCalculatedAt(LocalDateTime.now(ZoneOffset.UTC));
                }
                return metrics;
            })
            .flatMap(repository::save)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "record metrics"))
            .doOnSuccess(m -> log.info("Evaluation metrics recorded. sessionUuid={} overall={}",
                                       m.getSessionId(), m.getOverallQualityScore()))
            .doOnError(e -> log.error("Failed to record evaluation metrics. sessionUuid={}",
                                      metrics.getSessionId(), e));
    }

    public Mono<EvaluationMetrics> getForSession(UUID sessionUuid) {
        return repository.findBySessionId(sessionUuid)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read metrics"));
    }
}
