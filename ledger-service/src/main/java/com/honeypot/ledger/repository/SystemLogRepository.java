package com.honeypot.ledger.repository;

import com.honeypot.ledger.model.SystemLog;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface SystemLogRepository extends ReactiveCrudRepository<SystemLog, UUID> {

    Flux<SystemLog> findBySessionIdOrderByTimestampAsc(UUID sessionId);
}
