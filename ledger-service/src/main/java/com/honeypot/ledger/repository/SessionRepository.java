package com.honeypot.ledger.repository;

import com.honeypot.ledger.model.Session;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface SessionRepository extends ReactiveCrudRepository<Session, UUID> {

    Mono<Session> findBySessionId(String sessionId);

    Flux<Session> findByStatusOrderByCreatedAtDesc(String status);
}
