package com.honeypot.ledger.service;

import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Told after a write has changed a {@code sessions} row, so copies of that row held elsewhere can
 * be dropped. Implementations complete empty and never signal an error into the write.
 */
public interface SessionChangeListener {

    SessionChangeListener NONE = new SessionChangeListener() {
        @Override
        public Mono<Void> sessionChanged(String sessionId) {
            return Mono.empty();
        }

        @Override
        public Mono<Void> sessionChanged(UUID sessionUuid) {
            return Mono.empty();
        }
    };

    /** By the caller-facing session id. */
    Mono<Void> sessionChanged(String sessionId);

    /** By the internal id, for writes that only know the row's primary key. */
    Mono<Void> sessionChanged(UUID sessionUuid);
}
