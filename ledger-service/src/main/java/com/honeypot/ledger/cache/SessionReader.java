package com.honeypot.ledger.cache;

import com.honeypot.ledger.dto.SessionDTO;
import com.honeypot.ledger.service.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Read-through access to session records for the per-turn hot path.
 *
 * <p>The cache only ever saves a round trip: any cache failure falls back to the durable store
 * and is logged, never surfaced. Session writes drop the cached copy through
 * {@link SessionCacheEvictor}; only a cache outage during that eviction can leave a stale entry.
 */
@Component
public class SessionReader {

    private static final Logger log = LoggerFactory.getLogger(SessionReader.class);

    private final SessionStore sessionStore;
    private final SessionCache cache;

    public SessionReader(SessionStore sessionStore, SessionCache cache) {
        this.sessionStore = sessionStore;
        this.cache        = cache;
    }

    public Mono<SessionDTO> readSession(String sessionId) {
        return cache.getCachedSession(sessionId, SessionDTO.class)
            .doOnNext(s -> log.debug("Session cache hit. sessionId={}", sessionId))
            .onErrorResume(e -> {
                log.warn("Session cache read failed (non-fatal). sessionId={}", sessionId, e);
                return Mono.empty();
            })
            .switchIfEmpty(Mono.defer(() -> sessionStore.getBySessionId(sessionId)
                .flatMap(session -> cache.cacheSession(sessionId, session)
                    .onErrorResume(e -> {
                        log.warn("Session cache write failed (non-fatal). sessionId={}", sessionId, e);
                        return Mono.just(Boolean.FALSE);
                    })
                    .thenReturn(session))));
    }

    /** Keeps a live session warm; {@code false} when nothing was cached or the cache is down. */
    public Mono<Boolean> touch(String sessionId) {
        return cache.extendTtl(sessionId)
            .onErrorResume(e -> {
                log.warn("Cache TTL extension failed (non-fatal). sessionId={}", sessionId, e);
                return Mono.just(Boolean.FALSE);
            });
    }
}
