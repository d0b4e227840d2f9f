package com.honeypot.ledger.cache;

import com.honeypot.ledger.model.Session;
import com.honeypot.ledger.repository.SessionRepository;
import com.honeypot.ledger.service.SessionChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Drops the cached snapshots of a session whenever its durable row changes. Eviction is
 * best-effort: a cache outage is logged and the write it follows still succeeds.
 */
@Component
public class SessionCacheEvictor implements SessionChangeListener {

    private static final Logger log = LoggerFactory.getLogger(SessionCacheEvictor.class);

    private final SessionCache cache;
    private final SessionRepository sessions;

    public SessionCacheEvictor(SessionCache cache, SessionRepository sessions) {
        this.cache    = cache;
        this.sessions = sessions;
    }

    @Override
    public Mono<Void> sessionChanged(String sessionId) {
        return cache.invalidate(sessionId)
            .onErrorResume(e -> {
                log.warn("Cache invalidation failed (non-fatal). sessionId={}", sessionId, e);
                return Mono.just(0L);
            })
            .then();
    }

    @Override
    public Mono<Void> sessionChanged(UUID sessionUuid) {
        return sessions.findById(sessionUuid)
            .map(Session::getSessionId)
            .onErrorResume(e -> {
                log.warn("Session id lookup for cache invalidation failed (non-fatal). sessionUuid={}",
                         sessionUuid, e);
                return Mono.empty();
            })
            .flatMap(this::sessionChanged);
    }
}
