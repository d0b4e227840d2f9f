package com.honeypot.ledger.cache;

import com.honeypot.common.exception.ConnectivityException;
import com.honeypot.ledger.model.Session;
import com.honeypot.ledger.repository.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionCacheEvictorTest {

    private static final UUID SESSION_UUID = UUID.fromString("6a0f3c2e-1d4b-4f8e-a2c7-93b5d1e0f4a8");

    @Mock SessionCache cache;
    @Mock SessionRepository sessions;

    private SessionCacheEvictor evictor;

    @BeforeEach
    void setUp() {
        evictor = new SessionCacheEvictor(cache, sessions);
    }

    private static ConnectivityException cacheDown() {
        return new ConnectivityException("session-cache", "invalidate wa-1 could not reach its backing store",
                                         new RuntimeException("refused"));
    }

    @Test
    @DisplayName("caller session id evicts both snapshots")
    void bySessionId() {
        when(cache.invalidate("wa-1")).thenReturn(Mono.just(2L));

        StepVerifier.create(evictor.sessionChanged("wa-1")).verifyComplete();

        verify(cache).invalidate("wa-1");
        verifyNoInteractions(sessions);
    }

    @Test
    @DisplayName("internal id is resolved to the caller session id first")
    void byInternalId() {
        Session row = new Session();
        row.setId(SESSION_UUID);
        row.setSessionId("wa-1");
        when(sessions.findById(SESSION_UUID)).thenReturn(Mono.just(row));
        when(cache.invalidate("wa-1")).thenReturn(Mono.just(1L));

        StepVerifier.create(evictor.sessionChanged(SESSION_UUID)).verifyComplete();

        verify(cache).invalidate("wa-1");
    }

    @Test
    @DisplayName("unknown internal id touches nothing")
    void unknownInternalId() {
        when(sessions.findById(SESSION_UUID)).thenReturn(Mono.empty());

        StepVerifier.create(evictor.sessionChanged(SESSION_UUID)).verifyComplete();

        verify(cache, never()).invalidate(anyString());
    }

    @Test
    @DisplayName("cache outage completes quietly")
    void cacheOutage() {
        when(cache.invalidate("wa-1")).thenReturn(Mono.error(cacheDown()));

        StepVerifier.create(evictor.sessionChanged("wa-1")).verifyComplete();
    }

    @Test
    @DisplayName("failed id lookup completes quietly")
    void lookupOutage() {
        when(sessions.findById(SESSION_UUID))
            .thenReturn(Mono.error(new DataAccessResourceFailureException("pool exhausted")));

        StepVerifier.create(evictor.sessionChanged(SESSION_UUID)).verifyComplete();

        verifyNoInteractions(cache);
    }
}
