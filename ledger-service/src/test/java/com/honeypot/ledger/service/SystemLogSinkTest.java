package com.honeypot.ledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.exception.ConnectivityException;
import com.honeypot.common.model.LogLevel;
import com.honeypot.ledger.dto.SystemLogEntry;
import com.honeypot.ledger.model.SystemLog;
import com.honeypot.ledger.repository.SystemLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SystemLogSinkTest {

    private static final UUID SESSION = UUID.randomUUID();

    @Mock SystemLogRepository repository;

    private SystemLogSink sink;

    @BeforeEach
    void setUp() {
        sink = new SystemLogSink(repository, new JsonColumnCodec(new ObjectMapper()));
    }

    @Nested
    @DisplayName("log()")
    class Log {

        @Test
        @DisplayName("successful write → true, details encoded")
        void success() {
            when(repository.save(any(SystemLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(sink.log(SystemLogEntry.warning(SESSION, "agent", "exposure_high",
                                                                "Exposure risk above 0.8", Map.of("risk", 0.83))))
                .expectNext(true)
                .verifyComplete();

            ArgumentCaptor<SystemLog> saved = ArgumentCaptor.forClass(SystemLog.class);
            verify(repository).save(saved.capture());
            assertEquals("WARNING", saved.getValue().getLogLevel());
            assertEquals("{\"risk\":0.83}", saved.getValue().getDetails());
            assertNotNull(saved.getValue().getTimestamp());
        }

        @Test
        @DisplayName("failed write → false, never an error")
        void failure() {
            when(repository.save(any(SystemLog.class)))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("store down")));

            StepVerifier.create(sink.log(SystemLogEntry.info(null, "agent", "startup", "up", null)))
                .expectNext(false)
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("emitAfter()")
    class EmitAfter {

        @Test
        @DisplayName("primary value passes through when the log write fails")
        void logFailureIsSwallowed() {
            when(repository.save(any(SystemLog.class))).thenReturn(Mono.error(new IllegalStateException("boom")));

            StepVerifier.create(sink.emitAfter(Mono.just("primary"),
                    v -> SystemLogEntry.info(SESSION, "test", "evt", v, null)))
                .expectNext("primary")
                .verifyComplete();
        }

        @Test
        @DisplayName("a throwing entry factory does not fail the primary")
        void factoryFailureIsSwallowed() {
            StepVerifier.create(sink.emitAfter(Mono.just(42), v -> {
                    throw new IllegalStateException("cannot build entry");
                }))
                .expectNext(42)
                .verifyComplete();

            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("failed primary writes nothing and keeps its error")
        void primaryFailure() {
            StepVerifier.create(sink.emitAfter(Mono.<String>error(new IllegalArgumentException("bad")),
                    v -> SystemLogEntry.info(SESSION, "test", "evt", v, null)))
                .expectError(IllegalArgumentException.class)
                .verify();

            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("empty primary writes nothing")
        void emptyPrimary() {
            StepVerifier.create(sink.emitAfter(Mono.<String>empty(),
                    v -> SystemLogEntry.info(SESSION, "test", "evt", v, null)))
                .verifyComplete();

            verifyNoInteractions(repository);
        }
    }

    @Test
    @DisplayName("session events are read back with decoded details")
    void readBack() {
        SystemLog row = new SystemLog();
        row.setSessionId(SESSION);
        row.setLogLevel("ERROR");
        row.setComponent("callback");
        row.setEventType("callback_failed");
        row.setMessage("HTTP 502");
        row.setDetails("{\"attempt\":1}");
        when(repository.findBySessionIdOrderByTimestampAsc(SESSION)).thenReturn(Flux.just(row));

        StepVerifier.create(sink.getForSession(SESSION))
            .assertNext(e -> {
                assertEquals(LogLevel.ERROR, e.level());
                assertEquals(1, e.details().get("attempt"));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("store outage on read → ConnectivityException")
    void readOutage() {
        when(repository.findBySessionIdOrderByTimestampAsc(SESSION)).thenReturn(
            Flux.error(new DataAccessResourceFailureException("connection refused")));

        StepVerifier.create(sink.getForSession(SESSION))
            .expectError(ConnectivityException.class)
            .verify();
    }
}
