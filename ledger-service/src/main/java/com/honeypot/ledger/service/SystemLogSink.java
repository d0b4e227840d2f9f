package com.honeypot.ledger.service;

import com.honeypot.common.codec.JsonColumnCodec;
import com.honeypot.common.model.LogLevel;
import com.honeypot.ledger.dto.SystemLogEntry;
import com.honeypot.ledger.model.SystemLog;
import com.honeypot.ledger.repository.SystemLogRepository;
import com.honeypot.ledger.support.LedgerErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.function.Function;

/**
 * Best-effort writer for the {@code system_logs} audit table.
 *
 * <p>A failed write is reported through SLF4J and swallowed: nothing in this class ever
 * propagates an error into the operation that produced the event.
 */
@Service
public class SystemLogSink {

    private static final Logger log = LoggerFactory.getLogger(SystemLogSink.class);
    private static final String COMPONENT = "system-log-sink";

    private final SystemLogRepository repository;
    private final JsonColumnCodec codec;

    public SystemLogSink(SystemLogRepository repository, JsonColumnCodec codec) {
        this.repository = repository;
        this.codec      = codec;
    }

    /**
     * Appends one event.
     *
     * @return {@code true} when the row was written, {@code false} otherwise; never an error
     */
    public Mono<Boolean> log(SystemLogEntry entry) {
        return Mono.fromCallable(() -> toEntity(entry))
            .flatMap(repository::save)
            .map(saved -> Boolean.TRUE)
            .defaultIfEmpty(Boolean.FALSE)
            .onErrorResume(e -> {
                log.warn("System log write failed (non-fatal). component={} eventType={} sessionId={}",
                         entry.component(), entry.eventType(), entry.sessionId(), e);
                return Mono.just(Boolean.FALSE);
            });
    }

    /**
     * Runs {@code primary} and, once it succeeds, writes the event built from its value.
     * The primary value is emitted unchanged whatever happens to the log write; an empty or
     * failing primary writes nothing.
     */
    public <T> Mono<T> emitAfter(Mono<T> primary, Function<T, SystemLogEntry> entryFactory) {
        return primary.flatMap(value -> Mono.fromCallable(() -> entryFactory.apply(value))
            .flatMap(this::log)
            .onErrorResume(e -> {
                log.warn("System log entry could not be built (non-fatal)", e);
                return Mono.just(Boolean.FALSE);
            })
            .thenReturn(value));
    }

    public Flux<SystemLogEntry> getForSession(UUID sessionUuid) {
        return repository.findBySessionIdOrderByTimestampAsc(sessionUuid)
            .map(this::toEntry)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read system log"));
    }

    private SystemLog toEntity(SystemLogEntry entry) {
        SystemLog entity = new SystemLog();
        entity.setSessionId(entry.sessionId());
        entity.setLogLevel(entry.level().value());
        entity.setComponent(entry.component());
        entity.setEventType(entry.eventType());
        entity.setMessage(entry.message());
        entity.setDetails(codec.writeMap(entry.details()));
        entity.setTimestamp(LocalDateTime.now(ZoneOffset.UTC));
        return entity;
    }

    private SystemLogEntry toEntry(SystemLog entity) {
        return new SystemLogEntry(entity.getSessionId(), LogLevel.fromValue(entity.getLogLevel()),
                                  entity.getComponent(), entity.getEventType(), entity.getMessage(),
                                  codec.readMap(entity.getDetails()));
    }
}
