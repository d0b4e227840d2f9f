package com.honeypot.ledger.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.honeypot.common.exception.SerializationException;
import com.honeypot.ledger.config.CacheSettings;
import com.honeypot.ledger.support.LedgerErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Redis mirror of a session snapshot and a state snapshot, under {@code session:<id>} and
 * {@code state:<id>}. Values are JSON strings written with the configured entry TTL, which every
 * write resets.
 *
 * <p>Not authoritative. A miss only means "go to the durable store"; callers must be prepared
 * for any entry to vanish between two calls.
 */
@Component
public class SessionCache {

    private static final Logger log = LoggerFactory.getLogger(SessionCache.class);
    private static final String COMPONENT = "session-cache";

    static final String SESSION_PREFIX = "session:";
    static final String STATE_PREFIX   = "state:";

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final CacheSettings settings;

    public SessionCache(ReactiveStringRedisTemplate redis, ObjectMapper objectMapper, CacheSettings settings) {
        this.redis        = redis;
        this.objectMapper = objectMapper;
        this.settings     = settings;
    }

    public static String sessionKey(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }

    public static String stateKey(String sessionId) {
        return STATE_PREFIX + sessionId;
    }

    // ── Session snapshot ────────────────────────────────────────────────────

    public Mono<Boolean> cacheSession(String sessionId, Object snapshot) {
        return write(sessionKey(sessionId), snapshot);
    }

    public Mono<Map<String, Object>> getCachedSession(String sessionId) {
        return read(sessionKey(sessionId), OBJECT_MAP);
    }

    public <T> Mono<T> getCachedSession(String sessionId, Class<T> type) {
        return read(sessionKey(sessionId), type);
    }

    // ── State snapshot ──────────────────────────────────────────────────────

    public Mono<Boolean> cacheState(String sessionId, Object snapshot) {
        return write(stateKey(sessionId), snapshot);
    }

    public Mono<Map<String, Object>> getCachedState(String sessionId) {
        return read(stateKey(sessionId), OBJECT_MAP);
    }

    public <T> Mono<T> getCachedState(String sessionId, Class<T> type) {
        return read(stateKey(sessionId), type);
    }

    // ── Lifecycle ───────────────────────────────────────────────────────────

    /**
     * Drops both entries. Absent keys are fine.
     *
     * @return number of keys actually removed (0..2)
     */
    public Mono<Long> invalidate(String sessionId) {
        return redis.delete(sessionKey(sessionId), stateKey(sessionId))
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "invalidate " + sessionId))
            .doOnSuccess(n -> log.debug("Cache invalidated. sessionId={} removed={}", sessionId, n));
    }

    /**
     * Pushes the expiry of both entries out by one TTL without touching their values.
     * {@code EXPIRE} never creates a key, so an absent or expired entry stays absent.
     *
     * @return {@code true} when at least one entry was still present
     */
    public Mono<Boolean> extendTtl(String sessionId) {
        return Flux.just(sessionKey(sessionId), stateKey(sessionId))
            .concatMap(key -> redis.expire(key, settings.entryTtl()))
            .reduce(Boolean.FALSE, (anyLive, extended) -> anyLive || extended)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "extend TTL " + sessionId));
    }

    private Mono<Boolean> write(String key, Object snapshot) {
        return Mono.fromCallable(() -> encode(key, snapshot))
            .flatMap(json -> redis.opsForValue().set(key, json, settings.entryTtl()))
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "write " + key));
    }

    private <T> Mono<T> read(String key, TypeReference<T> type) {
        return redis.opsForValue().get(key)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read " + key))
            .map(json -> decode(key, json, objectMapper.getTypeFactory().constructType(type)));
    }

    private <T> Mono<T> read(String key, Class<T> type) {
        return redis.opsForValue().get(key)
            .onErrorMap(LedgerErrorTranslator.forOperation(COMPONENT, "read " + key))
            .map(json -> decode(key, json, objectMapper.getTypeFactory().constructType(type)));
    }

    private String encode(String key, Object snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SerializationException(COMPONENT, "Cannot encode snapshot for " + key, e);
        }
    }

    private <T> T decode(String key, String json, JavaType type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException(COMPONENT, "Cached entry is not valid JSON: " + key, e);
        }
    }
}
