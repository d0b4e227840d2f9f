package com.honeypot.ledger.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Duration;

@Configuration
public class LedgerCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerCacheConfig.class);

    @Value("${ledger.cache.host:" + CacheSettings.DEFAULT_HOST + "}")
    private String host;

    @Value("${ledger.cache.port:" + CacheSettings.DEFAULT_PORT + "}")
    private int port;

    @Value("${ledger.cache.database:" + CacheSettings.DEFAULT_DATABASE + "}")
    private int database;

    @Value("${ledger.cache.ttl-seconds:" + CacheSettings.DEFAULT_TTL_SECONDS + "}")
    private long ttlSeconds;

    @Value("${ledger.cache.command-timeout-seconds:5}")
    private long commandTimeoutSeconds;

    @Bean
    public CacheSettings cacheSettings() {
        return new CacheSettings(host, port, database,
                                 Duration.ofSeconds(ttlSeconds), Duration.ofSeconds(commandTimeoutSeconds))
            .validate();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(CacheSettings settings) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(settings.host(), settings.port());
        standalone.setDatabase(settings.database());
        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
            .commandTimeout(settings.commandTimeout())
            .build();
        log.info("Session cache configured. host={} port={} db={} ttl={}",
                 settings.host(), settings.port(), settings.database(), settings.entryTtl());
        return new LettuceConnectionFactory(standalone, client);
    }

    @Bean
    public ReactiveStringRedisTemplate reactiveStringRedisTemplate(LettuceConnectionFactory redisConnectionFactory) {
        return new ReactiveStringRedisTemplate(redisConnectionFactory);
    }
}
