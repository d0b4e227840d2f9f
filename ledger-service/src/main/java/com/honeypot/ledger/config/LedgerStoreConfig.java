package com.honeypot.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.honeypot.common.codec.JsonColumnCodec;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

/**
 * Durable-store wiring: one bounded R2DBC pool shared by every repository.
 *
 * <p>Declaring the pool here makes Spring Boot's own R2DBC auto-configuration back off; the
 * repositories, {@code DatabaseClient} and {@code R2dbcEntityTemplate} are still auto-configured
 * on top of it. Connections are borrowed per statement and released on every exit path.
 */
@Configuration
public class LedgerStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerStoreConfig.class);

    @Value("${ledger.store.host:" + StoreSettings.DEFAULT_HOST + "}")
    private String host;

    @Value("${ledger.store.port:" + StoreSettings.DEFAULT_PORT + "}")
    private int port;

    @Value("${ledger.store.database:" + StoreSettings.DEFAULT_DATABASE + "}")
    private String database;

    @Value("${ledger.store.user:" + StoreSettings.DEFAULT_USER + "}")
    private String user;

    @Value("${ledger.store.password:postgres}")
    private String password;

    @Value("${ledger.store.pool.min-size:" + StoreSettings.DEFAULT_POOL_MIN_SIZE + "}")
    private int poolMinSize;

    @Value("${ledger.store.pool.max-size:" + StoreSettings.DEFAULT_POOL_MAX_SIZE + "}")
    private int poolMaxSize;

    @Value("${ledger.store.timeout-seconds:" + StoreSettings.DEFAULT_TIMEOUT_SECONDS + "}")
    private long timeoutSeconds;

    @Bean
    public StoreSettings storeSettings() {
        return new StoreSettings(host, port, database, user, password,
                                 poolMinSize, poolMaxSize, Duration.ofSeconds(timeoutSeconds))
            .validate();
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionPool connectionFactory(StoreSettings settings) {
        PostgresqlConnectionFactory postgres = new PostgresqlConnectionFactory(
            PostgresqlConnectionConfiguration.builder()
                .host(settings.host())
                .port(settings.port())
                .database(settings.database())
                .username(settings.user())
                .password(settings.password())
                .connectTimeout(settings.timeout())
                .statementTimeout(settings.timeout())
                .options(Map.of("TimeZone", "UTC"))
                .build());

        ConnectionPool pool = new ConnectionPool(ConnectionPoolConfiguration.builder(postgres)
            .name("ledger-pool")
            .initialSize(settings.poolMinSize())
            .minIdle(settings.poolMinSize())
            .maxSize(settings.poolMaxSize())
            .maxAcquireTime(settings.timeout())
            .validationQuery("SELECT 1")
            .build());

        log.info("Ledger connection pool configured. {}", settings);
        return pool;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public JsonColumnCodec jsonColumnCodec(ObjectMapper objectMapper) {
        return new JsonColumnCodec(objectMapper);
    }
}
