package com.whereq.transcribe.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis wiring for the job store, queue index and completion locks.
 * Job records are stored as JSON strings, so a plain string context is enough.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "transcribe.store", name = "type", havingValue = "REDIS", matchIfMissing = true)
public class RedisConfig {

    private static final Duration PING_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {
        return new ReactiveRedisTemplate<>(connectionFactory, RedisSerializationContext.string());
    }

    /**
     * Log whether Redis answers at startup. An unreachable store is reported, not fatal:
     * ticks fail and are retried until it comes back.
     */
    @Bean
    public ApplicationRunner redisConnectionCheck(ReactiveRedisConnectionFactory connectionFactory,
                                                  TranscribeProperties properties) {
        return args -> Mono.usingWhen(
                Mono.fromSupplier(connectionFactory::getReactiveConnection),
                connection -> connection.ping(),
                connection -> connection.closeLater())
            .timeout(PING_TIMEOUT)
            .doOnNext(reply -> log.info("Job store connected to Redis (key prefix '{}')",
                properties.getStore().getKeyPrefix()))
            .onErrorResume(e -> {
                log.warn("Redis not reachable at startup: {}", e.getMessage());
                return Mono.empty();
            })
            .subscribe();
    }
}
