package com.whereq.transcribe.lock;

import com.whereq.transcribe.config.TranscribeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Redis lock using {@code SET NX PX} with a random owner token.
 * <p>
 * The lease bounds how long a crashed holder blocks others. Release only deletes
 * the key while it still carries the holder's token.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "transcribe.store", name = "type", havingValue = "REDIS", matchIfMissing = true)
public class RedisDistributedLock implements DistributedLock {

    static final Duration RETRY_INTERVAL = Duration.ofMillis(200);

    private static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
        "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) end\n" +
        "return 0",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;
    private final Duration lease;

    public RedisDistributedLock(ReactiveRedisTemplate<String, String> redisTemplate,
                                TranscribeProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getStore().getKeyPrefix() + ":lock:";
        this.lease = properties.getCompletion().getLockLease();
    }

    @Override
    public Mono<LockHandle> tryAcquire(String lockName, Duration timeout) {
        String key = keyPrefix + lockName;
        String token = UUID.randomUUID().toString();

        return Mono.defer(() -> redisTemplate.opsForValue().setIfAbsent(key, token, lease))
            .filter(Boolean::booleanValue)
            .repeatWhenEmpty(attempts -> attempts.delayElements(RETRY_INTERVAL))
            .timeout(timeout, Mono.empty())
            .map(acquired -> (LockHandle) new RedisLockHandle(lockName, key, token))
            .doOnNext(handle -> log.debug("Acquired lock {}", lockName));
    }

    private class RedisLockHandle implements LockHandle {
        private final String lockName;
        private final String key;
        private final String token;

        RedisLockHandle(String lockName, String key, String token) {
            this.lockName = lockName;
            this.key = key;
            this.token = token;
        }

        @Override
        public String lockName() {
            return lockName;
        }

        @Override
        public Mono<Void> release() {
            return redisTemplate.execute(RELEASE_SCRIPT, List.of(key), List.of(token))
                .next()
                .doOnSuccess(deleted -> {
                    if (deleted == null || deleted == 0L) {
                        log.warn("Lock {} had already expired or changed owner on release", lockName);
                    } else {
                        log.debug("Released lock {}", lockName);
                    }
                })
                .then();
        }
    }
}
