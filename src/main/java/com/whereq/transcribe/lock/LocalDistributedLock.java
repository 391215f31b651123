package com.whereq.transcribe.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lock for the memory store. Only excludes ticks running in the same JVM.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "transcribe.store", name = "type", havingValue = "MEMORY")
public class LocalDistributedLock implements DistributedLock {

    static final Duration RETRY_INTERVAL = Duration.ofMillis(20);

    private final Map<String, String> holders = new ConcurrentHashMap<>();

    @Override
    public Mono<LockHandle> tryAcquire(String lockName, Duration timeout) {
        String token = UUID.randomUUID().toString();

        return Mono.fromSupplier(() -> holders.putIfAbsent(lockName, token) == null)
            .filter(Boolean::booleanValue)
            .repeatWhenEmpty(attempts -> attempts.delayElements(RETRY_INTERVAL))
            .timeout(timeout, Mono.empty())
            .map(acquired -> (LockHandle) new LocalLockHandle(lockName, token))
            .doOnNext(handle -> log.debug("Acquired lock {}", lockName));
    }

    public boolean isHeld(String lockName) {
        return holders.containsKey(lockName);
    }

    private class LocalLockHandle implements LockHandle {
        private final String lockName;
        private final String token;

        LocalLockHandle(String lockName, String token) {
            this.lockName = lockName;
            this.token = token;
        }

        @Override
        public String lockName() {
            return lockName;
        }

        @Override
        public Mono<Void> release() {
            return Mono.fromRunnable(() -> {
                if (!holders.remove(lockName, token)) {
                    log.warn("Lock {} was not held by this handle on release", lockName);
                }
            });
        }
    }
}
