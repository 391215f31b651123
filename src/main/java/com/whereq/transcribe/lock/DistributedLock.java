package com.whereq.transcribe.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Named, timeout-bounded exclusive lock shared by independent drain ticks.
 */
public interface DistributedLock {

    /**
     * Try to acquire a lock with the given name.
     *
     * @param lockName unique name for the lock
     * @param timeout maximum time to wait for the lock
     * @return Mono with a lock handle, empty if the lock was not acquired in time
     */
    Mono<LockHandle> tryAcquire(String lockName, Duration timeout);

    /**
     * Execute a task while holding a lock.
     * <p>
     * The lock is released when the task completes, fails or is cancelled.
     * If the lock cannot be acquired within the timeout the task is not run
     * and the returned Mono is empty.
     *
     * @param lockName unique name for the lock
     * @param timeout maximum time to wait for the lock
     * @param task the task to execute while holding the lock
     * @return the task result, empty if the lock was not acquired
     */
    default <T> Mono<T> withLock(String lockName, Duration timeout, Supplier<Mono<T>> task) {
        return Mono.usingWhen(
            tryAcquire(lockName, timeout),
            handle -> task.get(),
            LockHandle::release);
    }

    /**
     * Handle to a held lock.
     */
    interface LockHandle {
        String lockName();

        Mono<Void> release();
    }
}
