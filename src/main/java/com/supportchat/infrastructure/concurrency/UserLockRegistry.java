package com.supportchat.infrastructure.concurrency;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.supportchat.application.exceptions.UserContextBusyException;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per user id, so that updates for one user run strictly one
 * after another while different users proceed in parallel.
 *
 * <p>Locks live in a Caffeine cache with weak values: a lock stays in the
 * registry while any thread holds or waits on it and is reclaimed once idle,
 * so the registry does not grow with the number of users ever seen.
 */
@Slf4j
public class UserLockRegistry {

    private final LoadingCache<String, ReentrantLock> locks;
    private final Duration timeout;

    public UserLockRegistry(Duration timeout) {
        this.timeout = timeout;
        this.locks = Caffeine.newBuilder()
            .weakValues()
            .build(userId -> new ReentrantLock(true));
    }

    /**
     * Run {@code operation} while holding the user's lock.
     *
     * @throws UserContextBusyException if the lock is not acquired within the timeout
     */
    public <T> T executeWithLock(String userId, LockOperation<T> operation) {
        ReentrantLock lock = locks.get(userId);
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UserContextBusyException("Interrupted while waiting for user context", e);
        }
        if (!acquired) {
            log.warn("User context lock not acquired within {}: userId={}", timeout, Encode.forJava(userId));
            throw new UserContextBusyException("User context is busy, try again later");
        }
        try {
            log.debug("Lock acquired: userId={}", Encode.forJava(userId));
            return operation.execute();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of locks currently retained, for diagnostics.
     */
    public long size() {
        locks.cleanUp();
        return locks.estimatedSize();
    }

    @FunctionalInterface
    public interface LockOperation<T> {
        T execute();
    }
}
