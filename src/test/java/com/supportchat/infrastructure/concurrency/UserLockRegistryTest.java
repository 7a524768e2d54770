package com.supportchat.infrastructure.concurrency;

import com.supportchat.application.exceptions.UserContextBusyException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UserLockRegistryTest {

    @Test
    void returnsOperationResult() {
        UserLockRegistry registry = new UserLockRegistry(Duration.ofSeconds(1));

        assertEquals("done", registry.executeWithLock("u1", () -> "done"));
    }

    @Test
    void releasesLockWhenOperationThrows() {
        UserLockRegistry registry = new UserLockRegistry(Duration.ofMillis(100));

        assertThrows(IllegalStateException.class, () -> registry.executeWithLock("u1", () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, registry.executeWithLock("u1", () -> 1));
    }

    @Test
    void sameUserNeverRunsConcurrently() throws Exception {
        UserLockRegistry registry = new UserLockRegistry(Duration.ofSeconds(10));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[64];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> registry.executeWithLock("u1", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    Thread.yield();
                    inside.decrementAndGet();
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInside.get());
    }

    @Test
    void differentUsersDoNotBlockEachOther() throws Exception {
        UserLockRegistry registry = new UserLockRegistry(Duration.ofMillis(200));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> registry.executeWithLock("u1", () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        try {
            assertTrue(held.await(5, TimeUnit.SECONDS));
            assertEquals("other", registry.executeWithLock("u2", () -> "other"));
            assertThrows(UserContextBusyException.class, () -> registry.executeWithLock("u1", () -> "late"));
        } finally {
            release.countDown();
            holder.join(5000);
        }
    }
}
