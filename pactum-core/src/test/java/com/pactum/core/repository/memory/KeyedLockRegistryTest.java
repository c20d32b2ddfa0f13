package com.pactum.core.repository.memory;

import com.pactum.core.tx.LockKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class KeyedLockRegistryTest {

    private final KeyedLockRegistry registry = new KeyedLockRegistry();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tryAcquireFailsWhileAnotherThreadHoldsKey() throws Exception {
        LockKey key = LockKey.pin(UUID.randomUUID());
        KeyedLockRegistry.Handle held = registry.acquire(key);

        Future<Boolean> attempt = executor.submit(() -> registry.tryAcquire(key).isPresent());

        assertThat(attempt.get(5, TimeUnit.SECONDS)).isFalse();
        held.release();
        assertThat(registry.trackedKeys()).isZero();
    }

    @Test
    void differentKeysDoNotContend() throws Exception {
        KeyedLockRegistry.Handle held = registry.acquire(LockKey.pin(UUID.randomUUID()));

        Future<Boolean> attempt = executor.submit(() -> {
            Optional<KeyedLockRegistry.Handle> other = registry.tryAcquire(LockKey.pin(UUID.randomUUID()));
            other.ifPresent(KeyedLockRegistry.Handle::release);
            return other.isPresent();
        });

        assertThat(attempt.get(5, TimeUnit.SECONDS)).isTrue();
        held.release();
    }

    @Test
    void blockedAcquireProceedsAfterRelease() throws Exception {
        LockKey key = LockKey.contract(UUID.randomUUID());
        KeyedLockRegistry.Handle held = registry.acquire(key);
        CountDownLatch started = new CountDownLatch(1);

        Future<?> waiter = executor.submit(() -> {
            started.countDown();
            registry.acquire(key).release();
        });
        started.await(5, TimeUnit.SECONDS);
        held.release();

        waiter.get(5, TimeUnit.SECONDS);
        assertThat(registry.trackedKeys()).isZero();
    }

    @Test
    void releaseIsIdempotent() {
        KeyedLockRegistry.Handle held = registry.acquire(LockKey.auditChain("agent-a"));

        held.release();
        held.release();

        assertThat(registry.trackedKeys()).isZero();
    }
}
