package com.pactum.core.repository.memory;

import com.pactum.core.tx.LockKey;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key mutex map for a single-process store.
 * Slots are reference counted and dropped once no thread holds or waits for them.
 */
public class KeyedLockRegistry {

    private final ConcurrentHashMap<LockKey, Slot> slots = new ConcurrentHashMap<>();

    /**
     * Blocks until the lock for {@code key} is held by the calling thread.
     */
    public Handle acquire(LockKey key) {
        Slot slot = retain(key);
        slot.lock.lock();
        return new Handle(key, slot);
    }

    /**
     * Takes the lock for {@code key} only if it is free right now.
     */
    public Optional<Handle> tryAcquire(LockKey key) {
        Slot slot = retain(key);
        if (slot.lock.tryLock()) {
            return Optional.of(new Handle(key, slot));
        }
        releaseSlot(key);
        return Optional.empty();
    }

    /**
     * Number of keys currently held or waited on.
     */
    public int trackedKeys() {
        return slots.size();
    }

    private Slot retain(LockKey key) {
        return slots.compute(key, (k, existing) -> {
            Slot slot = existing != null ? existing : new Slot();
            slot.references++;
            return slot;
        });
    }

    private void releaseSlot(LockKey key) {
        slots.computeIfPresent(key, (k, slot) -> --slot.references == 0 ? null : slot);
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int references;
    }

    /**
     * A held lock. Must be released by the thread that acquired it.
     */
    public final class Handle {
        private final LockKey key;
        private final Slot slot;
        private boolean released;

        private Handle(LockKey key, Slot slot) {
            this.key = key;
            this.slot = slot;
        }

        public LockKey key() {
            return key;
        }

        public void release() {
            if (released) {
                return;
            }
            released = true;
            slot.lock.unlock();
            releaseSlot(key);
        }
    }
}
