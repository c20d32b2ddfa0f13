package com.pactum.core.repository.memory;

import com.pactum.core.tx.LockAttempt;
import com.pactum.core.tx.LockKey;
import com.pactum.core.tx.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Transaction handle of {@link InMemoryTransactionManager}.
 * Writes are buffered until commit; reads see committed state only.
 */
final class InMemoryTransaction implements Transaction {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransaction.class);

    private final InMemoryTransactionManager manager;
    private final Deque<KeyedLockRegistry.Handle> heldLocks = new ArrayDeque<>();
    private final List<Runnable> stagedWrites = new ArrayList<>();
    private boolean committed;
    private boolean closed;

    InMemoryTransaction(InMemoryTransactionManager manager) {
        this.manager = manager;
    }

    static InMemoryTransaction from(Transaction tx) {
        if (!(tx instanceof InMemoryTransaction inMemory)) {
            throw new IllegalArgumentException("Transaction does not belong to the in-memory store");
        }
        inMemory.requireOpen();
        return inMemory;
    }

    @Override
    public void lockBlocking(LockKey key) {
        requireActive();
        heldLocks.push(manager.locks().acquire(key));
    }

    @Override
    public LockAttempt tryLock(LockKey key) {
        requireActive();
        return manager.locks().tryAcquire(key)
                .map(handle -> {
                    heldLocks.push(handle);
                    return LockAttempt.ACQUIRED;
                })
                .orElse(LockAttempt.BUSY);
    }

    void stage(Runnable write) {
        requireActive();
        stagedWrites.add(write);
    }

    @Override
    public void commit() {
        requireActive();
        manager.applyAtomically(stagedWrites);
        stagedWrites.clear();
        committed = true;
    }

    @Override
    public boolean isActive() {
        return !closed && !committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!committed && !stagedWrites.isEmpty()) {
            log.debug("Discarding {} uncommitted writes", stagedWrites.size());
        }
        stagedWrites.clear();
        while (!heldLocks.isEmpty()) {
            heldLocks.pop().release();
        }
    }

    private void requireActive() {
        if (!isActive()) {
            throw new IllegalStateException("Transaction is no longer active");
        }
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is closed");
        }
    }
}
