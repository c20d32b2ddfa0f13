package com.pactum.core.repository.memory;

import com.pactum.core.tx.Transaction;
import com.pactum.core.tx.TransactionManager;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Transactions over the in-memory repositories of one process.
 * Commits apply their staged writes under an exclusive commit lock, so readers always see
 * whole transactions. Multi-instance deployments need a store with native row locking instead.
 */
public class InMemoryTransactionManager implements TransactionManager {

    private final KeyedLockRegistry locks;
    private final ReentrantReadWriteLock commitLock = new ReentrantReadWriteLock();

    public InMemoryTransactionManager() {
        this(new KeyedLockRegistry());
    }

    public InMemoryTransactionManager(KeyedLockRegistry locks) {
        if (locks == null) {
            throw new IllegalArgumentException("Lock registry cannot be null");
        }
        this.locks = locks;
    }

    @Override
    public Transaction begin() {
        return new InMemoryTransaction(this);
    }

    public KeyedLockRegistry locks() {
        return locks;
    }

    <T> T readCommitted(Supplier<T> reader) {
        commitLock.readLock().lock();
        try {
            return reader.get();
        } finally {
            commitLock.readLock().unlock();
        }
    }

    void applyAtomically(List<Runnable> writes) {
        commitLock.writeLock().lock();
        try {
            writes.forEach(Runnable::run);
        } finally {
            commitLock.writeLock().unlock();
        }
    }
}
