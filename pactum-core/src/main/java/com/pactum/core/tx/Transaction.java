package com.pactum.core.tx;

/**
 * Handle on one unit of work against the store.
 * <p>
 * Writes staged through a repository become visible to other transactions atomically on
 * {@link #commit()}. {@link #close()} releases every lock the transaction took, on every exit
 * path, and discards writes that were never committed. Use with try-with-resources.
 * <p>
 * A transaction is confined to the thread that began it.
 */
public interface Transaction extends AutoCloseable {

    /**
     * Takes an exclusive lock on {@code key}, waiting for the current holder to finish.
     */
    void lockBlocking(LockKey key);

    /**
     * Takes an exclusive lock on {@code key} only if nobody holds it.
     */
    LockAttempt tryLock(LockKey key);

    void commit();

    boolean isActive();

    @Override
    void close();
}
