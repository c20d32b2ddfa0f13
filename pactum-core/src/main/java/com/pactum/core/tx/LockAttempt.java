package com.pactum.core.tx;

/**
 * Result of a non-blocking lock attempt.
 */
public enum LockAttempt {
    ACQUIRED,
    BUSY
}
