package com.pactum.core.result;

/**
 * Kinds of rejection a protocol operation can return.
 * Only {@link #LOCK_CONTENTION} is worth retrying; {@link #CHAIN_BROKEN}
 * signals tampering or corruption and is handled as an incident.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_STATE,
    FORBIDDEN,
    CONFLICT,
    INVALID_SIGNATURE,
    SCOPE_EXCEEDED,
    EXPIRED,
    ALREADY_USED,
    LOCK_CONTENTION,
    CHAIN_BROKEN,
    INVALID_REQUEST;

    /**
     * Stable code for transports to map onto their own status values.
     */
    public String code() {
        return name();
    }

    public boolean isRetryable() {
        return this == LOCK_CONTENTION;
    }

    public boolean isIncident() {
        return this == CHAIN_BROKEN;
    }
}
