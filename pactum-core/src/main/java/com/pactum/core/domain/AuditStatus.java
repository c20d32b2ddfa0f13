package com.pactum.core.domain;

/**
 * Outcome recorded by an audit entry.
 */
public enum AuditStatus {
    SENT("sent"),
    RECEIVED("received"),
    DENIED("denied"),
    ERROR("error"),
    EXPIRED("expired");

    private final String value;

    AuditStatus(String value) {
        this.value = value;
    }

    /**
     * Lower-case form used in the canonical entry hash.
     */
    public String value() {
        return value;
    }
}
