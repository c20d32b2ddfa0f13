package com.pactum.core.domain;

/**
 * What kind of step an audit entry records.
 */
public enum AuditAction {
    REQUEST("request"),
    RESPONSE("response"),
    ERROR("error"),
    VALIDATION("validation"),
    REVOCATION("revocation");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    /**
     * Lower-case form used in the canonical entry hash.
     */
    public String value() {
        return value;
    }
}
