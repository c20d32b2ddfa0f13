package com.pactum.api.audit;

import com.pactum.core.domain.AuditAction;
import com.pactum.core.domain.AuditStatus;

import java.util.Map;
import java.util.UUID;

/**
 * Caller-supplied fields of an audit entry. Identity, timestamp and hashes are assigned on append.
 */
public record AuditSubmission(
        UUID contractId,
        UUID pinId,
        AuditAction action,
        AuditStatus status,
        String targetSystem,
        Map<String, Object> scope,
        Map<String, Object> metadata,
        String requestId
) {
    public static AuditSubmission of(AuditAction action, AuditStatus status, String targetSystem, String requestId) {
        return new AuditSubmission(null, null, action, status, targetSystem, null, null, requestId);
    }

    public AuditSubmission withContract(UUID value) {
        return new AuditSubmission(value, pinId, action, status, targetSystem, scope, metadata, requestId);
    }

    public AuditSubmission withPin(UUID value) {
        return new AuditSubmission(contractId, value, action, status, targetSystem, scope, metadata, requestId);
    }

    public AuditSubmission withScope(Map<String, Object> value) {
        return new AuditSubmission(contractId, pinId, action, status, targetSystem, value, metadata, requestId);
    }

    public AuditSubmission withMetadata(Map<String, Object> value) {
        return new AuditSubmission(contractId, pinId, action, status, targetSystem, scope, value, requestId);
    }
}
