package com.pactum.core.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Short-lived, scoped bearer credential issued under an active contract.
 * Only the HMAC signature is stored; the secret token exists solely in the credential handed to the holder.
 */
public record Pin(
        UUID id,
        UUID contractId,
        String agentId,
        Scope scope,
        String signature,
        Instant issuedAt,
        Instant expiresAt,
        Instant usedAt,
        boolean singleUse,
        boolean revoked,
        Instant revokedAt,
        String revocationReason
) {
    public Pin {
        Objects.requireNonNull(id, "ID cannot be null");
        Objects.requireNonNull(contractId, "Contract ID cannot be null");
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(signature, "Signature cannot be null");
        Objects.requireNonNull(issuedAt, "Issued at cannot be null");
        Objects.requireNonNull(expiresAt, "Expires at cannot be null");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("PIN must expire after it is issued");
        }
        if (usedAt != null && usedAt.isBefore(issuedAt)) {
            throw new IllegalArgumentException("PIN cannot be used before it is issued");
        }
        if (revoked != (revokedAt != null)) {
            throw new IllegalArgumentException("Revocation flag and timestamp must agree");
        }
    }

    public static Pin issue(
            UUID id,
            UUID contractId,
            String agentId,
            Scope scope,
            String signature,
            Instant issuedAt,
            Instant expiresAt,
            boolean singleUse) {
        return new Pin(id, contractId, agentId, scope, signature, issuedAt, expiresAt,
                null, singleUse, false, null, null);
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isUsed() {
        return usedAt != null;
    }

    public Pin markUsed(Instant now) {
        if (usedAt != null) {
            throw new IllegalStateException("PIN " + id + " already used");
        }
        return new Pin(id, contractId, agentId, scope, signature, issuedAt, expiresAt,
                now, singleUse, revoked, revokedAt, revocationReason);
    }

    public Pin revoke(String reason, Instant now) {
        if (revoked) {
            throw new IllegalStateException("PIN " + id + " already revoked");
        }
        return new Pin(id, contractId, agentId, scope, signature, issuedAt, expiresAt,
                usedAt, singleUse, true, now, reason);
    }
}
