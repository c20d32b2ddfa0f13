package com.pactum.core.tx;

import java.util.Objects;
import java.util.UUID;

/**
 * Names the row or advisory lock a critical section serializes on.
 * Keys in different namespaces never contend.
 */
public record LockKey(String namespace, String id) {

    public LockKey {
        Objects.requireNonNull(namespace, "Namespace cannot be null");
        Objects.requireNonNull(id, "ID cannot be null");
    }

    public static LockKey contract(UUID contractId) {
        return new LockKey("contract", contractId.toString());
    }

    public static LockKey pin(UUID pinId) {
        return new LockKey("pin", pinId.toString());
    }

    /**
     * Advisory key guarding the tip of one agent's audit chain.
     */
    public static LockKey auditChain(String agentId) {
        return new LockKey("audit-chain", agentId);
    }

    @Override
    public String toString() {
        return namespace + ":" + id;
    }
}
