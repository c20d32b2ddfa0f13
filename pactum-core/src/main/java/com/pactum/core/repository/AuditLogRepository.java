package com.pactum.core.repository;

import com.pactum.core.domain.AuditLogEntry;
import com.pactum.core.tx.Transaction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of audit entries. Chain order for an agent is timestamp order,
 * with commit order breaking ties.
 */
public interface AuditLogRepository {

    Optional<AuditLogEntry> findById(Transaction tx, UUID entryId);

    /**
     * The tip of the agent's chain.
     */
    Optional<AuditLogEntry> findLatestByAgent(Transaction tx, String agentId);

    /**
     * The last entry of the agent's chain strictly before {@code before}.
     */
    Optional<AuditLogEntry> findLatestByAgentBefore(Transaction tx, String agentId, Instant before);

    /**
     * The agent's entries in chain order, optionally bounded (inclusive) by {@code from} and {@code to}.
     */
    List<AuditLogEntry> findByAgentInChainOrder(Transaction tx, String agentId, Instant from, Instant to);

    AuditLogPage query(Transaction tx, AuditLogQuery query);

    void append(Transaction tx, AuditLogEntry entry);
}
