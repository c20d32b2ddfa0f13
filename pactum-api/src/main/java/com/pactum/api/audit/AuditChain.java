package com.pactum.api.audit;

import com.pactum.api.config.ProtocolSettings;
import com.pactum.api.crypto.CanonicalJson;
import com.pactum.core.domain.AuditLogEntry;
import com.pactum.core.repository.AuditLogPage;
import com.pactum.core.repository.AuditLogQuery;
import com.pactum.core.repository.AuditLogRepository;
import com.pactum.core.result.ErrorKind;
import com.pactum.core.result.ProtocolResult;
import com.pactum.core.tx.LockKey;
import com.pactum.core.tx.Transaction;
import com.pactum.core.tx.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-agent hash-chained audit log.
 * <p>
 * Appends for one agent are serialized on a blocking per-agent lock, so commit order is chain order.
 * Chains of different agents never contend. Queries and verification read committed state without locks.
 */
public class AuditChain {

    private static final Logger log = LoggerFactory.getLogger(AuditChain.class);

    /**
     * {@code prevHash} of an agent's first entry.
     */
    public static final String GENESIS_HASH = "0".repeat(64);

    private final TransactionManager transactions;
    private final AuditLogRepository entries;
    private final Clock clock;
    private final int defaultPageSize;
    private final int maxPageSize;

    public AuditChain(
            TransactionManager transactions,
            AuditLogRepository entries,
            Clock clock,
            ProtocolSettings settings) {
        this.transactions = Objects.requireNonNull(transactions, "Transaction manager cannot be null");
        this.entries = Objects.requireNonNull(entries, "Audit repository cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        Objects.requireNonNull(settings, "Settings cannot be null");
        this.defaultPageSize = settings.defaultPageSize();
        this.maxPageSize = settings.maxPageSize();
    }

    /**
     * Appends an entry to {@code agentId}'s chain, linked to the current tip.
     */
    public ProtocolResult<AuditLogEntry> append(String agentId, AuditSubmission submission) {
        if (agentId == null || agentId.isBlank()) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Agent ID is required");
        }
        if (submission == null || submission.action() == null || submission.status() == null) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Action and status are required");
        }
        if (isBlank(submission.targetSystem()) || isBlank(submission.requestId())) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Target system and request ID are required");
        }

        try (Transaction tx = transactions.begin()) {
            tx.lockBlocking(LockKey.auditChain(agentId));

            AuditLogEntry tip = entries.findLatestByAgent(tx, agentId).orElse(null);
            String prevHash = tip != null ? tip.entryHash() : GENESIS_HASH;

            // never earlier than the tip, so timestamp order stays chain order
            Instant timestamp = now();
            if (tip != null && timestamp.isBefore(tip.timestamp())) {
                timestamp = tip.timestamp();
            }

            AuditLogEntry unhashed = new AuditLogEntry(
                    UUID.randomUUID(),
                    timestamp,
                    submission.contractId(),
                    submission.pinId(),
                    agentId,
                    submission.action(),
                    submission.status(),
                    submission.targetSystem(),
                    submission.scope(),
                    submission.metadata(),
                    agentId,
                    submission.requestId(),
                    prevHash,
                    "");
            AuditLogEntry entry = withEntryHash(unhashed, computeEntryHash(unhashed));

            entries.append(tx, entry);
            tx.commit();

            log.debug("Appended audit entry {} to chain of {}", entry.id(), agentId);
            return ProtocolResult.ok(entry);
        }
    }

    /**
     * A query for the first page at the configured page size, to be narrowed with the {@code with*} methods.
     */
    public AuditLogQuery newQuery() {
        return AuditLogQuery.page(defaultPageSize, 0);
    }

    /**
     * Filtered search across all chains, newest first.
     */
    public ProtocolResult<AuditLogPage> query(AuditLogQuery query) {
        if (query == null) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Query is required");
        }
        if (query.limit() < 1 || query.limit() > maxPageSize) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Limit must be between 1 and " + maxPageSize);
        }
        if (query.offset() < 0) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Offset cannot be negative");
        }
        if (query.from() != null && query.to() != null && query.from().isAfter(query.to())) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Time range start is after its end");
        }
        try (Transaction tx = transactions.begin()) {
            return ProtocolResult.ok(entries.query(tx, query));
        }
    }

    public ProtocolResult<ChainVerification> verify(String agentId) {
        return verify(agentId, null, null);
    }

    /**
     * Walks {@code agentId}'s chain in append order, optionally limited to {@code [from, to]}, and
     * reports the first entry whose link, timestamp order or hash does not check out. An empty chain is valid.
     */
    public ProtocolResult<ChainVerification> verify(String agentId, Instant from, Instant to) {
        if (agentId == null || agentId.isBlank()) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Agent ID is required");
        }
        if (from != null && to != null && from.isAfter(to)) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Time range start is after its end");
        }

        List<AuditLogEntry> chain;
        String expectedPrev;
        try (Transaction tx = transactions.begin()) {
            chain = entries.findByAgentInChainOrder(tx, agentId, from, to);
            expectedPrev = from == null
                    ? GENESIS_HASH
                    : entries.findLatestByAgentBefore(tx, agentId, from)
                            .map(AuditLogEntry::entryHash)
                            .orElse(GENESIS_HASH);
        }

        int checked = 0;
        Instant previousTimestamp = null;
        for (AuditLogEntry entry : chain) {
            checked++;
            ChainCheck failed = null;
            if (!expectedPrev.equals(entry.prevHash())) {
                failed = ChainCheck.PREV_HASH_LINK;
            } else if (previousTimestamp != null && entry.timestamp().isBefore(previousTimestamp)) {
                failed = ChainCheck.TIMESTAMP_ORDER;
            } else if (!computeEntryHash(entry).equals(entry.entryHash())) {
                failed = ChainCheck.ENTRY_HASH;
            }
            if (failed != null) {
                log.error("Audit chain of {} broken at entry {} ({} check failed)", agentId, entry.id(), failed);
                return ProtocolResult.ok(ChainVerification.broken(agentId, checked, entry.id(), failed));
            }
            expectedPrev = entry.entryHash();
            previousTimestamp = entry.timestamp();
        }
        return ProtocolResult.ok(ChainVerification.intact(agentId, checked));
    }

    public ProtocolResult<AuditLogEntry> getEntry(UUID entryId) {
        try (Transaction tx = transactions.begin()) {
            return entries.findById(tx, entryId)
                    .map(ProtocolResult::ok)
                    .orElseGet(() -> ProtocolResult.failure(ErrorKind.NOT_FOUND, "Audit entry not found: " + entryId));
        }
    }

    /**
     * SHA-256 over the canonical JSON of every field except {@code entryHash}.
     */
    public static String computeEntryHash(AuditLogEntry entry) {
        // HashMap: absent references hash as null
        Map<String, Object> content = new HashMap<>();
        content.put("log_id", entry.id().toString());
        content.put("timestamp", CanonicalJson.timestamp(entry.timestamp()));
        content.put("contract_id", entry.contractId() != null ? entry.contractId().toString() : null);
        content.put("pin_id", entry.pinId() != null ? entry.pinId().toString() : null);
        content.put("agent_id", entry.agentId());
        content.put("action", entry.action().value());
        content.put("status", entry.status().value());
        content.put("target_system", entry.targetSystem());
        content.put("scope", entry.scope());
        content.put("metadata", entry.metadata());
        content.put("source", entry.source());
        content.put("request_id", entry.requestId());
        content.put("prev_hash", entry.prevHash());
        return CanonicalJson.sha256Hex(content);
    }

    private static AuditLogEntry withEntryHash(AuditLogEntry entry, String entryHash) {
        return new AuditLogEntry(entry.id(), entry.timestamp(), entry.contractId(), entry.pinId(),
                entry.agentId(), entry.action(), entry.status(), entry.targetSystem(), entry.scope(),
                entry.metadata(), entry.source(), entry.requestId(), entry.prevHash(), entryHash);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
