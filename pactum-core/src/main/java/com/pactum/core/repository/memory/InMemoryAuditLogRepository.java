package com.pactum.core.repository.memory;

import com.pactum.core.domain.AuditLogEntry;
import com.pactum.core.repository.AuditLogPage;
import com.pactum.core.repository.AuditLogQuery;
import com.pactum.core.repository.AuditLogRepository;
import com.pactum.core.tx.Transaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only audit store. Keeps every entry in commit order, plus a per-agent chain and an id index.
 * Chains are returned in commit order, never re-sorted, so a rewritten timestamp cannot move an entry.
 */
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private static final Comparator<AuditLogEntry> BY_TIMESTAMP = Comparator.comparing(AuditLogEntry::timestamp);

    private final InMemoryTransactionManager manager;
    private final List<AuditLogEntry> entries = new ArrayList<>();
    private final Map<String, List<AuditLogEntry>> chains = new HashMap<>();
    private final Map<UUID, AuditLogEntry> byId = new HashMap<>();

    public InMemoryAuditLogRepository(InMemoryTransactionManager manager) {
        this.manager = manager;
    }

    @Override
    public Optional<AuditLogEntry> findById(Transaction tx, UUID entryId) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> Optional.ofNullable(byId.get(entryId)));
    }

    @Override
    public Optional<AuditLogEntry> findLatestByAgent(Transaction tx, String agentId) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> {
            List<AuditLogEntry> chain = chainOf(agentId);
            return chain.isEmpty() ? Optional.empty() : Optional.of(chain.get(chain.size() - 1));
        });
    }

    @Override
    public Optional<AuditLogEntry> findLatestByAgentBefore(Transaction tx, String agentId, Instant before) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> {
            AuditLogEntry latest = null;
            for (AuditLogEntry entry : chainOf(agentId)) {
                if (!entry.timestamp().isBefore(before)) {
                    break;
                }
                latest = entry;
            }
            return Optional.ofNullable(latest);
        });
    }

    @Override
    public List<AuditLogEntry> findByAgentInChainOrder(Transaction tx, String agentId, Instant from, Instant to) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> chainOf(agentId).stream()
                .filter(e -> from == null || !e.timestamp().isBefore(from))
                .filter(e -> to == null || !e.timestamp().isAfter(to))
                .collect(Collectors.toList()));
    }

    @Override
    public AuditLogPage query(Transaction tx, AuditLogQuery query) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> {
            List<AuditLogEntry> matches = entries.stream()
                    .filter(query::matches)
                    .collect(Collectors.toCollection(ArrayList::new));
            // newest first; sort is stable, so among equal timestamps the later commit comes first
            Collections.reverse(matches);
            matches.sort(BY_TIMESTAMP.reversed());
            int from = Math.min(query.offset(), matches.size());
            int to = Math.min(from + query.limit(), matches.size());
            return new AuditLogPage(matches.subList(from, to), matches.size(), query.limit(), query.offset());
        });
    }

    @Override
    public void append(Transaction tx, AuditLogEntry entry) {
        InMemoryTransaction.from(tx).stage(() -> {
            if (byId.containsKey(entry.id())) {
                throw new IllegalStateException("Audit entry " + entry.id() + " already exists");
            }
            entries.add(entry);
            chains.computeIfAbsent(entry.agentId(), k -> new ArrayList<>()).add(entry);
            byId.put(entry.id(), entry);
        });
    }

    /**
     * Replaces a stored entry outside any transaction. Exists to simulate storage tampering
     * in verification drills; the protocol itself never rewrites entries.
     */
    public void overwrite(AuditLogEntry tampered) {
        manager.applyAtomically(List.of(() -> {
            AuditLogEntry original = byId.get(tampered.id());
            if (original == null) {
                throw new IllegalArgumentException("Unknown audit entry " + tampered.id());
            }
            replace(entries, original, tampered);
            replace(chains.get(original.agentId()), original, tampered);
            byId.put(tampered.id(), tampered);
        }));
    }

    private List<AuditLogEntry> chainOf(String agentId) {
        return new ArrayList<>(chains.getOrDefault(agentId, List.of()));
    }

    private static void replace(List<AuditLogEntry> list, AuditLogEntry original, AuditLogEntry replacement) {
        int index = list.indexOf(original);
        if (index >= 0) {
            list.set(index, replacement);
        }
    }
}
