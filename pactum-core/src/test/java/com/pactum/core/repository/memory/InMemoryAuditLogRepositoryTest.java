package com.pactum.core.repository.memory;

import com.pactum.core.domain.AuditAction;
import com.pactum.core.domain.AuditLogEntry;
import com.pactum.core.domain.AuditStatus;
import com.pactum.core.repository.AuditLogPage;
import com.pactum.core.repository.AuditLogQuery;
import com.pactum.core.tx.Transaction;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class InMemoryAuditLogRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final InMemoryTransactionManager manager = new InMemoryTransactionManager();
    private final InMemoryAuditLogRepository repository = new InMemoryAuditLogRepository(manager);

    @Test
    void chainOrderKeepsCommitOrderOnTimestampTies() {
        AuditLogEntry first = append("agent-a", T0, AuditAction.REQUEST);
        AuditLogEntry second = append("agent-a", T0, AuditAction.RESPONSE);
        append("agent-b", T0, AuditAction.REQUEST);

        try (Transaction tx = manager.begin()) {
            assertThat(repository.findByAgentInChainOrder(tx, "agent-a", null, null))
                    .containsExactly(first, second);
            assertThat(repository.findLatestByAgent(tx, "agent-a")).contains(second);
        }
    }

    @Test
    void chainIsNotReorderedByTimestamp() {
        AuditLogEntry first = append("agent-a", T0.plusSeconds(5), AuditAction.REQUEST);
        AuditLogEntry second = append("agent-a", T0, AuditAction.RESPONSE);

        try (Transaction tx = manager.begin()) {
            assertThat(repository.findByAgentInChainOrder(tx, "agent-a", null, null))
                    .containsExactly(first, second);
            assertThat(repository.findLatestByAgent(tx, "agent-a")).contains(second);
        }
    }

    @Test
    void latestBeforeIsStrict() {
        AuditLogEntry early = append("agent-a", T0, AuditAction.REQUEST);
        append("agent-a", T0.plusSeconds(10), AuditAction.RESPONSE);

        try (Transaction tx = manager.begin()) {
            assertThat(repository.findLatestByAgentBefore(tx, "agent-a", T0.plusSeconds(10))).contains(early);
            assertThat(repository.findLatestByAgentBefore(tx, "agent-a", T0)).isEmpty();
        }
    }

    @Test
    void queryPagesNewestFirstWithTotal() {
        for (int i = 0; i < 5; i++) {
            append("agent-a", T0.plusSeconds(i), AuditAction.REQUEST);
        }
        append("agent-a", T0.plusSeconds(9), AuditAction.ERROR);

        try (Transaction tx = manager.begin()) {
            AuditLogPage page = repository.query(tx,
                    AuditLogQuery.page(2, 1).withAction(AuditAction.REQUEST));

            assertThat(page.total()).isEqualTo(5);
            assertThat(page.entries()).extracting(AuditLogEntry::timestamp)
                    .containsExactly(T0.plusSeconds(3), T0.plusSeconds(2));
        }
    }

    @Test
    void offsetPastEndYieldsEmptyPage() {
        append("agent-a", T0, AuditAction.REQUEST);

        try (Transaction tx = manager.begin()) {
            AuditLogPage page = repository.query(tx, AuditLogQuery.page(10, 5));
            assertThat(page.entries()).isEmpty();
            assertThat(page.total()).isEqualTo(1);
        }
    }

    @Test
    void overwriteReplacesEntryEverywhere() {
        AuditLogEntry original = append("agent-a", T0, AuditAction.REQUEST);
        AuditLogEntry tampered = new AuditLogEntry(original.id(), original.timestamp(), null, null,
                "agent-a", AuditAction.REQUEST, AuditStatus.DENIED, null, Map.of(), Map.of(),
                "agent-a", null, original.prevHash(), original.entryHash());

        repository.overwrite(tampered);

        try (Transaction tx = manager.begin()) {
            assertThat(repository.findById(tx, original.id())).contains(tampered);
            assertThat(repository.findByAgentInChainOrder(tx, "agent-a", null, null)).containsExactly(tampered);
        }
    }

    private AuditLogEntry append(String agentId, Instant at, AuditAction action) {
        AuditLogEntry entry = new AuditLogEntry(UUID.randomUUID(), at, null, null, agentId, action,
                AuditStatus.SENT, "target", Map.of(), Map.of(), agentId, null,
                "0".repeat(64), UUID.randomUUID().toString());
        try (Transaction tx = manager.begin()) {
            repository.append(tx, entry);
            tx.commit();
        }
        return entry;
    }
}
