package com.pactum.core.repository;

import com.pactum.core.domain.AuditAction;
import com.pactum.core.domain.AuditLogEntry;
import com.pactum.core.domain.AuditStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Filters and page window for audit log searches. {@code null} filters match everything.
 */
public record AuditLogQuery(
        UUID contractId,
        String agentId,
        AuditAction action,
        AuditStatus status,
        Instant from,
        Instant to,
        int limit,
        int offset
) {
    public static AuditLogQuery page(int limit, int offset) {
        return new AuditLogQuery(null, null, null, null, null, null, limit, offset);
    }

    public AuditLogQuery withContractId(UUID value) {
        return new AuditLogQuery(value, agentId, action, status, from, to, limit, offset);
    }

    public AuditLogQuery withAgentId(String value) {
        return new AuditLogQuery(contractId, value, action, status, from, to, limit, offset);
    }

    public AuditLogQuery withAction(AuditAction value) {
        return new AuditLogQuery(contractId, agentId, value, status, from, to, limit, offset);
    }

    public AuditLogQuery withStatus(AuditStatus value) {
        return new AuditLogQuery(contractId, agentId, action, value, from, to, limit, offset);
    }

    public AuditLogQuery withTimeRange(Instant start, Instant end) {
        return new AuditLogQuery(contractId, agentId, action, status, start, end, limit, offset);
    }

    public boolean matches(AuditLogEntry entry) {
        return (contractId == null || contractId.equals(entry.contractId()))
                && (agentId == null || agentId.equals(entry.agentId()))
                && (action == null || action == entry.action())
                && (status == null || status == entry.status())
                && (from == null || !entry.timestamp().isBefore(from))
                && (to == null || !entry.timestamp().isAfter(to));
    }
}
