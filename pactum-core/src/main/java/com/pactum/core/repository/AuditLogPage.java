package com.pactum.core.repository;

import com.pactum.core.domain.AuditLogEntry;

import java.util.List;

/**
 * One page of audit entries, newest first, plus the total number of matches.
 */
public record AuditLogPage(List<AuditLogEntry> entries, long total, int limit, int offset) {

    public AuditLogPage {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }
}
