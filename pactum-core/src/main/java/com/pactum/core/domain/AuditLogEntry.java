package com.pactum.core.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One link in an agent's hash chain. Immutable and append-only.
 *
 * @param id           entry identifier
 * @param timestamp    server time the entry was appended
 * @param contractId   optional contract reference
 * @param pinId        optional PIN reference
 * @param agentId      chain owner (author)
 * @param action       kind of step recorded
 * @param status       outcome recorded
 * @param targetSystem counterparty of the step
 * @param scope        author-supplied scope detail
 * @param metadata     author-supplied context
 * @param source       author's own agent id
 * @param requestId    correlates the two sides of one transaction
 * @param prevHash     entry hash of the author's previous entry, or the genesis constant
 * @param entryHash    digest over every other field
 */
public record AuditLogEntry(
        UUID id,
        Instant timestamp,
        UUID contractId,
        UUID pinId,
        String agentId,
        AuditAction action,
        AuditStatus status,
        String targetSystem,
        Map<String, Object> scope,
        Map<String, Object> metadata,
        String source,
        String requestId,
        String prevHash,
        String entryHash
) {
    public AuditLogEntry {
        Objects.requireNonNull(id, "ID cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(prevHash, "Previous hash cannot be null");
        Objects.requireNonNull(entryHash, "Entry hash cannot be null");
        scope = unmodifiableCopy(scope);
        metadata = unmodifiableCopy(metadata);
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> copy = (Map<String, Object>) deepCopy(map);
        return copy;
    }

    /**
     * Copies nested maps and collections all the way down, so the stored entry shares no
     * mutable state with the caller. LinkedHashMap and ArrayList keep null values, which the
     * {@code copyOf} factories reject.
     */
    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(v -> copy.add(deepCopy(v)));
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(deepCopy(v)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            return deepCopy(Arrays.asList(array));
        }
        return value;
    }
}
