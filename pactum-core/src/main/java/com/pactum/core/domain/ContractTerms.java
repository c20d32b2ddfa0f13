package com.pactum.core.domain;

import java.time.Instant;
import java.util.Set;

/**
 * The immutable terms both parties sign.
 *
 * @param dataTypes       data types covered by the contract
 * @param allowedActions  actions the contract permits
 * @param purpose         business purpose, required
 * @param retentionDays   retention period in days, {@code null} for unbounded
 * @param geographicScope region codes the data may be processed in
 * @param expiresAt       contract expiry, {@code null} for none
 */
public record ContractTerms(
        Set<String> dataTypes,
        Set<String> allowedActions,
        String purpose,
        Integer retentionDays,
        Set<String> geographicScope,
        Instant expiresAt
) {
    public ContractTerms {
        dataTypes = Scope.sortedCopy(dataTypes);
        allowedActions = Scope.sortedCopy(allowedActions);
        geographicScope = Scope.sortedCopy(geographicScope);
    }

    /**
     * True when a data type, action or region code is null or blank.
     */
    public boolean hasBlankEntries() {
        return Scope.hasBlankEntry(dataTypes) || Scope.hasBlankEntry(allowedActions)
                || Scope.hasBlankEntry(geographicScope);
    }

    public Scope scope() {
        return new Scope(dataTypes, allowedActions);
    }
}
