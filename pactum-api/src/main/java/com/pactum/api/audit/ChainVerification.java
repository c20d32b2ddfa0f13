package com.pactum.api.audit;

import com.pactum.core.result.ErrorKind;
import com.pactum.core.result.ProtocolError;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of verifying one agent's chain.
 *
 * @param agentId        chain owner
 * @param valid          true when every checked entry passed both checks
 * @param entriesChecked entries examined before stopping
 * @param brokenEntryId  first failing entry, {@code null} when valid
 * @param failedCheck    which check failed on that entry, {@code null} when valid
 */
public record ChainVerification(
        String agentId,
        boolean valid,
        int entriesChecked,
        UUID brokenEntryId,
        ChainCheck failedCheck
) {
    static ChainVerification intact(String agentId, int entriesChecked) {
        return new ChainVerification(agentId, true, entriesChecked, null, null);
    }

    static ChainVerification broken(String agentId, int entriesChecked, UUID entryId, ChainCheck check) {
        return new ChainVerification(agentId, false, entriesChecked, entryId, check);
    }

    /**
     * The incident to raise for a broken chain.
     */
    public Optional<ProtocolError> error() {
        if (valid) {
            return Optional.empty();
        }
        return Optional.of(new ProtocolError(ErrorKind.CHAIN_BROKEN,
                "Audit chain broken at entry " + brokenEntryId + " (" + failedCheck + ")"));
    }
}
