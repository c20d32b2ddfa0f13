package com.pactum.api.contract;

import com.pactum.core.domain.ContractStatus;

import java.util.List;
import java.util.UUID;

/**
 * Result of re-verifying every signature stored on a contract.
 */
public record ContractSignatureReport(
        UUID contractId,
        ContractStatus status,
        String contentHash,
        List<SignatureCheck> checks
) {
    public ContractSignatureReport {
        checks = List.copyOf(checks);
    }

    /**
     * True when both parties signed and both signatures verify.
     */
    public boolean isFullyVerified() {
        return checks.stream().allMatch(c -> c.present() && c.valid());
    }

    /**
     * True when no stored signature fails verification. Missing signatures do not count as failures.
     */
    public boolean hasNoInvalidSignature() {
        return checks.stream().noneMatch(c -> c.present() && !c.valid());
    }
}
