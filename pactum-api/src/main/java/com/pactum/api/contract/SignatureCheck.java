package com.pactum.api.contract;

import com.pactum.core.domain.ContractParty;

/**
 * Re-verification outcome for one party's stored signature.
 *
 * @param party          which side of the contract
 * @param agentId        the party's agent id
 * @param present        whether the party has signed at all
 * @param valid          whether the stored signature still verifies against the content hash
 * @param keyFingerprint fingerprint of the recorded public key, {@code null} when unsigned
 */
public record SignatureCheck(
        ContractParty party,
        String agentId,
        boolean present,
        boolean valid,
        String keyFingerprint
) {
}
