package com.pactum.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A party's signature over the contract content hash, with the key it was verified against.
 *
 * @param signature    base64 Ed25519 signature
 * @param publicKeyPem PEM public key the party declared when signing
 * @param signedAt     when the signature was recorded
 */
public record ContractSignature(String signature, String publicKeyPem, Instant signedAt) {

    public ContractSignature {
        Objects.requireNonNull(signature, "Signature cannot be null");
        Objects.requireNonNull(publicKeyPem, "Public key cannot be null");
        Objects.requireNonNull(signedAt, "Signed at cannot be null");
    }
}
