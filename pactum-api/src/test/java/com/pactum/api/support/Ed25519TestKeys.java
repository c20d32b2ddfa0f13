package com.pactum.api.support;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Base64;

/**
 * An Ed25519 key pair a test party signs contracts with.
 */
public final class Ed25519TestKeys {

    private final KeyPair keyPair;

    private Ed25519TestKeys(KeyPair keyPair) {
        this.keyPair = keyPair;
    }

    public static Ed25519TestKeys generate() {
        try {
            return new Ed25519TestKeys(KeyPairGenerator.getInstance("Ed25519").generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    public String publicKeyPem() {
        return toPem(keyPair.getPublic().getEncoded());
    }

    /**
     * Base64 signature over the UTF-8 bytes of {@code contentHash}.
     */
    public String sign(String contentHash) {
        try {
            Signature signer = Signature.getInstance("Ed25519");
            signer.initSign(keyPair.getPrivate());
            signer.update(contentHash.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    public static String toPem(byte[] subjectPublicKeyInfo) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(subjectPublicKeyInfo);
        return "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";
    }
}
