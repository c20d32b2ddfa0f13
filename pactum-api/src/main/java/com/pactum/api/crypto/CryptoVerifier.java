package com.pactum.api.crypto;

import com.pactum.core.domain.ContractTerms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Content hashing and Ed25519 signature checks for consent contracts.
 * Verification never explains a failure: every malformed or mismatched input is simply {@code false}.
 */
public class CryptoVerifier {

    private static final Logger log = LoggerFactory.getLogger(CryptoVerifier.class);

    private static final String ALGORITHM = "Ed25519";
    private static final int SIGNATURE_LENGTH = 64;
    private static final String PEM_BEGIN = "-----BEGIN PUBLIC KEY-----";
    private static final String PEM_END = "-----END PUBLIC KEY-----";

    /**
     * Hash both parties sign. Set order in {@code terms} does not affect the result.
     */
    public String computeContentHash(String partyA, String partyB, ContractTerms terms) {
        // HashMap: null values are part of the content
        Map<String, Object> content = new HashMap<>();
        content.put("party_a", partyA);
        content.put("party_b", partyB);
        content.put("data_types", new ArrayList<>(terms.dataTypes()));
        content.put("actions", new ArrayList<>(terms.allowedActions()));
        content.put("purpose", terms.purpose());
        content.put("retention_days", terms.retentionDays());
        content.put("expires_at", terms.expiresAt() != null ? CanonicalJson.timestamp(terms.expiresAt()) : null);
        return CanonicalJson.sha256Hex(content);
    }

    /**
     * Checks a base64 Ed25519 signature over the UTF-8 bytes of {@code contentHash}
     * against a PEM (SubjectPublicKeyInfo) public key.
     */
    public boolean verifySignature(String publicKeyPem, String signatureBase64, String contentHash) {
        if (publicKeyPem == null || signatureBase64 == null || contentHash == null) {
            return false;
        }
        try {
            PublicKey publicKey = parsePublicKey(publicKeyPem);
            byte[] signatureBytes = Base64.getDecoder().decode(signatureBase64.strip());
            if (signatureBytes.length != SIGNATURE_LENGTH) {
                return false;
            }
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(contentHash.getBytes(StandardCharsets.UTF_8));
            return verifier.verify(signatureBytes);
        } catch (GeneralSecurityException | RuntimeException e) {
            log.debug("Signature check failed for key {}", publicKeyFingerprint(publicKeyPem));
            return false;
        }
    }

    /**
     * SHA-256 hex of the PEM text. Safe to log.
     */
    public String publicKeyFingerprint(String publicKeyPem) {
        return CanonicalJson.sha256Hex(publicKeyPem);
    }

    private static PublicKey parsePublicKey(String pem) throws GeneralSecurityException {
        String text = pem.strip();
        if (!text.startsWith(PEM_BEGIN) || !text.endsWith(PEM_END)) {
            throw new GeneralSecurityException("Not a PEM public key");
        }
        String body = text.substring(PEM_BEGIN.length(), text.length() - PEM_END.length());
        byte[] der = Base64.getMimeDecoder().decode(body);
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
    }
}
