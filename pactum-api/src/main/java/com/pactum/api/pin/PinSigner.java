package com.pactum.api.pin;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Objects;
import java.util.UUID;

/**
 * HMAC-SHA256 over {@code "<pin id>:<token>"} under the server secret, URL-safe base64 with padding.
 */
public class PinSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public PinSigner(String signingKey) {
        Objects.requireNonNull(signingKey, "Signing key cannot be null");
        if (signingKey.isBlank()) {
            throw new IllegalArgumentException("Signing key cannot be blank");
        }
        this.key = new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String sign(UUID pinId, String token) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((pinId + ":" + token).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("HMAC-SHA256 not available", e);
        }
    }

    /**
     * Constant-time comparison of two encoded signatures.
     */
    public boolean matches(String expected, String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
