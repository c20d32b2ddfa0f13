package com.pactum.api.pin;

import java.util.Optional;

/**
 * The bearer string handed to a PIN holder: {@code token + "." + signature}.
 */
public record PinCredential(String token, String signature) {

    private static final char SEPARATOR = '.';

    /**
     * Splits at the last separator. Empty when either half is missing.
     */
    public static Optional<PinCredential> parse(String credential) {
        if (credential == null) {
            return Optional.empty();
        }
        int split = credential.lastIndexOf(SEPARATOR);
        if (split <= 0 || split == credential.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new PinCredential(credential.substring(0, split), credential.substring(split + 1)));
    }

    public String encode() {
        return token + SEPARATOR + signature;
    }

    @Override
    public String toString() {
        return "PinCredential[redacted]";
    }
}
