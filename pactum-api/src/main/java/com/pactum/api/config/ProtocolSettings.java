package com.pactum.api.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Protocol settings resolved once at startup and handed to the services.
 *
 * @param pinSigningKey   server secret for PIN HMACs; never logged
 * @param pinTtl          default PIN lifetime
 * @param defaultPageSize audit query page size when the caller gives none
 * @param maxPageSize     largest audit page a caller may ask for
 */
public record ProtocolSettings(
        String pinSigningKey,
        Duration pinTtl,
        int defaultPageSize,
        int maxPageSize
) {
    public static final int MIN_SIGNING_KEY_LENGTH = 32;

    public ProtocolSettings {
        Objects.requireNonNull(pinSigningKey, "PIN signing key cannot be null");
        Objects.requireNonNull(pinTtl, "PIN TTL cannot be null");
        if (pinSigningKey.length() < MIN_SIGNING_KEY_LENGTH) {
            throw new IllegalArgumentException("PIN signing key must be at least " + MIN_SIGNING_KEY_LENGTH + " characters");
        }
        if (pinTtl.isZero() || pinTtl.isNegative()) {
            throw new IllegalArgumentException("PIN TTL must be positive");
        }
        if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("Page sizes must satisfy 1 <= default <= max");
        }
    }

    @Override
    public String toString() {
        return "ProtocolSettings[pinTtl=" + pinTtl
                + ", defaultPageSize=" + defaultPageSize
                + ", maxPageSize=" + maxPageSize + "]";
    }
}
