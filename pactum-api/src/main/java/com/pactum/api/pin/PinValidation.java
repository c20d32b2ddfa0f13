package com.pactum.api.pin;

import com.pactum.core.domain.Scope;

import java.time.Instant;
import java.util.UUID;

/**
 * A successful PIN validation.
 *
 * @param consumed true when this validation used up a single-use PIN
 */
public record PinValidation(
        UUID pinId,
        UUID contractId,
        String agentId,
        Scope grantedScope,
        boolean consumed,
        Instant validatedAt
) {
}
