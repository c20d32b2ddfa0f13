package com.pactum.core.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Contract lifecycle states. REVOKED and EXPIRED are terminal.
 */
public enum ContractStatus {
    PROPOSED,
    ACTIVE,
    REVOKED,
    EXPIRED;

    public Set<ContractStatus> allowedTransitions() {
        return switch (this) {
            case PROPOSED -> EnumSet.of(ACTIVE, REVOKED, EXPIRED);
            case ACTIVE -> EnumSet.of(REVOKED, EXPIRED);
            case REVOKED, EXPIRED -> EnumSet.noneOf(ContractStatus.class);
        };
    }

    public boolean canTransitionTo(ContractStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }
}
