package com.pactum.core.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

class ContractStatusTest {

    @Test
    void proposedMayActivateRevokeOrExpire() {
        assertThat(ContractStatus.PROPOSED.allowedTransitions())
                .containsExactlyInAnyOrder(ContractStatus.ACTIVE, ContractStatus.REVOKED, ContractStatus.EXPIRED);
    }

    @Test
    void activeMayOnlyEnd() {
        assertThat(ContractStatus.ACTIVE.allowedTransitions())
                .containsExactlyInAnyOrder(ContractStatus.REVOKED, ContractStatus.EXPIRED);
        assertThat(ContractStatus.ACTIVE.canTransitionTo(ContractStatus.PROPOSED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = ContractStatus.class, names = {"REVOKED", "EXPIRED"})
    void terminalStatesHaveNoExits(ContractStatus status) {
        assertThat(status.isTerminal()).isTrue();
        for (ContractStatus target : ContractStatus.values()) {
            assertThat(status.canTransitionTo(target)).isFalse();
        }
    }
}
