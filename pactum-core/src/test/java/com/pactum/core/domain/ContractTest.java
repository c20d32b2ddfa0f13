package com.pactum.core.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class ContractTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private Contract proposed;

    @BeforeEach
    void setUp() {
        ContractTerms terms = new ContractTerms(Set.of("email"), Set.of("read"), "support", 30,
                Set.of("EU"), NOW.plus(30, ChronoUnit.DAYS));
        proposed = Contract.propose(UUID.randomUUID(), "agent-a", "agent-b", terms, "ab".repeat(32), NOW);
    }

    @Test
    void proposalStartsUnsigned() {
        assertThat(proposed.status()).isEqualTo(ContractStatus.PROPOSED);
        assertThat(proposed.isFullySigned()).isFalse();
        assertThat(proposed.partyOf("agent-b")).contains(ContractParty.PARTY_B);
        assertThat(proposed.partyOf("stranger")).isEmpty();
        assertThat(proposed.isUsableAt(NOW)).isFalse();
    }

    @Test
    void secondSignatureActivates() {
        Instant later = NOW.plusSeconds(5);

        Contract half = proposed.withSignature(ContractParty.PARTY_A, signature(NOW), NOW);
        Contract full = half.withSignature(ContractParty.PARTY_B, signature(later), later);

        assertThat(half.status()).isEqualTo(ContractStatus.PROPOSED);
        assertThat(half.signedAt()).isNull();
        assertThat(full.status()).isEqualTo(ContractStatus.ACTIVE);
        assertThat(full.signedAt()).isEqualTo(later);
        assertThat(full.contentHash()).isEqualTo(proposed.contentHash());
        assertThat(full.isUsableAt(later)).isTrue();
    }

    @Test
    void partyCannotSignTwice() {
        Contract half = proposed.withSignature(ContractParty.PARTY_A, signature(NOW), NOW);

        assertThatThrownBy(() -> half.withSignature(ContractParty.PARTY_A, signature(NOW), NOW))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already signed");
    }

    @Test
    void revokedContractRecordsWhoAndWhy() {
        Contract revoked = proposed.revoke("agent-b", "changed my mind", NOW);

        assertThat(revoked.status()).isEqualTo(ContractStatus.REVOKED);
        assertThat(revoked.revokedBy()).isEqualTo("agent-b");
        assertThat(revoked.revocationReason()).isEqualTo("changed my mind");
        assertThatThrownBy(() -> revoked.revoke("agent-a", null, NOW))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> revoked.expire(NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void expiryBoundaryIsInclusive() {
        Instant expiry = proposed.expiresAt();

        assertThat(proposed.isPastExpiry(expiry.minusNanos(1000))).isFalse();
        assertThat(proposed.isPastExpiry(expiry)).isTrue();
    }

    @Test
    void partiesMustDiffer() {
        assertThatThrownBy(() -> Contract.propose(UUID.randomUUID(), "same", "same",
                proposed.terms(), "00", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ContractSignature signature(Instant at) {
        return new ContractSignature("c2ln", "-----BEGIN PUBLIC KEY-----", at);
    }
}
