package com.pactum.core.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bilateral consent contract between two agents.
 * Instances are immutable; every lifecycle step returns a new instance.
 * {@code contentHash} is fixed at proposal and carried unchanged through every transition.
 */
public record Contract(
        UUID id,
        String partyA,
        String partyB,
        ContractTerms terms,
        ContractSignature partyASignature,
        ContractSignature partyBSignature,
        ContractStatus status,
        String contentHash,
        Instant createdAt,
        Instant updatedAt,
        Instant signedAt,
        Instant revokedAt,
        String revokedBy,
        String revocationReason
) {
    public Contract {
        Objects.requireNonNull(id, "ID cannot be null");
        Objects.requireNonNull(partyA, "Party A cannot be null");
        Objects.requireNonNull(partyB, "Party B cannot be null");
        Objects.requireNonNull(terms, "Terms cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(contentHash, "Content hash cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
        Objects.requireNonNull(updatedAt, "Updated at cannot be null");
        if (partyA.equals(partyB)) {
            throw new IllegalArgumentException("Contract parties must be distinct");
        }
        if (terms.retentionDays() != null && terms.retentionDays() <= 0) {
            throw new IllegalArgumentException("Retention days must be positive when set");
        }
        if (status == ContractStatus.ACTIVE && (partyASignature == null || partyBSignature == null)) {
            throw new IllegalArgumentException("Active contract requires both signatures");
        }
        if (status == ContractStatus.REVOKED && (revokedAt == null || revokedBy == null)) {
            throw new IllegalArgumentException("Revoked contract requires revocation details");
        }
    }

    /**
     * Creates a new contract in PROPOSED state.
     */
    public static Contract propose(
            UUID id,
            String proposer,
            String counterparty,
            ContractTerms terms,
            String contentHash,
            Instant now) {
        return new Contract(id, proposer, counterparty, terms, null, null,
                ContractStatus.PROPOSED, contentHash, now, now, null, null, null, null);
    }

    public Optional<ContractParty> partyOf(String agentId) {
        if (partyA.equals(agentId)) {
            return Optional.of(ContractParty.PARTY_A);
        }
        if (partyB.equals(agentId)) {
            return Optional.of(ContractParty.PARTY_B);
        }
        return Optional.empty();
    }

    public boolean isParty(String agentId) {
        return partyOf(agentId).isPresent();
    }

    public String agentOf(ContractParty party) {
        return party == ContractParty.PARTY_A ? partyA : partyB;
    }

    public ContractSignature signatureOf(ContractParty party) {
        return party == ContractParty.PARTY_A ? partyASignature : partyBSignature;
    }

    public boolean isFullySigned() {
        return partyASignature != null && partyBSignature != null;
    }

    public Scope scope() {
        return terms.scope();
    }

    public Instant expiresAt() {
        return terms.expiresAt();
    }

    public boolean isPastExpiry(Instant now) {
        return terms.expiresAt() != null && !now.isBefore(terms.expiresAt());
    }

    /**
     * True when PINs may be issued or validated against this contract at {@code now}.
     */
    public boolean isUsableAt(Instant now) {
        return status == ContractStatus.ACTIVE && !isPastExpiry(now);
    }

    /**
     * Records a party's signature. Activates the contract once both signatures are present.
     */
    public Contract withSignature(ContractParty party, ContractSignature signature, Instant now) {
        requireStatus(ContractStatus.PROPOSED);
        if (signatureOf(party) != null) {
            throw new IllegalStateException(party + " has already signed contract " + id);
        }
        ContractSignature a = party == ContractParty.PARTY_A ? signature : partyASignature;
        ContractSignature b = party == ContractParty.PARTY_B ? signature : partyBSignature;
        boolean complete = a != null && b != null;
        return new Contract(id, partyA, partyB, terms, a, b,
                complete ? ContractStatus.ACTIVE : ContractStatus.PROPOSED,
                contentHash, createdAt, now, complete ? now : null,
                null, null, null);
    }

    public Contract revoke(String agentId, String reason, Instant now) {
        requireTransition(ContractStatus.REVOKED);
        return new Contract(id, partyA, partyB, terms, partyASignature, partyBSignature,
                ContractStatus.REVOKED, contentHash, createdAt, now, signedAt,
                now, agentId, reason);
    }

    public Contract expire(Instant now) {
        requireTransition(ContractStatus.EXPIRED);
        return new Contract(id, partyA, partyB, terms, partyASignature, partyBSignature,
                ContractStatus.EXPIRED, contentHash, createdAt, now, signedAt,
                null, null, null);
    }

    private void requireStatus(ContractStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Contract " + id + " is " + status + ", expected " + expected);
        }
    }

    private void requireTransition(ContractStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Contract " + id + " cannot move from " + status + " to " + target);
        }
    }
}
