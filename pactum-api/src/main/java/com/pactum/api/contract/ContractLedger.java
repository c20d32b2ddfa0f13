package com.pactum.api.contract;

import com.pactum.api.crypto.CryptoVerifier;
import com.pactum.core.domain.Contract;
import com.pactum.core.domain.ContractParty;
import com.pactum.core.domain.ContractSignature;
import com.pactum.core.domain.ContractStatus;
import com.pactum.core.domain.ContractTerms;
import com.pactum.core.repository.ContractRepository;
import com.pactum.core.result.ErrorKind;
import com.pactum.core.result.ProtocolResult;
import com.pactum.core.tx.LockKey;
import com.pactum.core.tx.Transaction;
import com.pactum.core.tx.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract lifecycle: proposal, bilateral signing, revocation and expiry.
 * <p>
 * Every state change runs under a blocking lock on the contract id, so concurrent signers
 * are serialized and the contract activates exactly once.
 */
public class ContractLedger {

    private static final Logger log = LoggerFactory.getLogger(ContractLedger.class);

    static final int MAX_REASON_LENGTH = 500;

    private final TransactionManager transactions;
    private final ContractRepository contracts;
    private final CryptoVerifier crypto;
    private final Clock clock;

    public ContractLedger(
            TransactionManager transactions,
            ContractRepository contracts,
            CryptoVerifier crypto,
            Clock clock) {
        this.transactions = Objects.requireNonNull(transactions, "Transaction manager cannot be null");
        this.contracts = Objects.requireNonNull(contracts, "Contract repository cannot be null");
        this.crypto = Objects.requireNonNull(crypto, "Crypto verifier cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Proposes a contract from {@code proposer} (party A) to {@code counterparty} (party B).
     * The content hash is computed here once and never again.
     */
    public ProtocolResult<Contract> create(String proposer, String counterparty, ContractTerms terms) {
        Instant now = now();
        Optional<String> problem = validateProposal(proposer, counterparty, terms, now);
        if (problem.isPresent()) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, problem.get());
        }

        String contentHash = crypto.computeContentHash(proposer, counterparty, terms);
        Contract contract = Contract.propose(UUID.randomUUID(), proposer, counterparty, terms, contentHash, now);

        try (Transaction tx = transactions.begin()) {
            contracts.save(tx, contract);
            tx.commit();
        }

        log.info("Contract {} proposed by {} to {}", contract.id(), proposer, counterparty);
        return ProtocolResult.ok(contract);
    }

    /**
     * Records {@code signerId}'s Ed25519 signature over the content hash.
     * The contract becomes ACTIVE when the second party signs.
     */
    public ProtocolResult<Contract> sign(UUID contractId, String signerId, String signature, String publicKeyPem) {
        try (Transaction tx = transactions.begin()) {
            tx.lockBlocking(LockKey.contract(contractId));

            Optional<Contract> found = contracts.findById(tx, contractId);
            if (found.isEmpty()) {
                return notFound(contractId);
            }
            Contract contract = found.get();

            if (contract.status() != ContractStatus.PROPOSED) {
                return ProtocolResult.failure(ErrorKind.INVALID_STATE,
                        "Contract is not in PROPOSED status (current: " + contract.status() + ")");
            }

            Optional<ContractParty> party = contract.partyOf(signerId);
            if (party.isEmpty()) {
                return ProtocolResult.failure(ErrorKind.FORBIDDEN, "Signer is not a party to this contract");
            }

            if (contract.signatureOf(party.get()) != null) {
                return ProtocolResult.failure(ErrorKind.CONFLICT, "Party has already signed this contract");
            }

            if (!crypto.verifySignature(publicKeyPem, signature, contract.contentHash())) {
                log.warn("Rejected signature from {} on contract {} (key {})",
                        signerId, contractId, fingerprint(publicKeyPem));
                return ProtocolResult.failure(ErrorKind.INVALID_SIGNATURE, "Invalid signature");
            }

            Instant now = now();
            Contract signed = contract.withSignature(party.get(),
                    new ContractSignature(signature, publicKeyPem, now), now);
            contracts.save(tx, signed);
            tx.commit();

            if (signed.status() == ContractStatus.ACTIVE) {
                log.info("Contract {} activated", contractId);
            } else {
                log.info("Contract {} signed by {}", contractId, signerId);
            }
            return ProtocolResult.ok(signed);
        }
    }

    public ProtocolResult<Contract> get(UUID contractId) {
        try (Transaction tx = transactions.begin()) {
            return contracts.findById(tx, contractId)
                    .map(ProtocolResult::ok)
                    .orElseGet(() -> notFound(contractId));
        }
    }

    /**
     * Revokes an ACTIVE contract on behalf of one of its parties. Takes effect immediately.
     */
    public ProtocolResult<Contract> revoke(UUID contractId, String agentId, String reason) {
        if (reason == null || reason.isBlank() || reason.length() > MAX_REASON_LENGTH) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST,
                    "Revocation reason must be 1 to " + MAX_REASON_LENGTH + " characters");
        }

        try (Transaction tx = transactions.begin()) {
            tx.lockBlocking(LockKey.contract(contractId));

            Optional<Contract> found = contracts.findById(tx, contractId);
            if (found.isEmpty()) {
                return notFound(contractId);
            }
            Contract contract = found.get();

            if (contract.status() != ContractStatus.ACTIVE) {
                return ProtocolResult.failure(ErrorKind.INVALID_STATE,
                        "Contract is not ACTIVE (current: " + contract.status() + ")");
            }
            if (!contract.isParty(agentId)) {
                return ProtocolResult.failure(ErrorKind.FORBIDDEN, "Only contract parties can revoke");
            }

            Contract revoked = contract.revoke(agentId, reason, now());
            contracts.save(tx, revoked);
            tx.commit();

            log.info("Contract {} revoked by {}", contractId, agentId);
            return ProtocolResult.ok(revoked);
        }
    }

    /**
     * Re-verifies each stored signature against the content hash and the key recorded with it.
     */
    public ProtocolResult<ContractSignatureReport> verifySignatures(UUID contractId) {
        Optional<Contract> found;
        try (Transaction tx = transactions.begin()) {
            found = contracts.findById(tx, contractId);
        }
        if (found.isEmpty()) {
            return notFound(contractId);
        }
        Contract contract = found.get();

        List<SignatureCheck> checks = new ArrayList<>();
        for (ContractParty party : ContractParty.values()) {
            ContractSignature stored = contract.signatureOf(party);
            if (stored == null) {
                checks.add(new SignatureCheck(party, contract.agentOf(party), false, false, null));
                continue;
            }
            boolean valid = crypto.verifySignature(stored.publicKeyPem(), stored.signature(), contract.contentHash());
            if (!valid) {
                log.warn("Stored signature of {} on contract {} no longer verifies", contract.agentOf(party), contractId);
            }
            checks.add(new SignatureCheck(party, contract.agentOf(party), true, valid,
                    crypto.publicKeyFingerprint(stored.publicKeyPem())));
        }
        return ProtocolResult.ok(new ContractSignatureReport(contractId, contract.status(), contract.contentHash(), checks));
    }

    /**
     * Moves every PROPOSED or ACTIVE contract whose expiry has passed to EXPIRED.
     * Meant to be driven by an external scheduler.
     *
     * @return number of contracts expired by this sweep
     */
    public ProtocolResult<Integer> expireOverdue() {
        Instant cutoff = now();
        List<Contract> candidates;
        try (Transaction tx = transactions.begin()) {
            candidates = contracts.findExpirable(tx, cutoff);
        }

        int expired = 0;
        for (Contract candidate : candidates) {
            try (Transaction tx = transactions.begin()) {
                tx.lockBlocking(LockKey.contract(candidate.id()));

                // state may have moved since the scan
                Optional<Contract> current = contracts.findById(tx, candidate.id());
                if (current.isEmpty()
                        || current.get().status().isTerminal()
                        || !current.get().isPastExpiry(cutoff)) {
                    continue;
                }

                contracts.save(tx, current.get().expire(now()));
                tx.commit();
                expired++;
                log.info("Contract {} expired", candidate.id());
            }
        }
        return ProtocolResult.ok(expired);
    }

    /**
     * Contracts where {@code agentId} is either party, newest first.
     */
    public ProtocolResult<List<Contract>> listForParty(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Agent ID is required");
        }
        try (Transaction tx = transactions.begin()) {
            return ProtocolResult.ok(contracts.findByParty(tx, agentId));
        }
    }

    private Optional<String> validateProposal(String proposer, String counterparty, ContractTerms terms, Instant now) {
        if (proposer == null || proposer.isBlank() || counterparty == null || counterparty.isBlank()) {
            return Optional.of("Both parties are required");
        }
        if (proposer.equals(counterparty)) {
            return Optional.of("Contract parties must be distinct");
        }
        if (terms == null) {
            return Optional.of("Contract terms are required");
        }
        if (terms.purpose() == null || terms.purpose().isBlank()) {
            return Optional.of("Purpose is required");
        }
        if (terms.hasBlankEntries()) {
            return Optional.of("Data types, actions and regions cannot contain blank entries");
        }
        if (terms.retentionDays() != null && terms.retentionDays() <= 0) {
            return Optional.of("Retention days must be positive");
        }
        if (terms.expiresAt() != null && !terms.expiresAt().isAfter(now)) {
            return Optional.of("Expiry must be in the future");
        }
        return Optional.empty();
    }

    private String fingerprint(String publicKeyPem) {
        return publicKeyPem == null ? "none" : crypto.publicKeyFingerprint(publicKeyPem);
    }

    private static <T> ProtocolResult<T> notFound(UUID contractId) {
        return ProtocolResult.failure(ErrorKind.NOT_FOUND, "Contract not found: " + contractId);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
