package com.pactum.api.pin;

import com.pactum.core.domain.Contract;
import com.pactum.core.domain.Pin;
import com.pactum.core.domain.Scope;
import com.pactum.core.repository.ContractRepository;
import com.pactum.core.repository.PinRepository;
import com.pactum.core.result.ErrorKind;
import com.pactum.core.result.ProtocolResult;
import com.pactum.core.tx.LockAttempt;
import com.pactum.core.tx.LockKey;
import com.pactum.core.tx.Transaction;
import com.pactum.core.tx.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates presented PIN credentials.
 * <p>
 * Each validation holds a non-blocking lock on the PIN from the first read until the
 * single-use mark is committed, so at most one concurrent validation of a single-use PIN
 * can succeed. A busy PIN fails fast with {@link ErrorKind#LOCK_CONTENTION}.
 */
public class PinValidator {

    private static final Logger log = LoggerFactory.getLogger(PinValidator.class);

    private final TransactionManager transactions;
    private final PinRepository pins;
    private final ContractRepository contracts;
    private final PinSigner signer;
    private final Clock clock;

    public PinValidator(
            TransactionManager transactions,
            PinRepository pins,
            ContractRepository contracts,
            PinSigner signer,
            Clock clock) {
        this.transactions = Objects.requireNonNull(transactions, "Transaction manager cannot be null");
        this.pins = Objects.requireNonNull(pins, "PIN repository cannot be null");
        this.contracts = Objects.requireNonNull(contracts, "Contract repository cannot be null");
        this.signer = Objects.requireNonNull(signer, "PIN signer cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public ProtocolResult<PinValidation> validate(UUID pinId, String credential, Scope requestedScope) {
        if (pinId == null || requestedScope == null) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "PIN ID and requested scope are required");
        }
        if (requestedScope.hasBlankEntries()) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Requested scope cannot contain blank entries");
        }

        try (Transaction tx = transactions.begin()) {
            // Step 1: lock and load
            if (tx.tryLock(LockKey.pin(pinId)) == LockAttempt.BUSY) {
                log.debug("PIN {} is locked by a concurrent validation", pinId);
                return ProtocolResult.failure(ErrorKind.LOCK_CONTENTION, "PIN is being validated by another request");
            }
            Optional<Pin> found = pins.findById(tx, pinId).filter(p -> !p.revoked());
            if (found.isEmpty()) {
                log.debug("PIN {} not found or revoked", pinId);
                return ProtocolResult.failure(ErrorKind.NOT_FOUND, "PIN not found or revoked");
            }
            Pin pin = found.get();
            Instant now = now();

            // Step 2: expiry
            if (pin.isExpiredAt(now)) {
                log.debug("PIN {} expired at {}", pinId, pin.expiresAt());
                return ProtocolResult.failure(ErrorKind.EXPIRED, "PIN has expired");
            }

            // Step 3: replay
            if (pin.isUsed()) {
                log.debug("PIN {} already used at {}", pinId, pin.usedAt());
                return ProtocolResult.failure(ErrorKind.ALREADY_USED, "PIN has already been used");
            }

            // Step 4: credential
            if (!credentialMatches(pin, credential)) {
                log.warn("Rejected credential for PIN {}", pinId);
                return ProtocolResult.failure(ErrorKind.INVALID_SIGNATURE, "Invalid PIN signature");
            }

            // Step 5: scope
            if (!requestedScope.isSubsetOf(pin.scope())) {
                log.warn("Requested scope {} exceeds PIN {} scope", requestedScope, pinId);
                return ProtocolResult.failure(ErrorKind.SCOPE_EXCEEDED, "Requested scope exceeds PIN scope");
            }

            // Step 6: parent contract must still be in force
            Optional<Contract> contract = contracts.findById(tx, pin.contractId());
            if (contract.isEmpty() || !contract.get().isUsableAt(now)) {
                log.debug("Contract {} of PIN {} is no longer active", pin.contractId(), pinId);
                return ProtocolResult.failure(ErrorKind.INVALID_STATE, "Contract is no longer active");
            }

            // Step 7: consume before the lock is released
            if (pin.singleUse()) {
                pins.save(tx, pin.markUsed(now));
                tx.commit();
                log.info("PIN {} consumed by validation", pinId);
            }

            return ProtocolResult.ok(new PinValidation(
                    pin.id(), pin.contractId(), pin.agentId(), pin.scope(), pin.singleUse(), now));
        }
    }

    private boolean credentialMatches(Pin pin, String credential) {
        Optional<PinCredential> parsed = PinCredential.parse(credential);
        if (parsed.isEmpty()) {
            return false;
        }
        String expected = signer.sign(pin.id(), parsed.get().token());
        // both comparisons always run
        boolean presentedMatches = signer.matches(expected, parsed.get().signature());
        boolean storedMatches = signer.matches(expected, pin.signature());
        return presentedMatches & storedMatches;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
