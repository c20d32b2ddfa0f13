package com.pactum.api.pin;

import com.pactum.api.config.ProtocolSettings;
import com.pactum.core.domain.Contract;
import com.pactum.core.domain.Pin;
import com.pactum.core.domain.Scope;
import com.pactum.core.repository.ContractRepository;
import com.pactum.core.repository.PinRepository;
import com.pactum.core.result.ErrorKind;
import com.pactum.core.result.ProtocolResult;
import com.pactum.core.tx.LockKey;
import com.pactum.core.tx.Transaction;
import com.pactum.core.tx.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and revokes PINs under active contracts.
 * Only the HMAC signature is persisted; the token leaves this class once, inside the credential.
 */
public class PinIssuer {

    private static final Logger log = LoggerFactory.getLogger(PinIssuer.class);

    private static final int TOKEN_BYTES = 32;
    private static final int MAX_REASON_LENGTH = 500;

    private final TransactionManager transactions;
    private final ContractRepository contracts;
    private final PinRepository pins;
    private final PinSigner signer;
    private final SecureRandom random;
    private final Clock clock;
    private final Duration defaultTtl;

    public PinIssuer(
            TransactionManager transactions,
            ContractRepository contracts,
            PinRepository pins,
            PinSigner signer,
            SecureRandom random,
            Clock clock,
            ProtocolSettings settings) {
        this.transactions = Objects.requireNonNull(transactions, "Transaction manager cannot be null");
        this.contracts = Objects.requireNonNull(contracts, "Contract repository cannot be null");
        this.pins = Objects.requireNonNull(pins, "PIN repository cannot be null");
        this.signer = Objects.requireNonNull(signer, "PIN signer cannot be null");
        this.random = Objects.requireNonNull(random, "Secure random cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.defaultTtl = Objects.requireNonNull(settings, "Settings cannot be null").pinTtl();
    }

    /**
     * Issues a PIN with the configured lifetime.
     */
    public ProtocolResult<IssuedPin> createPin(String agentId, UUID contractId, Scope scope, boolean singleUse) {
        return createPin(agentId, contractId, scope, singleUse, defaultTtl);
    }

    /**
     * Issues a PIN for {@code agentId} scoped to a subset of the contract's permissions.
     */
    public ProtocolResult<IssuedPin> createPin(
            String agentId, UUID contractId, Scope scope, boolean singleUse, Duration ttl) {
        if (agentId == null || agentId.isBlank() || contractId == null || scope == null) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Agent, contract and scope are required");
        }
        if (scope.hasBlankEntries()) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "Scope cannot contain blank entries");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "PIN TTL must be positive");
        }

        try (Transaction tx = transactions.begin()) {
            Instant now = now();

            // unknown contracts are reported the same way as inactive ones
            Optional<Contract> found = contracts.findById(tx, contractId);
            if (found.isEmpty() || !found.get().isUsableAt(now)) {
                return ProtocolResult.failure(ErrorKind.INVALID_STATE, "Contract is not active");
            }
            Contract contract = found.get();

            if (!contract.isParty(agentId)) {
                return ProtocolResult.failure(ErrorKind.FORBIDDEN, "Agent is not a party to this contract");
            }

            if (!scope.isSubsetOf(contract.scope())) {
                log.warn("PIN scope {} exceeds contract {} scope", scope, contractId);
                return ProtocolResult.failure(ErrorKind.SCOPE_EXCEEDED, "Requested scope exceeds contract scope");
            }

            UUID pinId = UUID.randomUUID();
            String token = generateToken();
            String signature = signer.sign(pinId, token);
            Pin pin = Pin.issue(pinId, contractId, agentId, scope, signature, now, now.plus(ttl), singleUse);

            pins.save(tx, pin);
            tx.commit();

            log.info("PIN {} issued to {} under contract {} (single use: {})", pinId, agentId, contractId, singleUse);
            return ProtocolResult.ok(new IssuedPin(pin, new PinCredential(token, signature).encode()));
        }
    }

    /**
     * Revokes a PIN. The holder or either party to the parent contract may revoke.
     */
    public ProtocolResult<Pin> revokePin(UUID pinId, String agentId, String reason) {
        if (pinId == null || agentId == null) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST, "PIN and agent are required");
        }
        if (reason == null || reason.isBlank() || reason.length() > MAX_REASON_LENGTH) {
            return ProtocolResult.failure(ErrorKind.INVALID_REQUEST,
                    "Revocation reason must be 1 to " + MAX_REASON_LENGTH + " characters");
        }

        try (Transaction tx = transactions.begin()) {
            tx.lockBlocking(LockKey.pin(pinId));

            Optional<Pin> found = pins.findById(tx, pinId).filter(p -> !p.revoked());
            if (found.isEmpty()) {
                return ProtocolResult.failure(ErrorKind.NOT_FOUND, "PIN not found or revoked");
            }
            Pin pin = found.get();

            boolean contractParty = contracts.findById(tx, pin.contractId())
                    .map(c -> c.isParty(agentId))
                    .orElse(false);
            if (!pin.agentId().equals(agentId) && !contractParty) {
                return ProtocolResult.failure(ErrorKind.FORBIDDEN, "Agent may not revoke this PIN");
            }

            Pin revoked = pin.revoke(reason, now());
            pins.save(tx, revoked);
            tx.commit();

            log.info("PIN {} revoked by {}", pinId, agentId);
            return ProtocolResult.ok(revoked);
        }
    }

    /**
     * Stored metadata of a PIN. Never includes the token.
     */
    public ProtocolResult<Pin> getPin(UUID pinId) {
        try (Transaction tx = transactions.begin()) {
            return pins.findById(tx, pinId)
                    .map(ProtocolResult::ok)
                    .orElseGet(() -> ProtocolResult.failure(ErrorKind.NOT_FOUND, "PIN not found: " + pinId));
        }
    }

    private String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
