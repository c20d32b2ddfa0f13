package com.pactum.core.repository;

import com.pactum.core.domain.Contract;
import com.pactum.core.tx.Transaction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store of consent contracts. Contracts are never deleted.
 */
public interface ContractRepository {

    Optional<Contract> findById(Transaction tx, UUID contractId);

    /**
     * Inserts or replaces the contract with the same id when {@code tx} commits.
     */
    void save(Transaction tx, Contract contract);

    /**
     * PROPOSED or ACTIVE contracts whose expiry is at or before {@code now}.
     */
    List<Contract> findExpirable(Transaction tx, Instant now);

    /**
     * Contracts where the agent is either party, newest first.
     */
    List<Contract> findByParty(Transaction tx, String agentId);
}
