package com.pactum.core.repository.memory;

import com.pactum.core.domain.Contract;
import com.pactum.core.domain.ContractStatus;
import com.pactum.core.repository.ContractRepository;
import com.pactum.core.tx.Transaction;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Contract store backed by a map. Guarded by the manager's commit lock.
 */
public class InMemoryContractRepository implements ContractRepository {

    private final InMemoryTransactionManager manager;
    private final Map<UUID, Contract> contracts = new HashMap<>();

    public InMemoryContractRepository(InMemoryTransactionManager manager) {
        this.manager = manager;
    }

    @Override
    public Optional<Contract> findById(Transaction tx, UUID contractId) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> Optional.ofNullable(contracts.get(contractId)));
    }

    @Override
    public void save(Transaction tx, Contract contract) {
        InMemoryTransaction.from(tx).stage(() -> contracts.put(contract.id(), contract));
    }

    @Override
    public List<Contract> findExpirable(Transaction tx, Instant now) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> contracts.values().stream()
                .filter(c -> c.status() == ContractStatus.PROPOSED || c.status() == ContractStatus.ACTIVE)
                .filter(c -> c.isPastExpiry(now))
                .sorted(Comparator.comparing(Contract::createdAt))
                .collect(Collectors.toList()));
    }

    @Override
    public List<Contract> findByParty(Transaction tx, String agentId) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> contracts.values().stream()
                .filter(c -> c.isParty(agentId))
                .sorted(Comparator.comparing(Contract::createdAt).reversed())
                .collect(Collectors.toList()));
    }
}
