package com.pactum.core.repository.memory;

import com.pactum.core.domain.Pin;
import com.pactum.core.repository.PinRepository;
import com.pactum.core.tx.Transaction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryPinRepository implements PinRepository {

    private final InMemoryTransactionManager manager;
    private final Map<UUID, Pin> pins = new HashMap<>();

    public InMemoryPinRepository(InMemoryTransactionManager manager) {
        this.manager = manager;
    }

    @Override
    public Optional<Pin> findById(Transaction tx, UUID pinId) {
        InMemoryTransaction.from(tx);
        return manager.readCommitted(() -> Optional.ofNullable(pins.get(pinId)));
    }

    @Override
    public void save(Transaction tx, Pin pin) {
        InMemoryTransaction.from(tx).stage(() -> pins.put(pin.id(), pin));
    }
}
