package com.pactum.core.repository;

import com.pactum.core.domain.Pin;
import com.pactum.core.tx.Transaction;

import java.util.Optional;
import java.util.UUID;

/**
 * Store of issued PINs. Holds signatures only, never raw tokens.
 */
public interface PinRepository {

    Optional<Pin> findById(Transaction tx, UUID pinId);

    void save(Transaction tx, Pin pin);
}
