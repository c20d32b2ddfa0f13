package com.pactum.core.tx;

/**
 * Entry point to the store's transactions.
 */
public interface TransactionManager {

    Transaction begin();
}
