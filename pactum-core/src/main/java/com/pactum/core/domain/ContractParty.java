package com.pactum.core.domain;

/**
 * Which side of a bilateral contract an agent sits on.
 */
public enum ContractParty {
    PARTY_A,
    PARTY_B
}
