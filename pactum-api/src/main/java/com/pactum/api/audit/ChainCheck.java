package com.pactum.api.audit;

/**
 * Checks run on every chain entry, in this order.
 */
public enum ChainCheck {
    /** {@code prevHash} equals the entry hash of the preceding entry, or genesis. */
    PREV_HASH_LINK,
    /** The timestamp is not earlier than the preceding entry's. */
    TIMESTAMP_ORDER,
    /** Recomputing the hash over the stored fields reproduces {@code entryHash}. */
    ENTRY_HASH
}
