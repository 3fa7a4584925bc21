package com.chainbills.ledger.exception;

/**
 * Coarse classification of ledger failures. None of them is retried automatically.
 */
public enum ErrorCategory {
    /** Bad input, rejected before any write. */
    VALIDATION,
    /** Caller is not allowed to act on the entity. */
    AUTHORIZATION,
    /** Replayed, out-of-order or mismatched cross-chain content; permanently rejected. */
    CONSISTENCY,
    /** Counter or balance overflow; the transaction is aborted. */
    ARITHMETIC,
    /** Referenced entity does not exist. */
    NOT_FOUND
}
