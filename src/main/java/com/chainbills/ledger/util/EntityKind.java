package com.chainbills.ledger.util;

/**
 * Entity kinds that get a derived 32-byte id.
 */
public enum EntityKind {
    PAYABLE,
    PAYMENT,
    WITHDRAWAL
}
