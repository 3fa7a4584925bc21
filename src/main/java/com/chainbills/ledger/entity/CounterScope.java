package com.chainbills.ledger.entity;

/**
 * Kinds of sequence a {@link SequenceCounter} can track.
 */
public enum CounterScope {
    CHAIN_USERS,
    CHAIN_PAYABLES,
    CHAIN_PAYMENTS,
    CHAIN_WITHDRAWALS,
    USER_PAYABLES,
    USER_PAYMENTS,
    USER_WITHDRAWALS,
    PAYABLE_PAYMENTS,
    PAYABLE_CHAIN_PAYMENTS,
    PAYABLE_WITHDRAWALS
}
