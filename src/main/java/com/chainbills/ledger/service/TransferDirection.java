package com.chainbills.ledger.service;

public enum TransferDirection {
    /** Payer's tokens pulled into custody on this chain. */
    PAYMENT_IN,
    /** Tokens that arrived through the bridge with a remote payment. */
    BRIDGED_PAYMENT_IN,
    /** Net amount sent from custody to a local host. */
    WITHDRAWAL_OUT,
    /** Net amount bridged to a host on another chain. */
    BRIDGED_WITHDRAWAL_OUT
}
