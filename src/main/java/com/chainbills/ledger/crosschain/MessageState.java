package com.chainbills.ledger.crosschain;

/**
 * Lifecycle of an inbound attested message on this ledger.
 */
public enum MessageState {
    UNSEEN,
    VERIFIED,
    APPLIED
}
