package com.chainbills.ledger.service;

import lombok.Builder;
import lombok.Value;

/**
 * A token movement the ledger has accounted for and hands to the executor.
 */
@Value
@Builder
public class TransferInstruction {
    TransferDirection direction;
    String token;
    long grossAmount;
    long fee;
    long netAmount;
    /** Payer or host wallet on the other side of the movement. */
    String counterparty;
    int counterpartyChainId;
    /** Payment or withdrawal id the movement belongs to. */
    String reference;
}
