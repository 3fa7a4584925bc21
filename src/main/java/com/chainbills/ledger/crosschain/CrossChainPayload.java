package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.entity.TokenAndAmount;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Decoded body of an attested message. Addresses and ids are 0x-prefixed
 * 32-byte hex; fields not carried by an action are null.
 */
@Value
@Builder
public class CrossChainPayload {
    ActionType action;
    String caller;
    String payableId;
    String token;
    Long amount;
    String description;
    /** CREATE_PAYABLE only; tokens in 32-byte form. */
    @Singular("tokenAndAmount")
    List<TokenAndAmount> tokensAndAmounts;
}
