package com.chainbills.ledger.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Relayed payment made on another chain. Token and amount are the local
 * accounting values and must match the ones carried by the message.
 */
@Getter
@Setter
public class ReceivedPaymentRequest {

    @NotNull
    @Valid
    private SignedMessage message;

    @NotBlank
    private String payableId;

    /** Remote payer, 32-byte form. */
    @NotBlank
    private String caller;

    /** Local token address. */
    @NotBlank
    private String token;

    @NotNull
    private Long amount;
}
