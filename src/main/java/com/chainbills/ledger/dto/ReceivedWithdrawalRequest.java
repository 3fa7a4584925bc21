package com.chainbills.ledger.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Relayed withdrawal requested by a host living on another chain.
 */
@Getter
@Setter
public class ReceivedWithdrawalRequest {

    @NotNull
    @Valid
    private SignedMessage message;

    @NotBlank
    private String payableId;

    /** Remote host, 32-byte form. */
    @NotBlank
    private String caller;

    @NotBlank
    private String token;

    @NotNull
    private Long amount;

    /** The host's next withdrawal sequence number on this ledger. */
    @NotNull
    private Long hostCount;
}
