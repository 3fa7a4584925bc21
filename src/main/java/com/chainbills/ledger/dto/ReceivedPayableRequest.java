package com.chainbills.ledger.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Relayed request to create, close or reopen a payable hosted on another chain.
 *
 * {@code caller} is the remote host (32-byte form) the relayer claims sent the message;
 * {@code payableId} is required for close and reopen.
 */
@Getter
@Setter
public class ReceivedPayableRequest {

    @NotNull
    @Valid
    private SignedMessage message;

    @NotBlank
    private String caller;

    private String payableId;
}
