package com.chainbills.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Relayed message envelope as it arrives from a remote chain.
 * Verified by the attestation source before the ledger reads it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SignedMessage {

    /** Chain the message was emitted on. */
    @NotNull
    private Integer emitterChainId;

    /** 32-byte hex address of the emitting contract. */
    @NotBlank
    private String emitterAddress;

    /** Emitter-side sequence number of the message. */
    @NotNull
    private Long sequence;

    /** Hex-encoded payload. */
    @NotBlank
    private String payload;

    /** Hex-encoded HMAC-SHA256 over the envelope. */
    @NotBlank
    private String signature;
}
