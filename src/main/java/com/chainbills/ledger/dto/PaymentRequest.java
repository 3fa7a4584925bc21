package com.chainbills.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Request payload for paying a payable from the calling wallet.
 * A zero amount is rejected by the service with ZERO_AMOUNT_SPECIFIED.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {

    @NotBlank
    private String payableId;

    @NotBlank
    private String token;

    @NotNull
    private Long amount;
}
