package com.chainbills.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Request payload for a host withdrawing from one of its payables.
 * {@code amount} is the gross amount deducted from the payable balance.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalRequest {

    @NotBlank
    private String payableId;

    @NotBlank
    private String token;

    @NotNull
    private Long amount;
}
