package com.chainbills.ledger.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Request payload for creating a payable hosted by the calling wallet.
 * Description and list limits are ledger rules, checked by the service.
 */
@Getter
@Setter
public class CreatePayableRequest {

    /** Free text shown to payers. */
    @NotNull
    private String description;

    /** Empty means any supported token in any positive amount. */
    @Valid
    private List<TokenAndAmountDto> allowedTokensAndAmounts = new ArrayList<>();
}
