package com.chainbills.ledger.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.util.List;

@Getter
@Setter
public class UpdateAllowedTokensRequest {

    @NotNull
    @Valid
    private List<TokenAndAmountDto> allowedTokensAndAmounts;
}
