package com.chainbills.ledger.dto;

import com.chainbills.ledger.entity.TokenAndAmount;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Token address plus an exact amount in the token's smallest unit.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TokenAndAmountDto {

    @NotBlank
    private String token;

    @NotNull
    private Long amount;

    public static TokenAndAmountDto from(TokenAndAmount taa) {
        return new TokenAndAmountDto(taa.getToken(), taa.getAmount());
    }
}
