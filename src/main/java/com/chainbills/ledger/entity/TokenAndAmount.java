package com.chainbills.ledger.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.Column;
import javax.persistence.Embeddable;

/**
 * A token address with an exact amount in the token's smallest unit.
 * Used for allowed payment entries and for payment/withdrawal details.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class TokenAndAmount {

    /** Normalized local token address. */
    @Column(name = "token", nullable = false, length = 66)
    private String token;

    @Column(name = "amount", nullable = false)
    private long amount;
}
