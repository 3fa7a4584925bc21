package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.Instant;

/**
 * The same payment as {@link UserPayment}, indexed from the payable's side.
 * The payer is kept in its 32-byte chain-portable form.
 */
@Entity
@Table(name = "payable_payments")
@Getter
@Setter
public class PayablePayment {

    @Id
    @Column(length = 66)
    private String id;

    @Column(nullable = false, length = 66)
    private String payableId;

    @Column(nullable = false, length = 66)
    private String payer;

    @Column(nullable = false)
    private int payerChainId;

    /** Payable's payments sequence restricted to the payer's chain. */
    @Column(nullable = false)
    private long localChainCount;

    @Column(nullable = false)
    private long payableCount;

    @Column(nullable = false)
    private long payerCount;

    @Embedded
    private TokenAndAmount details;

    @Column(nullable = false)
    private Instant timestamp;
}
