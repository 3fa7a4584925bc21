package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.Instant;

/**
 * A payment as seen from the payer. Immutable once persisted.
 */
@Entity
@Table(name = "user_payments")
@Getter
@Setter
public class UserPayment {

    @Id
    @Column(length = 66)
    private String id;

    @Column(nullable = false, length = 66)
    private String payableId;

    @Column(nullable = false, length = 66)
    private String payer;

    /** Chain the payer paid from. */
    @Column(nullable = false)
    private int payerChainId;

    /** Chain the payable lives on (always this chain). */
    @Column(nullable = false)
    private int payableChainId;

    /** Chain-wide payments sequence at commit. */
    @Column(nullable = false)
    private long chainCount;

    /** Payer's payments sequence at commit. */
    @Column(nullable = false)
    private long payerCount;

    /** Payable's payments sequence at commit. */
    @Column(nullable = false)
    private long payableCount;

    @Embedded
    private TokenAndAmount details;

    @Column(nullable = false)
    private Instant timestamp;
}
