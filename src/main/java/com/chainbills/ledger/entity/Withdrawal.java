package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.Instant;

/**
 * A withdrawal from a payable to its host. Details hold the gross amount;
 * {@code fee} is what the ledger kept, the host received {@code amount - fee}.
 */
@Entity
@Table(name = "withdrawals")
@Getter
@Setter
public class Withdrawal {

    @Id
    @Column(length = 66)
    private String id;

    @Column(nullable = false)
    private long chainCount;

    @Column(nullable = false, length = 66)
    private String payableId;

    @Column(nullable = false)
    private long payableCount;

    @Column(nullable = false, length = 66)
    private String host;

    /** Chain the host requested the withdrawal from. */
    @Column(nullable = false)
    private int hostChainId;

    @Column(nullable = false)
    private long hostCount;

    @Embedded
    private TokenAndAmount details;

    @Column(nullable = false)
    private long fee;

    @Column(nullable = false)
    private Instant timestamp;
}
