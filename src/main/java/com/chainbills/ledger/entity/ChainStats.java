package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.persistence.Column;
import javax.persistence.Entity;
import javax.persistence.Id;
import javax.persistence.Table;

/**
 * Chain-wide totals. One row per deployment, created at startup and never decremented.
 */
@Entity
@Table(name = "chain_stats")
@Getter
@Setter
@NoArgsConstructor
public class ChainStats {

    /** The local chain id. */
    @Id
    private Integer chainId;

    @Column(nullable = false)
    private long usersCount;

    @Column(nullable = false)
    private long payablesCount;

    @Column(nullable = false)
    private long paymentsCount;

    @Column(nullable = false)
    private long withdrawalsCount;

    public ChainStats(int chainId) {
        this.chainId = chainId;
    }
}
