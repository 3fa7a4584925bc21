package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An invoice-like receiver owned by a host wallet.
 *
 * Invariants:
 *  - every balance is >= 0;
 *  - a token key exists in {@code balances} iff a payment in that token was accepted;
 *  - {@code closed} is the only lifecycle flag; payables are never deleted.
 */
@Entity
@Table(name = "payables")
@Getter
@Setter
public class Payable {

    /** 32-byte id, 0x-prefixed hex. */
    @Id
    @Column(length = 66)
    private String id;

    /** Position of this payable in the chain's payables sequence. */
    @Column(nullable = false)
    private long chainCount;

    /** Host wallet (normalized). */
    @Column(nullable = false, length = 66)
    private String host;

    /** Chain the host wallet lives on. */
    @Column(nullable = false)
    private int hostChainId;

    /** Position of this payable in its host's payables sequence. */
    @Column(nullable = false)
    private long hostCount;

    @Column(nullable = false, length = 3000)
    private String description;

    @Column(nullable = false)
    private long paymentsCount;

    @Column(nullable = false)
    private long withdrawalsCount;

    @Column(nullable = false)
    private boolean closed;

    /** Empty means any supported token in any positive amount. */
    @ElementCollection
    @CollectionTable(name = "payable_allowed_tokens_and_amounts", joinColumns = @JoinColumn(name = "payable_fk"))
    @OrderColumn(name = "position")
    private List<TokenAndAmount> allowedTokensAndAmounts = new ArrayList<>();

    /** Accumulated amount per token, one entry per token. */
    @ElementCollection
    @CollectionTable(name = "payable_balances", joinColumns = @JoinColumn(name = "payable_fk"))
    @MapKeyColumn(name = "token", length = 66)
    @Column(name = "amount", nullable = false)
    private Map<String, Long> balances = new HashMap<>();

    @ElementCollection
    @CollectionTable(name = "payable_payment_ids", joinColumns = @JoinColumn(name = "payable_fk"))
    @OrderColumn(name = "position")
    @Column(name = "payment_id", nullable = false, length = 66)
    private List<String> paymentIds = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "payable_withdrawal_ids", joinColumns = @JoinColumn(name = "payable_fk"))
    @OrderColumn(name = "position")
    @Column(name = "withdrawal_id", nullable = false, length = 66)
    private List<String> withdrawalIds = new ArrayList<>();

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    public boolean isHostedBy(int chainId, String wallet) {
        return hostChainId == chainId && host.equals(wallet);
    }
}
