package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A wallet known to this ledger, either local or living on a remote chain.
 *
 * Created lazily on the first payable, payment or withdrawal; never deleted.
 * Counters are local-chain scoped.
 */
@Entity
@Table(
        name = "users",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_chain_wallet", columnNames = {"chain_id", "wallet"})
)
@Getter
@Setter
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Chain the wallet lives on. */
    @Column(name = "chain_id", nullable = false)
    private int chainId;

    /** Normalized address: 20-byte hex for local wallets, 32-byte hex for remote ones. */
    @Column(name = "wallet", nullable = false, length = 66)
    private String wallet;

    /** Position of this user in the chain's users sequence. */
    @Column(nullable = false)
    private long chainCount;

    @Column(nullable = false)
    private long payablesCount;

    @Column(nullable = false)
    private long paymentsCount;

    @Column(nullable = false)
    private long withdrawalsCount;

    /** Ids of the payments made by this user, in payment order. */
    @ElementCollection
    @CollectionTable(name = "user_payment_ids", joinColumns = @JoinColumn(name = "user_fk"))
    @OrderColumn(name = "position")
    @Column(name = "payment_id", nullable = false, length = 66)
    private List<String> paymentIds = new ArrayList<>();

    private Instant createdAt = Instant.now();
}
