package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.Setter;

import javax.persistence.*;
import java.time.Instant;

/**
 * Replay guard row: an attested message that has influenced ledger state.
 *
 * Inserted in the same transaction as the effect it carries, so a message
 * is applied at most once per (emitter chain, hash).
 */
@Entity
@Table(
        name = "received_messages",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_received_chain_hash",
                columnNames = {"emitter_chain_id", "message_hash"}
        )
)
@Getter
@Setter
public class ReceivedMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "emitter_chain_id", nullable = false)
    private int emitterChainId;

    @Column(name = "message_hash", nullable = false, length = 64)
    private String messageHash;

    @Column(nullable = false)
    private int actionId;

    /** Id of the entity the message produced or affected. */
    @Column(length = 66)
    private String reference;

    @Column(nullable = false)
    private Instant appliedAt = Instant.now();
}
