package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.ReceivedMessage;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Durable replay guard for attested messages.
 *
 * Purpose:
 *  - Source of truth across nodes and restarts for "has this message been applied".
 *  - The unique constraint on (emitterChainId, messageHash) rejects a second insert
 *    even if two deliveries race past the lookup.
 */
public interface ReceivedMessageRepository extends JpaRepository<ReceivedMessage, Long> {

    boolean existsByEmitterChainIdAndMessageHash(int emitterChainId, String messageHash);
}
