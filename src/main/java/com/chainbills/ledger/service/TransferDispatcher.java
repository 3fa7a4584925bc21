package com.chainbills.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands queued transfers to the {@link TransferExecutor} once their ledger transaction has committed.
 * Instructions of a rolled back operation, including a relayed message that lost a
 * replay race at flush time, are dropped with the transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferDispatcher {

    private final TransferExecutor transferExecutor;

    @TransactionalEventListener
    public void onTransfer(TransferInstruction instruction) {
        try {
            transferExecutor.execute(instruction);
        } catch (RuntimeException e) {
            log.error("[TRANSFER] Dispatch failed after commit, needs manual settlement. ref={}, direction={}, net={}",
                    instruction.getReference(), instruction.getDirection(), instruction.getNetAmount(), e);
            throw e;
        }
    }
}
