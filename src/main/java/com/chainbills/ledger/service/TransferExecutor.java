package com.chainbills.ledger.service;

/**
 * Moves tokens between custody and wallets once the ledger has accounted for them.
 * Only called after the ledger transaction has committed, see {@link TransferDispatcher}.
 */
public interface TransferExecutor {

    void execute(TransferInstruction instruction);
}
