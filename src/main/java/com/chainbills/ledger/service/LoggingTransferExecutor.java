package com.chainbills.ledger.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default executor: records every movement in the log for an external
 * settlement process to pick up.
 */
@Service
@Slf4j
public class LoggingTransferExecutor implements TransferExecutor {

    @Override
    public void execute(TransferInstruction instruction) {
        log.info("[TRANSFER] {} token={}, gross={}, fee={}, net={}, counterparty={}@{}, ref={}",
                instruction.getDirection(), instruction.getToken(), instruction.getGrossAmount(),
                instruction.getFee(), instruction.getNetAmount(), instruction.getCounterparty(),
                instruction.getCounterpartyChainId(), instruction.getReference());
    }
}
