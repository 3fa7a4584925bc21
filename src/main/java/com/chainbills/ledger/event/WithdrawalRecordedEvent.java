package com.chainbills.ledger.event;

import lombok.Value;

/**
 * A committed withdrawal with the sequence numbers captured at commit.
 */
@Value
public class WithdrawalRecordedEvent {
    String withdrawalId;
    String payableId;
    String host;
    long chainCount;
    long hostCount;
    long payableCount;
}
