package com.chainbills.ledger.event;

import lombok.Value;

/**
 * A committed payment with the sequence numbers captured at commit.
 */
@Value
public class PaymentRecordedEvent {
    String paymentId;
    String payableId;
    String payer;
    int payerChainId;
    long chainCount;
    long payerCount;
    long payableCount;
    long localChainCount;
}
