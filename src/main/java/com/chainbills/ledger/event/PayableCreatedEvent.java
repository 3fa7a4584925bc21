package com.chainbills.ledger.event;

import lombok.Value;

@Value
public class PayableCreatedEvent {
    String payableId;
    String host;
    int hostChainId;
    long chainCount;
    long hostCount;
}
