package com.chainbills.ledger.event;

import lombok.Value;

@Value
public class PayableReopenedEvent {
    String payableId;
    String host;
}
