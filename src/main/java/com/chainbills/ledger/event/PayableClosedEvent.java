package com.chainbills.ledger.event;

import lombok.Value;

@Value
public class PayableClosedEvent {
    String payableId;
    String host;
}
