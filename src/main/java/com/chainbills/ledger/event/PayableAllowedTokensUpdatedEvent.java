package com.chainbills.ledger.event;

import lombok.Value;

@Value
public class PayableAllowedTokensUpdatedEvent {
    String payableId;
    int allowedCount;
}
