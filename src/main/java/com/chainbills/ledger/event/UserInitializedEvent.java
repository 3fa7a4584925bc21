package com.chainbills.ledger.event;

import lombok.Value;

@Value
public class UserInitializedEvent {
    int chainId;
    String wallet;
    long chainCount;
}
