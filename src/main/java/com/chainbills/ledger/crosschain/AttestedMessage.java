package com.chainbills.ledger.crosschain;

import lombok.Value;

/**
 * A message whose origin has been verified. The ledger trusts these fields
 * as given and only re-checks their semantic content.
 */
@Value
public class AttestedMessage {
    int emitterChainId;
    String emitterAddress;
    long sequence;
    byte[] payload;
    /** SHA-256 of the attested envelope, hex without prefix. */
    String messageHash;

    /** Key identifying this message across guards and logs. */
    public String guardKey() {
        return emitterChainId + ":" + messageHash;
    }
}
