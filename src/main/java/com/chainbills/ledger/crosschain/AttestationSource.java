package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.dto.SignedMessage;

/**
 * Turns a raw relayed envelope into an {@link AttestedMessage}, or rejects it.
 */
public interface AttestationSource {

    /**
     * @throws com.chainbills.ledger.exception.LedgerException INVALID_ATTESTATION or
     *         UNREGISTERED_EMITTER when the envelope cannot be trusted
     */
    AttestedMessage verify(SignedMessage message);
}
