package com.chainbills.ledger.crosschain;

import lombok.Getter;

/**
 * An attested message that passed the replay, action and caller checks.
 * Moves to {@link MessageState#APPLIED} once its effect is recorded.
 */
@Getter
public class VerifiedMessage {

    private final AttestedMessage message;
    private final CrossChainPayload payload;
    private MessageState state = MessageState.VERIFIED;

    public VerifiedMessage(AttestedMessage message, CrossChainPayload payload) {
        this.message = message;
        this.payload = payload;
    }

    public int getEmitterChainId() {
        return message.getEmitterChainId();
    }

    /** Caller in its 32-byte form. */
    public String getCaller() {
        return payload.getCaller();
    }

    void markApplied() {
        this.state = MessageState.APPLIED;
    }
}
