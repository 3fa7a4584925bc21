package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.entity.Payable;
import com.chainbills.ledger.entity.ReceivedMessage;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.repository.ReceivedMessageRepository;
import com.chainbills.ledger.service.AddressService;
import com.chainbills.ledger.util.HexUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Gatekeeper for attested messages before they touch ledger state.
 *
 * Checks, first failure wins:
 *  (a) the message was never applied (DUPLICATE_MESSAGE);
 *  (b) the payload carries the expected action (INVALID_ACTION_ID);
 *  (c) the decoded caller is non-zero and is the account the request names (INVALID_CALLER_ADDRESS);
 *  (d) the decoded payable id is the targeted payable (NOT_MATCHING_PAYABLE_ID).
 *
 * {@link #markApplied} records the message in the replay table. Callers invoke it inside
 * the same transaction that applies the effect, so both commit or neither does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrossChainMessageValidator {

    private final ReceivedMessageRepository receivedRepo;
    private final PayloadCodec codec;
    private final AddressService addressService;

    @Transactional(propagation = Propagation.MANDATORY)
    public VerifiedMessage verify(AttestedMessage message, ActionType expected, String expectedCaller) {
        if (receivedRepo.existsByEmitterChainIdAndMessageHash(message.getEmitterChainId(), message.getMessageHash())) {
            log.warn("[XCHAIN] Duplicate message. key={}", message.guardKey());
            throw new LedgerException(LedgerError.DUPLICATE_MESSAGE,
                    "Message already applied: " + message.guardKey());
        }

        ActionType action = codec.actionOf(message.getPayload());
        if (action != expected) {
            throw new LedgerException(LedgerError.INVALID_ACTION_ID,
                    "Expected " + expected + " but message carries " + action);
        }
        CrossChainPayload payload = codec.decode(message.getPayload());

        if (addressService.isZero(payload.getCaller())) {
            throw new LedgerException(LedgerError.INVALID_CALLER_ADDRESS, "Zero caller address");
        }
        if (!payload.getCaller().equals(universalOrReject(expectedCaller))) {
            throw new LedgerException(LedgerError.INVALID_CALLER_ADDRESS,
                    "Message caller " + payload.getCaller() + " does not match " + expectedCaller);
        }
        return new VerifiedMessage(message, payload);
    }

    /** Ids compare in their normalized form, with or without the 0x prefix. */
    public void requireMatchingPayable(VerifiedMessage verified, String payableId) {
        String decoded = verified.getPayload().getPayableId();
        if (decoded == null || payableId == null || payableId.isBlank()
                || !HexUtils.strip(decoded).equals(HexUtils.strip(payableId))) {
            throw new LedgerException(LedgerError.NOT_MATCHING_PAYABLE_ID,
                    "Message targets " + decoded + ", request targets " + payableId);
        }
    }

    /** The message caller on its emitter chain must be the payable's host. */
    public void requireHost(VerifiedMessage verified, Payable payable) {
        if (!payable.isHostedBy(verified.getEmitterChainId(), verified.getCaller())) {
            throw new LedgerException(LedgerError.UNAUTHORIZED_CALLER_ADDRESS,
                    "Caller " + verified.getCaller() + " on chain " + verified.getEmitterChainId()
                            + " does not host payable " + payable.getId());
        }
    }

    /**
     * Moves the message to APPLIED. Flushes so a racing duplicate fails on the
     * unique constraint before the surrounding transaction commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void markApplied(VerifiedMessage verified, String reference) {
        AttestedMessage message = verified.getMessage();
        ReceivedMessage row = new ReceivedMessage();
        row.setEmitterChainId(message.getEmitterChainId());
        row.setMessageHash(message.getMessageHash());
        row.setActionId(verified.getPayload().getAction().getId());
        row.setReference(reference);
        receivedRepo.saveAndFlush(row);
        verified.markApplied();
        log.info("[XCHAIN] Applied. key={}, action={}, reference={}",
                message.guardKey(), verified.getPayload().getAction(), reference);
    }

    private String universalOrReject(String caller) {
        try {
            return addressService.toUniversal(caller);
        } catch (LedgerException e) {
            throw new LedgerException(LedgerError.INVALID_CALLER_ADDRESS, "Invalid caller address: " + caller, e);
        }
    }
}
