package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.dto.PayableResponse;
import com.chainbills.ledger.dto.PaymentResponse;
import com.chainbills.ledger.dto.ReceivedPayableRequest;
import com.chainbills.ledger.dto.ReceivedPaymentRequest;
import com.chainbills.ledger.dto.ReceivedWithdrawalRequest;
import com.chainbills.ledger.dto.SignedMessage;
import com.chainbills.ledger.dto.WithdrawalResponse;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.repository.ReceivedMessageRepository;
import com.chainbills.ledger.service.PayableService;
import com.chainbills.ledger.service.PaymentService;
import com.chainbills.ledger.service.WithdrawalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.function.Function;

/**
 * Entry point for relayed messages.
 *
 * Order of steps:
 *   1) attestation check (signature + registered emitter), no state touched
 *   2) in-flight guard so a concurrent redelivery is turned away early
 *   3) the transactional operation, which re-checks replay and marks the message applied
 *   4) guard released whatever the outcome
 *
 * Not transactional itself: each delegate runs and commits its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrossChainService {

    private final AttestationSource attestation;
    private final MessageGuard guard;
    private final ReceivedMessageRepository receivedRepo;
    private final PayableService payableService;
    private final PaymentService paymentService;
    private final WithdrawalService withdrawalService;

    public PayableResponse createPayable(ReceivedPayableRequest req) {
        return process(req.getMessage(),
                message -> payableService.createPayableReceived(message, req.getCaller()));
    }

    public PayableResponse closePayable(ReceivedPayableRequest req) {
        return process(req.getMessage(),
                message -> payableService.closePayableReceived(message, req.getCaller(), req.getPayableId()));
    }

    public PayableResponse reopenPayable(ReceivedPayableRequest req) {
        return process(req.getMessage(),
                message -> payableService.reopenPayableReceived(message, req.getCaller(), req.getPayableId()));
    }

    public PaymentResponse pay(ReceivedPaymentRequest req) {
        return process(req.getMessage(),
                message -> paymentService.payReceived(message, req.getPayableId(), req.getCaller(),
                        req.getToken(), req.getAmount()));
    }

    public WithdrawalResponse withdraw(ReceivedWithdrawalRequest req) {
        return process(req.getMessage(),
                message -> withdrawalService.withdrawReceived(message, req.getPayableId(), req.getCaller(),
                        req.getToken(), req.getAmount(), req.getHostCount()));
    }

    private <T> T process(SignedMessage envelope, Function<AttestedMessage, T> operation) {
        AttestedMessage message = attestation.verify(envelope);
        String key = message.guardKey();

        if (!guard.tryAcquire(key)) {
            log.warn("[XCHAIN] Message already in flight. key={}", key);
            throw new LedgerException(LedgerError.MESSAGE_IN_FLIGHT, "Message is being processed: " + key);
        }
        try {
            return operation.apply(message);
        } catch (DataIntegrityViolationException e) {
            // a racing delivery on another node committed first
            if (receivedRepo.existsByEmitterChainIdAndMessageHash(message.getEmitterChainId(), message.getMessageHash())) {
                throw new LedgerException(LedgerError.DUPLICATE_MESSAGE, "Message already applied: " + key, e);
            }
            throw e;
        } finally {
            guard.release(key);
            log.debug("[XCHAIN] Released in-flight guard: {}", key);
        }
    }
}
