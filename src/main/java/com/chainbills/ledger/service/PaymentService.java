package com.chainbills.ledger.service;

import com.chainbills.ledger.crosschain.ActionType;
import com.chainbills.ledger.crosschain.AttestedMessage;
import com.chainbills.ledger.crosschain.CrossChainMessageValidator;
import com.chainbills.ledger.crosschain.CrossChainPayload;
import com.chainbills.ledger.crosschain.VerifiedMessage;
import com.chainbills.ledger.dto.PaymentResponse;
import com.chainbills.ledger.entity.ChainStats;
import com.chainbills.ledger.entity.CounterScope;
import com.chainbills.ledger.entity.Payable;
import com.chainbills.ledger.entity.PayablePayment;
import com.chainbills.ledger.entity.TokenAndAmount;
import com.chainbills.ledger.entity.User;
import com.chainbills.ledger.entity.UserPayment;
import com.chainbills.ledger.event.PaymentRecordedEvent;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.repository.PayablePaymentRepository;
import com.chainbills.ledger.repository.UserPaymentRepository;
import com.chainbills.ledger.util.EntityKind;
import com.chainbills.ledger.util.IdUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Payment recorder.
 *
 * Responsibilities:
 *  - Validates a payment against its payable, first failing check wins:
 *      1) payable exists, 2) payable open, 3) amount positive,
 *      4) token supported, 5) exact match in a non-empty allowed set.
 *  - Commits in one transaction: four sequence counters, the payable balance,
 *    both payment-id lists, the payer-side and payable-side payment records.
 *  - Queues the incoming movement; {@link TransferDispatcher} hands it to the executor after commit.
 *
 * Notes:
 *  - Remote payments are verified by {@link CrossChainMessageValidator} before any of the above,
 *    and the message is marked applied in the same transaction.
 *  - Balance addition is exact: an overflow aborts the payment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PayableService payableService;
    private final ChainStatsService chainStatsService;
    private final UserService userService;
    private final CounterRegistry counters;
    private final TokenRegistry tokenRegistry;
    private final AddressService addressService;
    private final CrossChainMessageValidator validator;
    private final UserPaymentRepository userPaymentRepo;
    private final PayablePaymentRepository payablePaymentRepo;
    private final ApplicationEventPublisher events;

    /**
     * Pays a payable from a wallet of this chain.
     *
     * @param payer     calling wallet, local form
     * @param payableId target payable
     * @param token     local token address
     * @param amount    exact amount in the token's smallest unit
     * @return the payer-side payment record
     */
    @Transactional
    public PaymentResponse pay(String payer, String payableId, String token, long amount) {
        String wallet = addressService.normalizeLocal(payer);
        log.info("[PAYMENT] Start pay. payer={}, payableId={}, token={}, amount={}", wallet, payableId, token, amount);

        Payable payable = payableService.requirePayableForUpdate(payableId);
        String checkedToken = validatePayment(payable, token, amount);

        UserPayment recorded = record(payable, chainStatsService.getChainId(), wallet, checkedToken, amount,
                TransferDirection.PAYMENT_IN);
        return PaymentResponse.from(recorded);
    }

    /**
     * Records a payment made on the message's emitter chain.
     *
     * @param message   attested PAY message
     * @param payableId payable the relayer targets
     * @param caller    remote payer, 32-byte form
     * @param token     local token the payment is accounted in
     * @param amount    amount the payment is accounted for
     */
    @Transactional
    public PaymentResponse payReceived(AttestedMessage message, String payableId, String caller,
                                       String token, long amount) {
        log.info("[PAYMENT] Start pay from message. key={}, payableId={}", message.guardKey(), payableId);

        VerifiedMessage verified = validator.verify(message, ActionType.PAY, caller);
        validator.requireMatchingPayable(verified, payableId);
        requireMatchingTransfer(verified.getPayload(), token, amount);

        Payable payable = payableService.requirePayableForUpdate(payableId);
        String checkedToken = validatePayment(payable, token, amount);

        UserPayment recorded = record(payable, verified.getEmitterChainId(), verified.getCaller(), checkedToken,
                amount, TransferDirection.BRIDGED_PAYMENT_IN);
        validator.markApplied(verified, recorded.getId());
        return PaymentResponse.from(recorded);
    }

    // ---------- Helpers ----------

    /** @return the normalized token */
    private String validatePayment(Payable payable, String token, long amount) {
        if (payable.isClosed()) {
            throw new LedgerException(LedgerError.PAYABLE_IS_CLOSED, "Payable is closed: " + payable.getId());
        }
        if (amount <= 0) {
            throw new LedgerException(LedgerError.ZERO_AMOUNT_SPECIFIED);
        }
        String normalized = tokenRegistry.requireSupported(token);
        if (!payable.getAllowedTokensAndAmounts().isEmpty()
                && !payable.getAllowedTokensAndAmounts().contains(new TokenAndAmount(normalized, amount))) {
            throw new LedgerException(LedgerError.MATCHING_TOKEN_AND_AMOUNT_NOT_FOUND,
                    "No allowed entry for " + amount + " of " + normalized);
        }
        return normalized;
    }

    private void requireMatchingTransfer(CrossChainPayload payload, String token, long amount) {
        String universal;
        try {
            universal = addressService.toUniversal(token);
        } catch (LedgerException e) {
            throw new LedgerException(LedgerError.NOT_MATCHING_TRANSACTION_TOKEN, "Invalid token: " + token, e);
        }
        if (!universal.equals(payload.getToken())) {
            throw new LedgerException(LedgerError.NOT_MATCHING_TRANSACTION_TOKEN,
                    "Message token " + payload.getToken() + " does not match " + token);
        }
        if (payload.getAmount() == null || payload.getAmount() != amount) {
            throw new LedgerException(LedgerError.NOT_MATCHING_TRANSACTION_AMOUNT,
                    "Message amount " + payload.getAmount() + " does not match " + amount);
        }
    }

    /**
     * All writes of a payment. Nothing here may fail after a partial write
     * except by exception, which rolls the whole transaction back.
     */
    private UserPayment record(Payable payable, int payerChainId, String payer, String token, long amount,
                               TransferDirection direction) {
        long newBalance;
        try {
            newBalance = Math.addExact(payable.getBalances().getOrDefault(token, 0L), amount);
        } catch (ArithmeticException e) {
            throw LedgerException.overflow("payable balance", e);
        }

        ChainStats stats = chainStatsService.loadForUpdate();
        User user = userService.loadOrInitialize(stats, payerChainId, payer);

        long chainCount = counters.next(CounterScope.CHAIN_PAYMENTS, CounterRegistry.chainScope(stats.getChainId()));
        long payerCount = counters.next(CounterScope.USER_PAYMENTS, CounterRegistry.userScope(payerChainId, payer));
        long payableCount = counters.next(CounterScope.PAYABLE_PAYMENTS, payable.getId());
        long localChainCount = counters.next(CounterScope.PAYABLE_CHAIN_PAYMENTS,
                CounterRegistry.payableChainScope(payable.getId(), payerChainId));

        String universalPayer = addressService.toUniversal(payer);
        String paymentId = IdUtils.create(EntityKind.PAYMENT, payerChainId, universalPayer, payerCount);
        Instant now = Instant.now();

        stats.setPaymentsCount(chainCount);
        user.setPaymentsCount(payerCount);
        user.getPaymentIds().add(paymentId);
        payable.setPaymentsCount(payableCount);
        payable.getBalances().put(token, newBalance);
        payable.getPaymentIds().add(paymentId);

        UserPayment userPayment = new UserPayment();
        userPayment.setId(paymentId);
        userPayment.setPayableId(payable.getId());
        userPayment.setPayer(payer);
        userPayment.setPayerChainId(payerChainId);
        userPayment.setPayableChainId(stats.getChainId());
        userPayment.setChainCount(chainCount);
        userPayment.setPayerCount(payerCount);
        userPayment.setPayableCount(payableCount);
        userPayment.setDetails(new TokenAndAmount(token, amount));
        userPayment.setTimestamp(now);
        UserPayment saved = userPaymentRepo.save(userPayment);

        PayablePayment payablePayment = new PayablePayment();
        payablePayment.setId(paymentId);
        payablePayment.setPayableId(payable.getId());
        payablePayment.setPayer(universalPayer);
        payablePayment.setPayerChainId(payerChainId);
        payablePayment.setLocalChainCount(localChainCount);
        payablePayment.setPayableCount(payableCount);
        payablePayment.setPayerCount(payerCount);
        payablePayment.setDetails(new TokenAndAmount(token, amount));
        payablePayment.setTimestamp(now);
        payablePaymentRepo.save(payablePayment);

        events.publishEvent(TransferInstruction.builder()
                .direction(direction)
                .token(token)
                .grossAmount(amount)
                .fee(0L)
                .netAmount(amount)
                .counterparty(payer)
                .counterpartyChainId(payerChainId)
                .reference(paymentId)
                .build());

        log.info("[PAYMENT] Completed. paymentId={}, payableId={}, chainCount={}, payerCount={}, payableCount={}",
                paymentId, payable.getId(), chainCount, payerCount, payableCount);
        events.publishEvent(new PaymentRecordedEvent(paymentId, payable.getId(), payer, payerChainId,
                chainCount, payerCount, payableCount, localChainCount));
        return saved;
    }
}
