package com.chainbills.ledger.service;

import com.chainbills.ledger.crosschain.ActionType;
import com.chainbills.ledger.crosschain.AttestedMessage;
import com.chainbills.ledger.crosschain.CrossChainMessageValidator;
import com.chainbills.ledger.crosschain.CrossChainPayload;
import com.chainbills.ledger.crosschain.VerifiedMessage;
import com.chainbills.ledger.dto.WithdrawalResponse;
import com.chainbills.ledger.entity.ChainStats;
import com.chainbills.ledger.entity.CounterScope;
import com.chainbills.ledger.entity.Payable;
import com.chainbills.ledger.entity.TokenAndAmount;
import com.chainbills.ledger.entity.User;
import com.chainbills.ledger.entity.Withdrawal;
import com.chainbills.ledger.event.WithdrawalRecordedEvent;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.repository.WithdrawalRepository;
import com.chainbills.ledger.util.EntityKind;
import com.chainbills.ledger.util.IdUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Withdrawal processor.
 *
 * Responsibilities:
 *  - Host-only withdrawals of accumulated balances, open or closed payable alike.
 *  - Deducts the gross amount from the payable; the fee is computed by
 *    {@link WithdrawalFeePolicy} and only the net amount leaves custody.
 *  - Remote withdrawals additionally check the host's next withdrawal count
 *    and the token/amount carried by the attested message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalService {

    private final PayableService payableService;
    private final ChainStatsService chainStatsService;
    private final UserService userService;
    private final CounterRegistry counters;
    private final TokenRegistry tokenRegistry;
    private final AddressService addressService;
    private final CrossChainMessageValidator validator;
    private final WithdrawalFeePolicy feePolicy;
    private final WithdrawalRepository withdrawalRepo;
    private final ApplicationEventPublisher events;

    /**
     * Withdraws from a payable hosted by a wallet of this chain.
     *
     * @param caller    calling wallet, local form
     * @param payableId payable to withdraw from
     * @param token     local token address
     * @param amount    gross amount deducted from the balance
     */
    @Transactional
    public WithdrawalResponse withdraw(String caller, String payableId, String token, long amount) {
        String wallet = addressService.normalizeLocal(caller);
        log.info("[WITHDRAWAL] Start withdraw. host={}, payableId={}, token={}, amount={}",
                wallet, payableId, token, amount);

        Payable payable = payableService.requirePayableForUpdate(payableId);
        int chainId = chainStatsService.getChainId();
        if (!payable.isHostedBy(chainId, wallet)) {
            log.warn("[WITHDRAWAL] Rejected non-host caller. payableId={}, caller={}", payable.getId(), wallet);
            throw new LedgerException(LedgerError.NOT_YOUR_PAYABLE,
                    "Wallet " + wallet + " does not host payable " + payable.getId());
        }
        String checkedToken = validateWithdrawal(payable, token, amount);

        Withdrawal recorded = record(payable, chainId, wallet, checkedToken, amount,
                feePolicy.localFee(amount), TransferDirection.WITHDRAWAL_OUT, null);
        return WithdrawalResponse.from(recorded);
    }

    /**
     * Withdraws on behalf of a host living on the message's emitter chain.
     *
     * @param hostCount the host's next withdrawal count as the relayer computed it
     */
    @Transactional
    public WithdrawalResponse withdrawReceived(AttestedMessage message, String payableId, String caller,
                                               String token, long amount, long hostCount) {
        log.info("[WITHDRAWAL] Start withdraw from message. key={}, payableId={}, hostCount={}",
                message.guardKey(), payableId, hostCount);

        VerifiedMessage verified = validator.verify(message, ActionType.WITHDRAW, caller);
        validator.requireMatchingPayable(verified, payableId);
        Payable payable = payableService.requirePayableForUpdate(payableId);
        validator.requireHost(verified, payable);

        int hostChainId = verified.getEmitterChainId();
        String host = verified.getCaller();
        long expected = counters.peekNext(CounterScope.USER_WITHDRAWALS, CounterRegistry.userScope(hostChainId, host));
        if (hostCount != expected) {
            throw new LedgerException(LedgerError.WRONG_WITHDRAWALS_HOST_COUNT_PROVIDED,
                    "Expected host withdrawal count " + expected + " but got " + hostCount);
        }
        requireMatchingTransfer(verified.getPayload(), token, amount);
        String checkedToken = validateWithdrawal(payable, token, amount);

        Withdrawal recorded = record(payable, hostChainId, host, checkedToken, amount,
                feePolicy.crossChainFee(amount), TransferDirection.BRIDGED_WITHDRAWAL_OUT, hostCount);
        validator.markApplied(verified, recorded.getId());
        return WithdrawalResponse.from(recorded);
    }

    // ---------- Helpers ----------

    /** Zero amount, then missing balance, then insufficient balance. */
    private String validateWithdrawal(Payable payable, String token, long amount) {
        if (amount <= 0) {
            throw new LedgerException(LedgerError.ZERO_AMOUNT_SPECIFIED);
        }
        String normalized = tokenRegistry.normalize(token);
        Long balance = payable.getBalances().get(normalized);
        if (balance == null) {
            throw new LedgerException(LedgerError.NO_BALANCE_FOR_WITHDRAWAL_TOKEN,
                    "Payable " + payable.getId() + " holds no " + normalized);
        }
        if (balance < amount) {
            throw new LedgerException(LedgerError.INSUFFICIENT_WITHDRAW_AMOUNT,
                    "Requested " + amount + " but balance is " + balance);
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

    private Withdrawal record(Payable payable, int hostChainId, String host, String token, long amount, long fee,
                              TransferDirection direction, Long expectedHostCount) {
        ChainStats stats = chainStatsService.loadForUpdate();
        User user = userService.loadOrInitialize(stats, hostChainId, host);

        long chainCount = counters.next(CounterScope.CHAIN_WITHDRAWALS, CounterRegistry.chainScope(stats.getChainId()));
        long hostCount = counters.next(CounterScope.USER_WITHDRAWALS, CounterRegistry.userScope(hostChainId, host));
        long payableCount = counters.next(CounterScope.PAYABLE_WITHDRAWALS, payable.getId());
        if (expectedHostCount != null && expectedHostCount != hostCount) {
            // another withdrawal of the same host committed since the early check
            throw new LedgerException(LedgerError.WRONG_WITHDRAWALS_HOST_COUNT_PROVIDED,
                    "Expected host withdrawal count " + hostCount + " but got " + expectedHostCount);
        }

        String withdrawalId = IdUtils.create(EntityKind.WITHDRAWAL, hostChainId,
                addressService.toUniversal(host), hostCount);

        // gross amount leaves the balance; the entry stays at zero after a full withdrawal
        payable.getBalances().put(token, payable.getBalances().get(token) - amount);
        payable.setWithdrawalsCount(payableCount);
        payable.getWithdrawalIds().add(withdrawalId);
        stats.setWithdrawalsCount(chainCount);
        user.setWithdrawalsCount(hostCount);

        Withdrawal withdrawal = new Withdrawal();
        withdrawal.setId(withdrawalId);
        withdrawal.setChainCount(chainCount);
        withdrawal.setPayableId(payable.getId());
        withdrawal.setPayableCount(payableCount);
        withdrawal.setHost(host);
        withdrawal.setHostChainId(hostChainId);
        withdrawal.setHostCount(hostCount);
        withdrawal.setDetails(new TokenAndAmount(token, amount));
        withdrawal.setFee(fee);
        withdrawal.setTimestamp(Instant.now());
        Withdrawal saved = withdrawalRepo.save(withdrawal);

        events.publishEvent(TransferInstruction.builder()
                .direction(direction)
                .token(token)
                .grossAmount(amount)
                .fee(fee)
                .netAmount(amount - fee)
                .counterparty(host)
                .counterpartyChainId(hostChainId)
                .reference(withdrawalId)
                .build());

        log.info("[WITHDRAWAL] Completed. withdrawalId={}, payableId={}, gross={}, fee={}, chainCount={}, hostCount={}",
                withdrawalId, payable.getId(), amount, fee, chainCount, hostCount);
        events.publishEvent(new WithdrawalRecordedEvent(withdrawalId, payable.getId(), host,
                chainCount, hostCount, payableCount));
        return saved;
    }
}
