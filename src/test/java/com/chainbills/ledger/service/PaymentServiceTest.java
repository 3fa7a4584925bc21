package com.chainbills.ledger.service;

import com.chainbills.ledger.config.LedgerProperties;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PaymentService.
 * Pure Mockito-based tests (no Spring context); address and token handling are real.
 */
@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    private static final int CHAIN_ID = 2;
    private static final String TOKEN_A = "0x1111111111111111111111111111111111111111";
    private static final String TOKEN_B = "0x2222222222222222222222222222222222222222";
    private static final String UNSUPPORTED = "0x3333333333333333333333333333333333333333";
    private static final String PAYER = "0xabababababababababababababababababababab";
    private static final String REMOTE_PAYER = "0x" + "0".repeat(24) + "cdcdcdcdcdcdcdcdcdcdcdcdcdcdcdcdcdcdcdcd";
    private static final String PAYABLE_ID = "0x" + "77".repeat(32);

    @Mock private PayableService payableService;
    @Mock private ChainStatsService chainStatsService;
    @Mock private UserService userService;
    @Mock private CounterRegistry counters;
    @Mock private CrossChainMessageValidator validator;
    @Mock private UserPaymentRepository userPaymentRepo;
    @Mock private PayablePaymentRepository payablePaymentRepo;
    @Mock private ApplicationEventPublisher events;

    private PaymentService paymentService;
    private Payable payable;
    private ChainStats stats;
    private User payerUser;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        properties.setChainId(CHAIN_ID);
        properties.setSupportedTokens(List.of(TOKEN_A, TOKEN_B));
        EvmAddressService addressService = new EvmAddressService();
        TokenRegistry tokenRegistry = new TokenRegistry(properties, addressService);

        paymentService = new PaymentService(payableService, chainStatsService, userService, counters, tokenRegistry,
                addressService, validator, userPaymentRepo, payablePaymentRepo, events);

        payable = new Payable();
        payable.setId(PAYABLE_ID);
        payable.setHost("0x9999999999999999999999999999999999999999");
        payable.setHostChainId(CHAIN_ID);
        payable.getAllowedTokensAndAmounts().add(new TokenAndAmount(TOKEN_A, 100L));

        stats = new ChainStats(CHAIN_ID);
        payerUser = new User();
    }

    // ============ Happy Path ============

    @Test
    void pay_success_commitsCountersBalanceListsAndRecords() {
        stubCommit(CHAIN_ID, PAYER);

        PaymentResponse resp = paymentService.pay(PAYER, PAYABLE_ID, TOKEN_A, 100L);

        assertThat(resp.getPayableId()).isEqualTo(PAYABLE_ID);
        assertThat(resp.getPayer()).isEqualTo(PAYER);
        assertThat(resp.getChainCount()).isEqualTo(10L);
        assertThat(resp.getPayerCount()).isEqualTo(3L);
        assertThat(resp.getPayableCount()).isEqualTo(1L);
        assertThat(resp.getAmount()).isEqualTo(100L);

        assertThat(payable.getBalances()).containsEntry(TOKEN_A, 100L);
        assertThat(payable.getPaymentsCount()).isEqualTo(1L);
        assertThat(payable.getPaymentIds()).containsExactly(resp.getId());
        assertThat(payerUser.getPaymentIds()).containsExactly(resp.getId());
        assertThat(payerUser.getPaymentsCount()).isEqualTo(3L);
        assertThat(stats.getPaymentsCount()).isEqualTo(10L);

        ArgumentCaptor<PayablePayment> cap = ArgumentCaptor.forClass(PayablePayment.class);
        verify(payablePaymentRepo).save(cap.capture());
        assertThat(cap.getValue().getId()).isEqualTo(resp.getId());
        assertThat(cap.getValue().getPayer()).isEqualTo("0x" + "0".repeat(24) + PAYER.substring(2));
        assertThat(cap.getValue().getLocalChainCount()).isEqualTo(1L);

        TransferInstruction transfer = publishedTransfer();
        assertThat(transfer.getDirection()).isEqualTo(TransferDirection.PAYMENT_IN);
        assertThat(transfer.getNetAmount()).isEqualTo(100L);
        assertThat(transfer.getReference()).isEqualTo(resp.getId());

        verify(events).publishEvent(any(PaymentRecordedEvent.class));
    }

    @Test
    void pay_addsToExistingBalance() {
        payable.getAllowedTokensAndAmounts().clear();
        payable.getBalances().put(TOKEN_B, 40L);
        stubCommit(CHAIN_ID, PAYER);

        paymentService.pay(PAYER, PAYABLE_ID, TOKEN_B, 2L);

        assertThat(payable.getBalances()).containsEntry(TOKEN_B, 42L);
    }

    @Test
    void pay_emptyAllowedSet_acceptsAnySupportedTokenAndAmount() {
        payable.getAllowedTokensAndAmounts().clear();
        stubCommit(CHAIN_ID, PAYER);

        paymentService.pay(PAYER, PAYABLE_ID, TOKEN_B, 12345L);

        assertThat(payable.getBalances()).containsEntry(TOKEN_B, 12345L);
    }

    // ============ Validation Order ============

    @Test
    void pay_unknownPayable_isInvalidPayableId() {
        when(payableService.requirePayableForUpdate(PAYABLE_ID))
                .thenThrow(new LedgerException(LedgerError.INVALID_PAYABLE_ID));

        assertError(() -> paymentService.pay(PAYER, PAYABLE_ID, TOKEN_A, 100L), LedgerError.INVALID_PAYABLE_ID);
        verifyNoInteractions(counters, userPaymentRepo);
        verify(events, never()).publishEvent(any(TransferInstruction.class));
    }

    @Test
    void pay_closedPayable_winsOverZeroAmount() {
        payable.setClosed(true);
        when(payableService.requirePayableForUpdate(PAYABLE_ID)).thenReturn(payable);

        assertError(() -> paymentService.pay(PAYER, PAYABLE_ID, UNSUPPORTED, 0L), LedgerError.PAYABLE_IS_CLOSED);
        assertThat(payable.getBalances()).isEmpty();
        verifyNoInteractions(counters);
    }

    @Test
    void pay_zeroAmount_winsOverUnsupportedToken() {
        when(payableService.requirePayableForUpdate(PAYABLE_ID)).thenReturn(payable);

        assertError(() -> paymentService.pay(PAYER, PAYABLE_ID, UNSUPPORTED, 0L), LedgerError.ZERO_AMOUNT_SPECIFIED);
    }

    @Test
    void pay_unsupportedToken_isInvalidToken() {
        when(payableService.requirePayableForUpdate(PAYABLE_ID)).thenReturn(payable);

        assertError(() -> paymentService.pay(PAYER, PAYABLE_ID, UNSUPPORTED, 100L), LedgerError.INVALID_TOKEN);
    }

    @Test
    void pay_amountNotInAllowedSet_isNotFound() {
        when(payableService.requirePayableForUpdate(PAYABLE_ID)).thenReturn(payable);

        assertError(() -> paymentService.pay(PAYER, PAYABLE_ID, TOKEN_A, 50L),
                LedgerError.MATCHING_TOKEN_AND_AMOUNT_NOT_FOUND);
        assertError(() -> paymentService.pay(PAYER, PAYABLE_ID, TOKEN_B, 100L),
                LedgerError.MATCHING_TOKEN_AND_AMOUNT_NOT_FOUND);
        assertThat(payable.getBalances()).isEmpty();
    }

    @Test
    void pay_balanceOverflow_abortsBeforeAnyCounter() {
        payable.getAllowedTokensAndAmounts().clear();
        payable.getBalances().put(TOKEN_A, Long.MAX_VALUE);
        when(payableService.requirePayableForUpdate(PAYABLE_ID)).thenReturn(payable);
        when(chainStatsService.getChainId()).thenReturn(CHAIN_ID);

        assertError(() -> paymentService.pay(PAYER, PAYABLE_ID, TOKEN_A, 1L), LedgerError.ARITHMETIC_OVERFLOW);
        assertThat(payable.getBalances()).containsEntry(TOKEN_A, Long.MAX_VALUE);
        verifyNoInteractions(counters);
    }

    // ============ Cross-chain ============

    @Test
    void payReceived_recordsRemotePayerAndMarksMessageApplied() {
        AttestedMessage message = message();
        VerifiedMessage verified = new VerifiedMessage(message, payload(TOKEN_A, 100L));
        when(validator.verify(message, ActionType.PAY, REMOTE_PAYER)).thenReturn(verified);
        stubCommit(1, REMOTE_PAYER);

        PaymentResponse resp = paymentService.payReceived(message, PAYABLE_ID, REMOTE_PAYER, TOKEN_A, 100L);

        assertThat(resp.getPayerChainId()).isEqualTo(1);
        assertThat(resp.getPayer()).isEqualTo(REMOTE_PAYER);
        verify(validator).requireMatchingPayable(verified, PAYABLE_ID);
        verify(validator).markApplied(verified, resp.getId());

        TransferInstruction transfer = publishedTransfer();
        assertThat(transfer.getDirection()).isEqualTo(TransferDirection.BRIDGED_PAYMENT_IN);
        assertThat(transfer.getCounterpartyChainId()).isEqualTo(1);
    }

    @Test
    void payReceived_tokenDifferentFromMessage_isRejectedBeforeLookup() {
        AttestedMessage message = message();
        when(validator.verify(message, ActionType.PAY, REMOTE_PAYER))
                .thenReturn(new VerifiedMessage(message, payload(TOKEN_A, 100L)));

        assertError(() -> paymentService.payReceived(message, PAYABLE_ID, REMOTE_PAYER, TOKEN_B, 100L),
                LedgerError.NOT_MATCHING_TRANSACTION_TOKEN);
        verify(payableService, never()).requirePayableForUpdate(anyString());
        verify(validator, never()).markApplied(any(), anyString());
    }

    @Test
    void payReceived_amountDifferentFromMessage_isRejected() {
        AttestedMessage message = message();
        when(validator.verify(message, ActionType.PAY, REMOTE_PAYER))
                .thenReturn(new VerifiedMessage(message, payload(TOKEN_A, 100L)));

        assertError(() -> paymentService.payReceived(message, PAYABLE_ID, REMOTE_PAYER, TOKEN_A, 99L),
                LedgerError.NOT_MATCHING_TRANSACTION_AMOUNT);
    }

    // ---------- Helpers ----------

    private void stubCommit(int payerChainId, String payer) {
        Map<CounterScope, Long> values = new EnumMap<>(CounterScope.class);
        values.put(CounterScope.CHAIN_PAYMENTS, 10L);
        values.put(CounterScope.USER_PAYMENTS, 3L);
        values.put(CounterScope.PAYABLE_PAYMENTS, 1L);
        values.put(CounterScope.PAYABLE_CHAIN_PAYMENTS, 1L);

        when(payableService.requirePayableForUpdate(PAYABLE_ID)).thenReturn(payable);
        when(chainStatsService.loadForUpdate()).thenReturn(stats);
        when(userService.loadOrInitialize(stats, payerChainId, payer)).thenReturn(payerUser);
        when(counters.next(any(CounterScope.class), anyString()))
                .thenAnswer(inv -> values.get(inv.<CounterScope>getArgument(0)));
        when(userPaymentRepo.save(any(UserPayment.class))).thenAnswer(inv -> inv.getArgument(0));
        if (payerChainId == CHAIN_ID) {
            when(chainStatsService.getChainId()).thenReturn(CHAIN_ID);
        }
    }

    private static CrossChainPayload payload(String localToken, long amount) {
        return CrossChainPayload.builder()
                .action(ActionType.PAY)
                .caller(REMOTE_PAYER)
                .payableId(PAYABLE_ID)
                .token("0x" + "0".repeat(24) + localToken.substring(2))
                .amount(amount)
                .build();
    }

    private static AttestedMessage message() {
        return new AttestedMessage(1, "0x" + "0".repeat(62) + "aa", 5L, new byte[]{4}, "ab".repeat(32));
    }

    private static void assertError(org.assertj.core.api.ThrowableAssert.ThrowingCallable call, LedgerError error) {
        assertThatThrownBy(call)
                .isInstanceOf(LedgerException.class)
                .satisfies(ex -> assertThat(((LedgerException) ex).getError()).isEqualTo(error));
    }

    private TransferInstruction publishedTransfer() {
        ArgumentCaptor<Object> published = ArgumentCaptor.forClass(Object.class);
        verify(events, atLeastOnce()).publishEvent(published.capture());
        return published.getAllValues().stream()
                .filter(TransferInstruction.class::isInstance)
                .map(TransferInstruction.class::cast)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no transfer queued"));
    }
}
