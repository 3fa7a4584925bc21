package com.chainbills.ledger.service;

import com.chainbills.ledger.dto.ChainStatsResponse;
import com.chainbills.ledger.dto.IdResponse;
import com.chainbills.ledger.dto.PayableResponse;
import com.chainbills.ledger.dto.PaymentResponse;
import com.chainbills.ledger.dto.UserResponse;
import com.chainbills.ledger.dto.WithdrawalResponse;
import com.chainbills.ledger.entity.Payable;
import com.chainbills.ledger.entity.User;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.repository.ChainStatsRepository;
import com.chainbills.ledger.repository.PayablePaymentRepository;
import com.chainbills.ledger.repository.PayableRepository;
import com.chainbills.ledger.repository.UserPaymentRepository;
import com.chainbills.ledger.repository.UserRepository;
import com.chainbills.ledger.repository.WithdrawalRepository;
import com.chainbills.ledger.util.HexUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side of the ledger. Counts passed in are 1-based positions.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class LedgerQueryService {

    private final ChainStatsService chainStatsService;
    private final ChainStatsRepository chainStatsRepo;
    private final PayableRepository payableRepo;
    private final UserRepository userRepo;
    private final UserPaymentRepository userPaymentRepo;
    private final PayablePaymentRepository payablePaymentRepo;
    private final WithdrawalRepository withdrawalRepo;
    private final AddressService addressService;

    public ChainStatsResponse chainStats() {
        int chainId = chainStatsService.getChainId();
        return chainStatsRepo.findById(chainId)
                .map(ChainStatsResponse::from)
                .orElseThrow(() -> new IllegalStateException("Chain stats not initialized for chain " + chainId));
    }

    public PayableResponse payable(String payableId) {
        return PayableResponse.from(findPayable(payableId));
    }

    /**
     * @param wallet  local wallet, or a 32-byte address for a remote user
     * @param chainId chain the wallet lives on; null means this chain
     */
    public UserResponse user(String wallet, Integer chainId) {
        return UserResponse.from(findUser(wallet, chainId));
    }

    public IdResponse userPaymentId(String wallet, Integer chainId, long count) {
        User user = findUser(wallet, chainId);
        return new IdResponse(at(user.getPaymentIds(), count, LedgerError.INVALID_USER_PAYMENT_COUNT));
    }

    public IdResponse payablePaymentId(String payableId, long count) {
        Payable payable = findPayable(payableId);
        return new IdResponse(at(payable.getPaymentIds(), count, LedgerError.INVALID_PAYABLE_PAYMENT_COUNT));
    }

    public IdResponse payableWithdrawalId(String payableId, long count) {
        Payable payable = findPayable(payableId);
        return new IdResponse(at(payable.getWithdrawalIds(), count, LedgerError.INVALID_PAYABLE_WITHDRAWAL_COUNT));
    }

    public PaymentResponse userPayment(String paymentId) {
        return userPaymentRepo.findById(normalizeId(paymentId))
                .map(PaymentResponse::from)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_PAYMENT_ID, "Payment not found: " + paymentId));
    }

    public PaymentResponse payablePayment(String paymentId) {
        return payablePaymentRepo.findById(normalizeId(paymentId))
                .map(PaymentResponse::from)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_PAYMENT_ID, "Payment not found: " + paymentId));
    }

    public WithdrawalResponse withdrawal(String withdrawalId) {
        return withdrawalRepo.findById(normalizeId(withdrawalId))
                .map(WithdrawalResponse::from)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_WITHDRAWAL_ID,
                        "Withdrawal not found: " + withdrawalId));
    }

    private Payable findPayable(String payableId) {
        return payableRepo.findById(normalizeId(payableId))
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_PAYABLE_ID, "Payable not found: " + payableId));
    }

    private User findUser(String wallet, Integer chainId) {
        int localChainId = chainStatsService.getChainId();
        int userChainId = chainId == null ? localChainId : chainId;
        String normalized = userChainId == localChainId
                ? addressService.normalizeLocal(wallet)
                : addressService.normalizeUniversal(wallet);
        return userRepo.findByChainIdAndWallet(userChainId, normalized)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_USER,
                        "User not found: " + normalized + "@" + userChainId));
    }

    private static String at(List<String> ids, long count, LedgerError error) {
        if (count < 1 || count > ids.size()) {
            throw new LedgerException(error, "Count " + count + " is outside 1.." + ids.size());
        }
        return ids.get((int) (count - 1));
    }

    private static String normalizeId(String id) {
        return "0x" + HexUtils.strip(id);
    }
}
