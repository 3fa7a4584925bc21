package com.chainbills.ledger.service;

import com.chainbills.ledger.config.LedgerProperties;
import com.chainbills.ledger.exception.LedgerException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Proportional withdrawal fee.
 *
 * fee = amount * percent / 100, rounded with the configured mode;
 * net = amount - fee is what leaves custody towards the host.
 * With the default 2% and rounding UP, net equals amount * 98 / 100 truncated.
 */
@Component
public class WithdrawalFeePolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerProperties.WithdrawalFee config;

    public WithdrawalFeePolicy(LedgerProperties properties) {
        this.config = properties.getWithdrawalFee();
    }

    public long fee(long amount, RoundingMode rounding) {
        try {
            return BigDecimal.valueOf(amount)
                    .multiply(BigDecimal.valueOf(config.getPercent()))
                    .divide(HUNDRED, 0, rounding)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw LedgerException.overflow("withdrawal fee", e);
        }
    }

    public long net(long amount, RoundingMode rounding) {
        return amount - fee(amount, rounding);
    }

    /** Fee of a withdrawal requested on this chain. */
    public long localFee(long amount) {
        return fee(amount, config.getRounding());
    }

    /** Fee of a withdrawal requested from another chain. */
    public long crossChainFee(long amount) {
        return fee(amount, config.getCrossChainRounding());
    }
}
