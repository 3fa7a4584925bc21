package com.chainbills.ledger.dto;

import com.chainbills.ledger.entity.Withdrawal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
@AllArgsConstructor
public class WithdrawalResponse {
    private String id;
    private String payableId;
    private String host;
    private int hostChainId;
    private long chainCount;
    private long hostCount;
    private long payableCount;
    private String token;
    /** Gross amount deducted from the payable. */
    private long amount;
    private long fee;
    private long netAmount;
    private Instant timestamp;

    public static WithdrawalResponse from(Withdrawal w) {
        long amount = w.getDetails().getAmount();
        return WithdrawalResponse.builder()
                .id(w.getId())
                .payableId(w.getPayableId())
                .host(w.getHost())
                .hostChainId(w.getHostChainId())
                .chainCount(w.getChainCount())
                .hostCount(w.getHostCount())
                .payableCount(w.getPayableCount())
                .token(w.getDetails().getToken())
                .amount(amount)
                .fee(w.getFee())
                .netAmount(amount - w.getFee())
                .timestamp(w.getTimestamp())
                .build();
    }
}
