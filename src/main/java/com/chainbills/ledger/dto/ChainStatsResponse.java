package com.chainbills.ledger.dto;

import com.chainbills.ledger.entity.ChainStats;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ChainStatsResponse {
    private int chainId;
    private long usersCount;
    private long payablesCount;
    private long paymentsCount;
    private long withdrawalsCount;

    public static ChainStatsResponse from(ChainStats s) {
        return new ChainStatsResponse(s.getChainId(), s.getUsersCount(), s.getPayablesCount(),
                s.getPaymentsCount(), s.getWithdrawalsCount());
    }
}
