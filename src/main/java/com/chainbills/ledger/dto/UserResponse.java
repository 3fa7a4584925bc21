package com.chainbills.ledger.dto;

import com.chainbills.ledger.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class UserResponse {
    private String wallet;
    private int chainId;
    private long chainCount;
    private long payablesCount;
    private long paymentsCount;
    private long withdrawalsCount;

    public static UserResponse from(User u) {
        return UserResponse.builder()
                .wallet(u.getWallet())
                .chainId(u.getChainId())
                .chainCount(u.getChainCount())
                .payablesCount(u.getPayablesCount())
                .paymentsCount(u.getPaymentsCount())
                .withdrawalsCount(u.getWithdrawalsCount())
                .build();
    }
}
