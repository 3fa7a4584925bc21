package com.chainbills.ledger.dto;

import com.chainbills.ledger.entity.Payable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Getter
@Builder
@AllArgsConstructor
public class PayableResponse {
    private String id;
    private long chainCount;
    private String host;
    private int hostChainId;
    private long hostCount;
    private String description;
    private long paymentsCount;
    private long withdrawalsCount;
    private boolean closed;
    private List<TokenAndAmountDto> allowedTokensAndAmounts;
    private Map<String, Long> balances;
    private Instant createdAt;

    public static PayableResponse from(Payable p) {
        return PayableResponse.builder()
                .id(p.getId())
                .chainCount(p.getChainCount())
                .host(p.getHost())
                .hostChainId(p.getHostChainId())
                .hostCount(p.getHostCount())
                .description(p.getDescription())
                .paymentsCount(p.getPaymentsCount())
                .withdrawalsCount(p.getWithdrawalsCount())
                .closed(p.isClosed())
                .allowedTokensAndAmounts(p.getAllowedTokensAndAmounts().stream()
                        .map(TokenAndAmountDto::from)
                        .collect(Collectors.toList()))
                .balances(new LinkedHashMap<>(p.getBalances()))
                .createdAt(p.getCreatedAt())
                .build();
    }
}
