package com.chainbills.ledger.dto;

import com.chainbills.ledger.entity.PayablePayment;
import com.chainbills.ledger.entity.UserPayment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Either view of a payment. Counts not carried by a view are null.
 */
@Getter
@Builder
@AllArgsConstructor
public class PaymentResponse {
    private String id;
    private String payableId;
    private String payer;
    private int payerChainId;
    private Long chainCount;
    private long payerCount;
    private long payableCount;
    private Long localChainCount;
    private String token;
    private long amount;
    private Instant timestamp;

    public static PaymentResponse from(UserPayment p) {
        return PaymentResponse.builder()
                .id(p.getId())
                .payableId(p.getPayableId())
                .payer(p.getPayer())
                .payerChainId(p.getPayerChainId())
                .chainCount(p.getChainCount())
                .payerCount(p.getPayerCount())
                .payableCount(p.getPayableCount())
                .token(p.getDetails().getToken())
                .amount(p.getDetails().getAmount())
                .timestamp(p.getTimestamp())
                .build();
    }

    public static PaymentResponse from(PayablePayment p) {
        return PaymentResponse.builder()
                .id(p.getId())
                .payableId(p.getPayableId())
                .payer(p.getPayer())
                .payerChainId(p.getPayerChainId())
                .payerCount(p.getPayerCount())
                .payableCount(p.getPayableCount())
                .localChainCount(p.getLocalChainCount())
                .token(p.getDetails().getToken())
                .amount(p.getDetails().getAmount())
                .timestamp(p.getTimestamp())
                .build();
    }
}
