package com.chainbills.ledger.controller;

import com.chainbills.ledger.config.RateLimiterService;
import com.chainbills.ledger.dto.PaymentRequest;
import com.chainbills.ledger.dto.PaymentResponse;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.service.LedgerQueryService;
import com.chainbills.ledger.service.PaymentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web-layer tests for {@link PaymentController}.
 *
 * The ledger services and the rate limiter are mocked; the 429 body
 * still comes from the real {@link RateLimiterService#tooManyRequests(String)}.
 */
@SpringBootTest
@AutoConfigureMockMvc(addFilters = false)
@ActiveProfiles("test")
class PaymentControllerTest {

    private static final String WALLET = "0x3333333333333333333333333333333333333333";
    private static final String TOKEN = "0x1111111111111111111111111111111111111111";
    private static final String PAYABLE_ID = "0x" + "77".repeat(32);

    @Autowired private MockMvc mvc;
    @Autowired private ObjectMapper om;

    @MockBean private PaymentService paymentService;
    @MockBean private LedgerQueryService queryService;
    @MockBean private RateLimiterService rateLimiter;

    @BeforeEach
    void setUp() {
        Mockito.when(rateLimiter.tooManyRequests(Mockito.any())).thenCallRealMethod();
    }

    private PaymentRequest validReq() {
        return new PaymentRequest(PAYABLE_ID, TOKEN, 100L);
    }

    @Test
    void postPayments_success_should201() throws Exception {
        Mockito.when(rateLimiter.tryConsume()).thenReturn(true);
        Mockito.when(paymentService.pay(WALLET, PAYABLE_ID, TOKEN, 100L))
                .thenReturn(PaymentResponse.builder()
                        .id("0x" + "ab".repeat(32))
                        .payableId(PAYABLE_ID)
                        .payer(WALLET)
                        .payerChainId(10002)
                        .chainCount(1L)
                        .payerCount(1)
                        .payableCount(1)
                        .token(TOKEN)
                        .amount(100)
                        .timestamp(Instant.now())
                        .build());

        mvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Wallet-Address", WALLET)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.payableId").value(PAYABLE_ID))
                .andExpect(jsonPath("$.amount").value(100))
                .andExpect(jsonPath("$.payerCount").value(1));
    }

    @Test
    void postPayments_missingWallet_should400() throws Exception {
        Mockito.when(rateLimiter.tryConsume()).thenReturn(true);

        mvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isBadRequest());
        Mockito.verifyNoInteractions(paymentService);
    }

    @Test
    void postPayments_missingAmount_should400() throws Exception {
        Mockito.when(rateLimiter.tryConsume()).thenReturn(true);

        mvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Wallet-Address", WALLET)
                        .content("{\"payableId\":\"" + PAYABLE_ID + "\",\"token\":\"" + TOKEN + "\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void postPayments_closedPayable_should409WithCode() throws Exception {
        Mockito.when(rateLimiter.tryConsume()).thenReturn(true);
        Mockito.when(paymentService.pay(WALLET, PAYABLE_ID, TOKEN, 100L))
                .thenThrow(new LedgerException(LedgerError.PAYABLE_IS_CLOSED));

        mvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Wallet-Address", WALLET)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("PAYABLE_IS_CLOSED"))
                .andExpect(jsonPath("$.path").value("/api/v1/payments"));
    }

    @Test
    void postPayments_rateLimited_should429() throws Exception {
        Mockito.when(rateLimiter.tryConsume()).thenReturn(false);

        mvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Wallet-Address", WALLET)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Too Many Requests"))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
        Mockito.verifyNoInteractions(paymentService);
    }

    @Test
    void getUserPayment_unknown_should404() throws Exception {
        Mockito.when(queryService.userPayment("0xdead"))
                .thenThrow(new LedgerException(LedgerError.INVALID_PAYMENT_ID));

        mvc.perform(get("/api/v1/payments/user/0xdead"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("INVALID_PAYMENT_ID"));
    }
}
