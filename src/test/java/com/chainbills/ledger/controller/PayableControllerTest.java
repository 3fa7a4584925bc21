package com.chainbills.ledger.controller;

import com.chainbills.ledger.config.RateLimiterService;
import com.chainbills.ledger.dto.IdResponse;
import com.chainbills.ledger.dto.PayableResponse;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.service.LedgerQueryService;
import com.chainbills.ledger.service.PayableService;
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

import java.util.Collections;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc(addFilters = false)
@ActiveProfiles("test")
class PayableControllerTest {

    private static final String HOST = "0x9999999999999999999999999999999999999999";
    private static final String PAYABLE_ID = "0x" + "77".repeat(32);

    @Autowired private MockMvc mvc;

    @MockBean private PayableService payableService;
    @MockBean private LedgerQueryService queryService;
    @MockBean private RateLimiterService rateLimiter;

    @BeforeEach
    void setUp() {
        Mockito.when(rateLimiter.tooManyRequests(Mockito.any())).thenCallRealMethod();
        Mockito.when(rateLimiter.tryConsume()).thenReturn(true);
    }

    private PayableResponse payable(boolean closed) {
        return PayableResponse.builder()
                .id(PAYABLE_ID)
                .chainCount(1)
                .host(HOST)
                .hostChainId(10002)
                .hostCount(1)
                .description("rent")
                .closed(closed)
                .allowedTokensAndAmounts(Collections.emptyList())
                .balances(Collections.emptyMap())
                .build();
    }

    @Test
    void create_should201() throws Exception {
        Mockito.when(payableService.createPayable(Mockito.eq(HOST), Mockito.eq("rent"), Mockito.anyList()))
                .thenReturn(payable(false));

        mvc.perform(post("/api/v1/payables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Wallet-Address", HOST)
                        .content("{\"description\":\"rent\",\"allowedTokensAndAmounts\":[]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(PAYABLE_ID))
                .andExpect(jsonPath("$.closed").value(false));
    }

    @Test
    void create_allowedEntryWithoutToken_should400() throws Exception {
        mvc.perform(post("/api/v1/payables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Wallet-Address", HOST)
                        .content("{\"description\":\"rent\",\"allowedTokensAndAmounts\":[{\"amount\":5}]}"))
                .andExpect(status().isBadRequest());
        Mockito.verifyNoInteractions(payableService);
    }

    @Test
    void close_byStranger_should403() throws Exception {
        Mockito.when(payableService.closePayable(PAYABLE_ID, HOST))
                .thenThrow(new LedgerException(LedgerError.NOT_YOUR_PAYABLE));

        mvc.perform(post("/api/v1/payables/" + PAYABLE_ID + "/close")
                        .header("X-Wallet-Address", HOST))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_YOUR_PAYABLE"));
    }

    @Test
    void reopen_should200() throws Exception {
        Mockito.when(payableService.reopenPayable(PAYABLE_ID, HOST)).thenReturn(payable(false));

        mvc.perform(post("/api/v1/payables/" + PAYABLE_ID + "/reopen")
                        .header("X-Wallet-Address", HOST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(false));
    }

    @Test
    void get_unknown_should404() throws Exception {
        Mockito.when(queryService.payable("0x01"))
                .thenThrow(new LedgerException(LedgerError.INVALID_PAYABLE_ID));

        mvc.perform(get("/api/v1/payables/0x01"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("INVALID_PAYABLE_ID"));
    }

    @Test
    void paymentIdByCount_should200() throws Exception {
        Mockito.when(queryService.payablePaymentId(PAYABLE_ID, 1L)).thenReturn(new IdResponse("0xabc"));

        mvc.perform(get("/api/v1/payables/" + PAYABLE_ID + "/payments/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("0xabc"));
    }

    @Test
    void close_rateLimited_should429() throws Exception {
        Mockito.when(rateLimiter.tryConsume()).thenReturn(false);

        mvc.perform(post("/api/v1/payables/" + PAYABLE_ID + "/close")
                        .header("X-Wallet-Address", HOST))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
        Mockito.verifyNoInteractions(payableService);
    }
}
