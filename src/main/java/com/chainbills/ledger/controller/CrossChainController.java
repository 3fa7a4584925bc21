package com.chainbills.ledger.controller;

import com.chainbills.ledger.config.RateLimiterService;
import com.chainbills.ledger.crosschain.CrossChainService;
import com.chainbills.ledger.dto.ReceivedPayableRequest;
import com.chainbills.ledger.dto.ReceivedPaymentRequest;
import com.chainbills.ledger.dto.ReceivedWithdrawalRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;

/**
 * Relayer entry point for attested messages from other chains.
 *
 * Endpoints:
 *  - POST /api/v1/cross-chain/payables
 *  - POST /api/v1/cross-chain/payables/close
 *  - POST /api/v1/cross-chain/payables/reopen
 *  - POST /api/v1/cross-chain/payments
 *  - POST /api/v1/cross-chain/withdrawals
 *
 * A replayed message answers 409 DUPLICATE_MESSAGE; a concurrent redelivery 409 MESSAGE_IN_FLIGHT.
 */
@RestController
@RequestMapping(value = "/api/v1/cross-chain", consumes = MediaType.APPLICATION_JSON_VALUE)
@Validated
@RequiredArgsConstructor
public class CrossChainController {

    private final CrossChainService crossChainService;
    private final RateLimiterService rateLimiterService;

    @PostMapping("/payables")
    public ResponseEntity<?> createPayable(@Valid @RequestBody ReceivedPayableRequest request,
                                           HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(crossChainService.createPayable(request));
    }

    @PostMapping("/payables/close")
    public ResponseEntity<?> closePayable(@Valid @RequestBody ReceivedPayableRequest request,
                                          HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.ok(crossChainService.closePayable(request));
    }

    @PostMapping("/payables/reopen")
    public ResponseEntity<?> reopenPayable(@Valid @RequestBody ReceivedPayableRequest request,
                                           HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.ok(crossChainService.reopenPayable(request));
    }

    @PostMapping("/payments")
    public ResponseEntity<?> pay(@Valid @RequestBody ReceivedPaymentRequest request,
                                 HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(crossChainService.pay(request));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<?> withdraw(@Valid @RequestBody ReceivedWithdrawalRequest request,
                                      HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(crossChainService.withdraw(request));
    }
}
