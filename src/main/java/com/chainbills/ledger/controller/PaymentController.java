package com.chainbills.ledger.controller;

import com.chainbills.ledger.config.RateLimiterService;
import com.chainbills.ledger.dto.PaymentRequest;
import com.chainbills.ledger.dto.PaymentResponse;
import com.chainbills.ledger.service.LedgerQueryService;
import com.chainbills.ledger.service.PaymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;

/**
 * REST controller for payments made from local wallets.
 *
 * Endpoints:
 *  - POST /api/v1/payments
 *  - GET  /api/v1/payments/user/{id}
 *  - GET  /api/v1/payments/payable/{id}
 *
 * Notes:
 *  - Rate limiting is global, not per wallet.
 */
@RestController
@RequestMapping("/api/v1/payments")
@Validated
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;
    private final LedgerQueryService queryService;
    private final RateLimiterService rateLimiterService;

    /**
     * Pays a payable.
     *
     * @return HTTP 201 with the payer-side record,
     *         HTTP 429 if rate limit exceeded,
     *         or the status of the ledger error otherwise.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> pay(@RequestHeader("X-Wallet-Address") String wallet,
                                 @Valid @RequestBody PaymentRequest request,
                                 HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        PaymentResponse resp = paymentService.pay(wallet, request.getPayableId(), request.getToken(),
                request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(resp);
    }

    @GetMapping("/user/{id}")
    public PaymentResponse userPayment(@PathVariable String id) {
        return queryService.userPayment(id);
    }

    @GetMapping("/payable/{id}")
    public PaymentResponse payablePayment(@PathVariable String id) {
        return queryService.payablePayment(id);
    }
}
