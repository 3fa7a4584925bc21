package com.chainbills.ledger.controller;

import com.chainbills.ledger.config.RateLimiterService;
import com.chainbills.ledger.dto.CreatePayableRequest;
import com.chainbills.ledger.dto.IdResponse;
import com.chainbills.ledger.dto.PayableResponse;
import com.chainbills.ledger.dto.UpdateAllowedTokensRequest;
import com.chainbills.ledger.service.LedgerQueryService;
import com.chainbills.ledger.service.PayableService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;

/**
 * REST controller for payables hosted by local wallets.
 *
 * Endpoints:
 *  - POST /api/v1/payables
 *  - POST /api/v1/payables/{id}/close
 *  - POST /api/v1/payables/{id}/reopen
 *  - PUT  /api/v1/payables/{id}/allowed-tokens-and-amounts
 *  - GET  /api/v1/payables/{id}
 *  - GET  /api/v1/payables/{id}/payments/{count}
 *  - GET  /api/v1/payables/{id}/withdrawals/{count}
 *
 * The acting wallet comes from the {@code X-Wallet-Address} header.
 */
@RestController
@RequestMapping("/api/v1/payables")
@Validated
@RequiredArgsConstructor
public class PayableController {

    private final PayableService payableService;
    private final LedgerQueryService queryService;
    private final RateLimiterService rateLimiterService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@RequestHeader("X-Wallet-Address") String wallet,
                                    @Valid @RequestBody CreatePayableRequest request,
                                    HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        PayableResponse resp = payableService.createPayable(wallet, request.getDescription(),
                request.getAllowedTokensAndAmounts());
        return ResponseEntity.status(HttpStatus.CREATED).body(resp);
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<?> close(@RequestHeader("X-Wallet-Address") String wallet,
                                   @PathVariable String id,
                                   HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.ok(payableService.closePayable(id, wallet));
    }

    @PostMapping("/{id}/reopen")
    public ResponseEntity<?> reopen(@RequestHeader("X-Wallet-Address") String wallet,
                                    @PathVariable String id,
                                    HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.ok(payableService.reopenPayable(id, wallet));
    }

    @PutMapping(value = "/{id}/allowed-tokens-and-amounts", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> updateAllowedTokensAndAmounts(@RequestHeader("X-Wallet-Address") String wallet,
                                                           @PathVariable String id,
                                                           @Valid @RequestBody UpdateAllowedTokensRequest request,
                                                           HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        return ResponseEntity.ok(payableService.updateAllowedTokensAndAmounts(id, wallet,
                request.getAllowedTokensAndAmounts()));
    }

    @GetMapping("/{id}")
    public PayableResponse get(@PathVariable String id) {
        return queryService.payable(id);
    }

    @GetMapping("/{id}/payments/{count}")
    public IdResponse paymentId(@PathVariable String id, @PathVariable long count) {
        return queryService.payablePaymentId(id, count);
    }

    @GetMapping("/{id}/withdrawals/{count}")
    public IdResponse withdrawalId(@PathVariable String id, @PathVariable long count) {
        return queryService.payableWithdrawalId(id, count);
    }
}
