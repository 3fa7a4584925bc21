package com.chainbills.ledger.controller;

import com.chainbills.ledger.config.RateLimiterService;
import com.chainbills.ledger.dto.WithdrawalRequest;
import com.chainbills.ledger.dto.WithdrawalResponse;
import com.chainbills.ledger.service.LedgerQueryService;
import com.chainbills.ledger.service.WithdrawalService;
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
 * Host withdrawals.
 *
 * Endpoints:
 *  - POST /api/v1/withdrawals
 *  - GET  /api/v1/withdrawals/{id}
 */
@RestController
@RequestMapping("/api/v1/withdrawals")
@Validated
@RequiredArgsConstructor
public class WithdrawalController {

    private final WithdrawalService withdrawalService;
    private final LedgerQueryService queryService;
    private final RateLimiterService rateLimiterService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> withdraw(@RequestHeader("X-Wallet-Address") String wallet,
                                      @Valid @RequestBody WithdrawalRequest request,
                                      HttpServletRequest httpReq) {
        if (!rateLimiterService.tryConsume()) {
            return rateLimiterService.tooManyRequests(httpReq.getRequestURI());
        }
        WithdrawalResponse resp = withdrawalService.withdraw(wallet, request.getPayableId(), request.getToken(),
                request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(resp);
    }

    @GetMapping("/{id}")
    public WithdrawalResponse get(@PathVariable String id) {
        return queryService.withdrawal(id);
    }
}
