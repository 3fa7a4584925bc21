package com.chainbills.ledger.controller;

import com.chainbills.ledger.dto.IdResponse;
import com.chainbills.ledger.dto.UserResponse;
import com.chainbills.ledger.service.LedgerQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Users by wallet. {@code chainId} selects a remote user; it defaults to this chain.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final LedgerQueryService queryService;

    @GetMapping("/{wallet}")
    public UserResponse get(@PathVariable String wallet,
                            @RequestParam(required = false) Integer chainId) {
        return queryService.user(wallet, chainId);
    }

    @GetMapping("/{wallet}/payments/{count}")
    public IdResponse paymentId(@PathVariable String wallet,
                                @PathVariable long count,
                                @RequestParam(required = false) Integer chainId) {
        return queryService.userPaymentId(wallet, chainId, count);
    }
}
