package com.chainbills.ledger.controller;

import com.chainbills.ledger.dto.ChainStatsResponse;
import com.chainbills.ledger.service.LedgerQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/chain-stats")
@RequiredArgsConstructor
public class ChainStatsController {

    private final LedgerQueryService queryService;

    @GetMapping
    public ChainStatsResponse get() {
        return queryService.chainStats();
    }
}
