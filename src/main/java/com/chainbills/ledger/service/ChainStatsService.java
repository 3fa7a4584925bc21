package com.chainbills.ledger.service;

import com.chainbills.ledger.config.LedgerProperties;
import com.chainbills.ledger.entity.ChainStats;
import com.chainbills.ledger.repository.ChainStatsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the single {@link ChainStats} row of this deployment.
 */
@Service
@Slf4j
public class ChainStatsService {

    private final ChainStatsRepository chainStatsRepo;
    private final int chainId;

    public ChainStatsService(ChainStatsRepository chainStatsRepo, LedgerProperties properties) {
        this.chainStatsRepo = chainStatsRepo;
        this.chainId = properties.getChainId();
    }

    /**
     * Creates the row on first start. Later starts find it and leave it alone.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void initialize() {
        if (!chainStatsRepo.existsById(chainId)) {
            chainStatsRepo.save(new ChainStats(chainId));
            log.info("[CHAIN] Initialized chain stats. chainId={}", chainId);
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ChainStats loadForUpdate() {
        return chainStatsRepo.findForUpdate(chainId)
                .orElseThrow(() -> new IllegalStateException("Chain stats not initialized for chain " + chainId));
    }

    public int getChainId() {
        return chainId;
    }
}
