package com.chainbills.ledger.service;

import com.chainbills.ledger.entity.ChainStats;
import com.chainbills.ledger.entity.CounterScope;
import com.chainbills.ledger.entity.User;
import com.chainbills.ledger.event.UserInitializedEvent;
import com.chainbills.ledger.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lazily initializes users the first time a wallet hosts, pays or withdraws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepo;
    private final CounterRegistry counters;
    private final ApplicationEventPublisher events;

    /**
     * Loads the user with a write lock, creating it when absent.
     * Creation bumps the chain's users count held by {@code stats}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public User loadOrInitialize(ChainStats stats, int chainId, String wallet) {
        return userRepo.findForUpdate(chainId, wallet).orElseGet(() -> {
            long chainCount = counters.next(CounterScope.CHAIN_USERS, CounterRegistry.chainScope(stats.getChainId()));
            stats.setUsersCount(chainCount);

            User user = new User();
            user.setChainId(chainId);
            user.setWallet(wallet);
            user.setChainCount(chainCount);
            User saved = userRepo.save(user);

            log.info("[USER] Initialized. chainId={}, wallet={}, chainCount={}", chainId, wallet, chainCount);
            events.publishEvent(new UserInitializedEvent(chainId, wallet, chainCount));
            return saved;
        });
    }
}
