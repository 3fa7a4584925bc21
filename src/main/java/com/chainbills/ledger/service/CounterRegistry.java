package com.chainbills.ledger.service;

import com.chainbills.ledger.entity.CounterScope;
import com.chainbills.ledger.entity.SequenceCounter;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.repository.SequenceCounterRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Monotonic sequence numbers per (scope, scope id).
 *
 * Contract:
 *  - {@link #next} returns 1 for a fresh scope, then 2, 3, ... with no gaps.
 *  - The counter row is read with a write lock and advanced inside the caller's
 *    transaction; a rolled back caller rolls the counter back too.
 *  - Overflow fails the transaction instead of wrapping.
 */
@Service
@RequiredArgsConstructor
public class CounterRegistry {

    private final SequenceCounterRepository counterRepo;

    @Transactional(propagation = Propagation.MANDATORY)
    public long next(CounterScope scope, String scopeId) {
        SequenceCounter counter = counterRepo.findForUpdate(scope, scopeId)
                .orElseGet(() -> counterRepo.save(new SequenceCounter(scope, scopeId)));
        counter.setValue(increment(counter.getValue(), scope));
        return counter.getValue();
    }

    /** Last value handed out, 0 if the scope was never used. */
    @Transactional(readOnly = true)
    public long current(CounterScope scope, String scopeId) {
        return counterRepo.findByScopeAndScopeId(scope, scopeId)
                .map(SequenceCounter::getValue)
                .orElse(0L);
    }

    /** The value {@link #next} would return, without claiming it. */
    @Transactional(readOnly = true)
    public long peekNext(CounterScope scope, String scopeId) {
        return increment(current(scope, scopeId), scope);
    }

    public static String chainScope(int chainId) {
        return String.valueOf(chainId);
    }

    public static String userScope(int chainId, String wallet) {
        return chainId + ":" + wallet;
    }

    public static String payableChainScope(String payableId, int chainId) {
        return payableId + ":" + chainId;
    }

    private static long increment(long value, CounterScope scope) {
        try {
            return Math.addExact(value, 1L);
        } catch (ArithmeticException e) {
            throw LedgerException.overflow(scope.name() + " counter", e);
        }
    }
}
