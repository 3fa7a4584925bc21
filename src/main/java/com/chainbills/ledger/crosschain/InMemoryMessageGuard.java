package com.chainbills.ledger.crosschain;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JVM-local in-flight guard. Enough for a single ledger node.
 */
@Service
@ConditionalOnProperty(name = "ledger.guard.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryMessageGuard implements MessageGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Override
    public boolean tryAcquire(String key) {
        return inFlight.add(key);
    }

    @Override
    public void release(String key) {
        inFlight.remove(key);
    }

    @Override
    public boolean isInFlight(String key) {
        return inFlight.contains(key);
    }
}
