package com.chainbills.ledger.crosschain;

/**
 * Guard against the same attested message being processed concurrently.
 *
 * <p>This is the fast, best-effort layer; the durable replay guard lives in the
 * {@code received_messages} table. Implementations:
 * <ul>
 *     <li>In-memory store (ConcurrentHashMap) – fast, JVM-local only</li>
 *     <li>Redis (SETNX with expiry) – shared across nodes</li>
 * </ul>
 *
 * Typical lifecycle:
 * <ol>
 *     <li>{@link #tryAcquire(String)} before the message is validated and applied.</li>
 *     <li>{@link #release(String)} in a finally block, whatever the outcome.</li>
 * </ol>
 */
public interface MessageGuard {

    /**
     * Attempts to acquire the in-flight slot for a message.
     *
     * @param key message key (emitter chain id + message hash)
     * @return true if acquired, false if another worker holds it
     */
    boolean tryAcquire(String key);

    /**
     * Releases the in-flight slot.
     *
     * @param key message key
     */
    void release(String key);

    /**
     * @param key message key
     * @return true while some worker holds the slot
     */
    boolean isInFlight(String key);
}
