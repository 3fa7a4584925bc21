package com.chainbills.ledger.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic 32-byte ids for payables, payments and withdrawals.
 *
 * How:
 *  - Joins (kind, origin chain id, chain-portable owner address, owner-scoped count)
 *    in a fixed order with '|' as separator.
 *  - Produces the SHA-256 digest of that string, 0x-prefixed.
 *
 * The same logical event therefore gets the same id on whichever chain
 * observes it, and two owners never collide.
 */
public final class IdUtils {

    private IdUtils() {
        // Utility class: prevent instantiation
    }

    /**
     * @param kind          entity kind
     * @param originChainId chain the owner lives on
     * @param owner         owner address in 32-byte form
     * @param ownerCount    owner's sequence number for this kind
     */
    public static String create(EntityKind kind, int originChainId, String owner, long ownerCount) {
        String normalized = new StringBuilder()
                .append(kind.name()).append('|')
                .append(originChainId).append('|')
                .append(HexUtils.strip(owner)).append('|')
                .append(ownerCount)
                .toString();
        return "0x" + DigestUtils.sha256Hex(normalized.getBytes(StandardCharsets.UTF_8));
    }
}
