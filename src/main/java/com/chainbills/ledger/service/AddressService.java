package com.chainbills.ledger.service;

/**
 * Validates wallet/token identifiers and converts them between the local form
 * and the 32-byte chain-portable form used in cross-chain payloads.
 *
 * All methods throw {@link com.chainbills.ledger.exception.LedgerException}
 * with INVALID_WALLET_ADDRESS on malformed input.
 */
public interface AddressService {

    /** Validates and normalizes a local address. The zero address is rejected. */
    String normalizeLocal(String address);

    /** Validates and normalizes a 32-byte chain-portable address (zero allowed). */
    String normalizeUniversal(String address);

    /** Chain-portable form of a local or already chain-portable address. */
    String toUniversal(String address);

    /** Local form of a chain-portable address whose padding allows it. */
    String toLocal(String universalAddress);

    boolean isZero(String address);
}
