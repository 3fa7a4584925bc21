package com.chainbills.ledger.service;

import com.chainbills.ledger.config.LedgerProperties;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Globally supported tokens, loaded from {@code ledger.supported-tokens}.
 */
@Service
public class TokenRegistry {

    private final AddressService addressService;
    private final Set<String> supported;

    public TokenRegistry(LedgerProperties properties, AddressService addressService) {
        this.addressService = addressService;
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : properties.getSupportedTokens()) {
            tokens.add(addressService.normalizeLocal(token));
        }
        this.supported = Collections.unmodifiableSet(tokens);
    }

    /**
     * Normalizes a token address.
     *
     * @throws LedgerException INVALID_TOKEN if the address is malformed
     */
    public String normalize(String token) {
        try {
            return addressService.normalizeLocal(token);
        } catch (LedgerException e) {
            throw new LedgerException(LedgerError.INVALID_TOKEN, "Invalid token: " + token, e);
        }
    }

    public boolean isSupported(String normalizedToken) {
        return supported.contains(normalizedToken);
    }

    /**
     * Normalizes and checks support in one step.
     *
     * @throws LedgerException INVALID_TOKEN if malformed or not supported
     */
    public String requireSupported(String token) {
        String normalized = normalize(token);
        if (!isSupported(normalized)) {
            throw new LedgerException(LedgerError.INVALID_TOKEN, "Token is not supported: " + normalized);
        }
        return normalized;
    }
}
