package com.chainbills.ledger.service;

import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.util.HexUtils;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Addresses of an EVM-style local chain: 20 bytes, left-padded with zeros
 * to 32 bytes for the chain-portable form.
 */
@Service
public class EvmAddressService implements AddressService {

    private static final Pattern LOCAL = Pattern.compile("^(0x)?[0-9a-f]{40}$");
    private static final Pattern UNIVERSAL = Pattern.compile("^(0x)?[0-9a-f]{64}$");
    private static final String PADDING = "000000000000000000000000";

    @Override
    public String normalizeLocal(String address) {
        String hex = strip(address);
        if (!LOCAL.matcher(hex).matches()) {
            throw invalid(address);
        }
        String normalized = "0x" + hex;
        if (isZero(normalized)) {
            throw invalid(address);
        }
        return normalized;
    }

    @Override
    public String normalizeUniversal(String address) {
        String hex = strip(address);
        if (!UNIVERSAL.matcher(hex).matches()) {
            throw invalid(address);
        }
        return "0x" + hex;
    }

    @Override
    public String toUniversal(String address) {
        String hex = strip(address);
        if (UNIVERSAL.matcher(hex).matches()) {
            return "0x" + hex;
        }
        if (LOCAL.matcher(hex).matches()) {
            return "0x" + PADDING + hex;
        }
        throw invalid(address);
    }

    @Override
    public String toLocal(String universalAddress) {
        String hex = HexUtils.strip(normalizeUniversal(universalAddress));
        if (!hex.startsWith(PADDING)) {
            throw invalid(universalAddress);
        }
        return normalizeLocal(hex.substring(PADDING.length()));
    }

    @Override
    public boolean isZero(String address) {
        return HexUtils.isAllZero(HexUtils.fromHex(strip(address)));
    }

    private static String strip(String address) {
        if (address == null) {
            throw invalid(null);
        }
        return HexUtils.strip(address);
    }

    private static LedgerException invalid(String address) {
        return new LedgerException(LedgerError.INVALID_WALLET_ADDRESS, "Invalid address: " + address);
    }
}
