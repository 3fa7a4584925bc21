package com.chainbills.ledger.util;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Locale;

/**
 * 0x-prefixed hex helpers shared by ids, addresses and payloads.
 */
public final class HexUtils {

    private HexUtils() {
        // Utility class: prevent instantiation
    }

    public static String toHex(byte[] bytes) {
        return "0x" + Hex.encodeHexString(bytes);
    }

    /**
     * Decodes hex with or without the 0x prefix.
     *
     * @throws IllegalArgumentException if the input is not valid hex
     */
    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex is null");
        }
        try {
            return Hex.decodeHex(strip(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex: " + hex, e);
        }
    }

    /** Lower-cased hex without prefix. */
    public static String strip(String hex) {
        String lower = hex.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("0x") ? lower.substring(2) : lower;
    }

    public static boolean isAllZero(byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }
}
