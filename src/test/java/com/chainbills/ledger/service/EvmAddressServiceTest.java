package com.chainbills.ledger.service;

import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmAddressServiceTest {

    private static final String WALLET = "0xAbCdEf0123456789abcdef0123456789ABCDEF01";
    private static final String PADDED = "0x000000000000000000000000abcdef0123456789abcdef0123456789abcdef01";

    private final EvmAddressService addresses = new EvmAddressService();

    @Test
    void normalizeLocal_lowerCasesAndKeepsPrefix() {
        assertThat(addresses.normalizeLocal(WALLET)).isEqualTo("0xabcdef0123456789abcdef0123456789abcdef01");
        assertThat(addresses.normalizeLocal(WALLET.substring(2))).isEqualTo("0xabcdef0123456789abcdef0123456789abcdef01");
    }

    @Test
    void normalizeLocal_rejectsZeroShortAndNonHex() {
        assertInvalid(() -> addresses.normalizeLocal("0x0000000000000000000000000000000000000000"));
        assertInvalid(() -> addresses.normalizeLocal("0x1234"));
        assertInvalid(() -> addresses.normalizeLocal("0xzzcdef0123456789abcdef0123456789abcdef01"));
        assertInvalid(() -> addresses.normalizeLocal(null));
    }

    @Test
    void toUniversal_leftPadsLocalAndKeepsUniversal() {
        assertThat(addresses.toUniversal(WALLET)).isEqualTo(PADDED);
        assertThat(addresses.toUniversal(PADDED)).isEqualTo(PADDED);
    }

    @Test
    void toLocal_stripsPadding() {
        assertThat(addresses.toLocal(PADDED)).isEqualTo("0xabcdef0123456789abcdef0123456789abcdef01");
    }

    @Test
    void toLocal_rejectsAddressesThatDoNotFitTwentyBytes() {
        assertInvalid(() -> addresses.toLocal("0x11000000000000000000000000abcdef0123456789abcdef0123456789abcdef"));
    }

    @Test
    void isZero_detectsAllZeroUniversal() {
        assertThat(addresses.isZero("0x" + "0".repeat(64))).isTrue();
        assertThat(addresses.isZero(PADDED)).isFalse();
    }

    private static void assertInvalid(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOf(LedgerException.class)
                .satisfies(ex -> assertThat(((LedgerException) ex).getError())
                        .isEqualTo(LedgerError.INVALID_WALLET_ADDRESS));
    }
}
