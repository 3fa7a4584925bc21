package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.entity.TokenAndAmount;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PayloadCodec}.
 */
class PayloadCodecTest {

    private static final String CALLER = "0x" + "0".repeat(24) + "ab".repeat(20);
    private static final String PAYABLE = "0x" + "cd".repeat(32);
    private static final String TOKEN = "0x" + "0".repeat(24) + "11".repeat(20);

    private final PayloadCodec codec = new PayloadCodec();

    // ============ Layout ============

    @Test
    void payPayload_hasFixedLayout() {
        byte[] bytes = codec.encode(CrossChainPayload.builder()
                .action(ActionType.PAY).caller(CALLER).payableId(PAYABLE).token(TOKEN).amount(100L).build());

        assertThat(bytes).hasSize(1 + 32 + 32 + 32 + 8);
        assertThat(bytes[0]).isEqualTo((byte) 4);
        assertThat(ByteBuffer.wrap(bytes, 97, 8).getLong()).isEqualTo(100L);

        CrossChainPayload decoded = codec.decode(bytes);
        assertThat(decoded.getAction()).isEqualTo(ActionType.PAY);
        assertThat(decoded.getCaller()).isEqualTo(CALLER);
        assertThat(decoded.getPayableId()).isEqualTo(PAYABLE);
        assertThat(decoded.getToken()).isEqualTo(TOKEN);
        assertThat(decoded.getAmount()).isEqualTo(100L);
    }

    @Test
    void createPayablePayload_carriesDescriptionAndAllowedEntries() {
        byte[] bytes = codec.encode(CrossChainPayload.builder()
                .action(ActionType.CREATE_PAYABLE)
                .caller(CALLER)
                .description("Coffee beans, 1kg")
                .tokenAndAmount(new TokenAndAmount(TOKEN, 250L))
                .build());

        CrossChainPayload decoded = codec.decode(bytes);

        assertThat(decoded.getDescription()).isEqualTo("Coffee beans, 1kg");
        assertThat(decoded.getTokensAndAmounts()).containsExactly(new TokenAndAmount(TOKEN, 250L));
        assertThat(decoded.getPayableId()).isNull();
    }

    // ============ Malformed ============

    @Test
    void emptyPayload_isInvalidPayload() {
        assertError(() -> codec.decode(new byte[0]), LedgerError.INVALID_PAYLOAD);
    }

    @Test
    void unknownAction_isInvalidActionId() {
        byte[] bytes = new byte[33];
        bytes[0] = 9;
        assertError(() -> codec.decode(bytes), LedgerError.INVALID_ACTION_ID);
    }

    @Test
    void truncatedPayload_isInvalidPayload() {
        byte[] full = codec.encode(CrossChainPayload.builder()
                .action(ActionType.WITHDRAW).caller(CALLER).payableId(PAYABLE).token(TOKEN).amount(5L).build());

        assertError(() -> codec.decode(Arrays.copyOf(full, full.length - 1)), LedgerError.INVALID_PAYLOAD);
    }

    @Test
    void trailingBytes_areInvalidPayload() {
        byte[] full = codec.encode(CrossChainPayload.builder()
                .action(ActionType.CLOSE_PAYABLE).caller(CALLER).payableId(PAYABLE).build());

        assertError(() -> codec.decode(Arrays.copyOf(full, full.length + 1)), LedgerError.INVALID_PAYLOAD);
    }

    @Test
    void amountAboveSignedRange_isInvalidPayload() {
        byte[] bytes = codec.encode(CrossChainPayload.builder()
                .action(ActionType.PAY).caller(CALLER).payableId(PAYABLE).token(TOKEN).amount(1L).build());
        bytes[97] = (byte) 0x80;

        assertError(() -> codec.decode(bytes), LedgerError.INVALID_PAYLOAD);
    }

    @Test
    void malformedUtf8Description_isInvalidPayload() {
        byte[] bytes = codec.encode(CrossChainPayload.builder()
                .action(ActionType.CREATE_PAYABLE).caller(CALLER).description("ab").build());
        // description bytes follow action(1) | caller(32) | length(2)
        bytes[35] = (byte) 0xC3;
        bytes[36] = (byte) 0x28;

        assertError(() -> codec.decode(bytes), LedgerError.INVALID_PAYLOAD);
    }

    @Test
    void encode_moreEntriesThanCountByte_isRejected() {
        CrossChainPayload.CrossChainPayloadBuilder builder = CrossChainPayload.builder()
                .action(ActionType.CREATE_PAYABLE).caller(CALLER).description("bulk");
        for (int i = 0; i < 256; i++) {
            builder.tokenAndAmount(new TokenAndAmount(TOKEN, i + 1L));
        }
        CrossChainPayload payload = builder.build();

        assertThatThrownBy(() -> codec.encode(payload)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void encode_descriptionLongerThanLengthField_isRejected() {
        CrossChainPayload payload = CrossChainPayload.builder()
                .action(ActionType.CREATE_PAYABLE).caller(CALLER).description("x".repeat(0x10000)).build();

        assertThatThrownBy(() -> codec.encode(payload)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void assertError(org.assertj.core.api.ThrowableAssert.ThrowingCallable call, LedgerError error) {
        assertThatThrownBy(call)
                .isInstanceOf(LedgerException.class)
                .satisfies(ex -> assertThat(((LedgerException) ex).getError()).isEqualTo(error));
    }
}
