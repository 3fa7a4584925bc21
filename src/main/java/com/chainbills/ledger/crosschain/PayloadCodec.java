package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.entity.TokenAndAmount;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.util.HexUtils;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Big-endian binary layout of cross-chain payloads:
 * <pre>
 * actionId(1) | caller(32) | body
 *   PAY, WITHDRAW          payableId(32) | token(32) | amount(8)
 *   CREATE_PAYABLE         descriptionLength(2) | description(utf-8) | count(1) | count x (token(32) | amount(8))
 *   CLOSE/REOPEN_PAYABLE   payableId(32)
 * </pre>
 * Amounts are unsigned on the wire; values above {@link Long#MAX_VALUE} are rejected.
 */
@Component
public class PayloadCodec {

    private static final int WORD = 32;
    private static final int MAX_DESCRIPTION_BYTES = 0xffff;
    private static final int MAX_ENTRIES = 0xff;

    /**
     * Reads only the action byte.
     *
     * @throws LedgerException INVALID_PAYLOAD if empty, INVALID_ACTION_ID if unknown
     */
    public ActionType actionOf(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new LedgerException(LedgerError.INVALID_PAYLOAD, "Empty payload");
        }
        int id = payload[0] & 0xff;
        return ActionType.fromId(id)
                .orElseThrow(() -> new LedgerException(LedgerError.INVALID_ACTION_ID, "Unknown action id: " + id));
    }

    public CrossChainPayload decode(byte[] payload) {
        ActionType action = actionOf(payload);
        ByteBuffer buf = ByteBuffer.wrap(payload);
        buf.get();
        try {
            CrossChainPayload.CrossChainPayloadBuilder builder = CrossChainPayload.builder()
                    .action(action)
                    .caller(readWord(buf));
            switch (action) {
                case PAY:
                case WITHDRAW:
                    builder.payableId(readWord(buf))
                            .token(readWord(buf))
                            .amount(readAmount(buf));
                    break;
                case CREATE_PAYABLE:
                    byte[] description = new byte[buf.getShort() & 0xffff];
                    buf.get(description);
                    builder.description(readUtf8(description));
                    int count = buf.get() & 0xff;
                    for (int i = 0; i < count; i++) {
                        builder.tokenAndAmount(new TokenAndAmount(readWord(buf), readAmount(buf)));
                    }
                    break;
                case CLOSE_PAYABLE:
                case REOPEN_PAYABLE:
                    builder.payableId(readWord(buf));
                    break;
                default:
                    throw new LedgerException(LedgerError.INVALID_ACTION_ID, "Unsupported action: " + action);
            }
            if (buf.hasRemaining()) {
                throw new LedgerException(LedgerError.INVALID_PAYLOAD,
                        "Trailing bytes in " + action + " payload: " + buf.remaining());
            }
            return builder.build();
        } catch (BufferUnderflowException e) {
            throw new LedgerException(LedgerError.INVALID_PAYLOAD, "Truncated " + action + " payload", e);
        }
    }

    /**
     * Inverse of {@link #decode}. Used by relayer tooling and tests to build messages.
     */
    public byte[] encode(CrossChainPayload payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(payload.getAction().getId());
        writeWord(out, payload.getCaller());
        switch (payload.getAction()) {
            case PAY:
            case WITHDRAW:
                writeWord(out, payload.getPayableId());
                writeWord(out, payload.getToken());
                writeLong(out, payload.getAmount());
                break;
            case CREATE_PAYABLE:
                byte[] description = payload.getDescription().getBytes(StandardCharsets.UTF_8);
                if (description.length > MAX_DESCRIPTION_BYTES) {
                    throw new IllegalArgumentException("Description exceeds " + MAX_DESCRIPTION_BYTES + " bytes");
                }
                if (payload.getTokensAndAmounts().size() > MAX_ENTRIES) {
                    throw new IllegalArgumentException("At most " + MAX_ENTRIES + " tokens and amounts fit a payload");
                }
                out.write((description.length >>> 8) & 0xff);
                out.write(description.length & 0xff);
                out.writeBytes(description);
                out.write(payload.getTokensAndAmounts().size());
                for (TokenAndAmount taa : payload.getTokensAndAmounts()) {
                    writeWord(out, taa.getToken());
                    writeLong(out, taa.getAmount());
                }
                break;
            default:
                writeWord(out, payload.getPayableId());
        }
        return out.toByteArray();
    }

    private static String readUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new LedgerException(LedgerError.INVALID_PAYLOAD, "Description is not valid UTF-8", e);
        }
    }

    private static String readWord(ByteBuffer buf) {
        byte[] word = new byte[WORD];
        buf.get(word);
        return HexUtils.toHex(word);
    }

    private static long readAmount(ByteBuffer buf) {
        long amount = buf.getLong();
        if (amount < 0) {
            throw new LedgerException(LedgerError.INVALID_PAYLOAD, "Amount exceeds the supported range");
        }
        return amount;
    }

    private static void writeWord(ByteArrayOutputStream out, String hex) {
        byte[] bytes = HexUtils.fromHex(hex);
        if (bytes.length != WORD) {
            throw new IllegalArgumentException("Expected 32 bytes: " + hex);
        }
        out.writeBytes(bytes);
    }

    private static void writeLong(ByteArrayOutputStream out, long value) {
        out.writeBytes(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
    }
}
