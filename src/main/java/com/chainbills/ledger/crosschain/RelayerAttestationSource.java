package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.config.LedgerProperties;
import com.chainbills.ledger.dto.SignedMessage;
import com.chainbills.ledger.exception.LedgerError;
import com.chainbills.ledger.exception.LedgerException;
import com.chainbills.ledger.util.HexUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.Map;

/**
 * Attestation by a trusted relayer sharing an HMAC-SHA256 key with this node.
 *
 * Signed body: emitterChainId(2) | emitterAddress(32) | sequence(8) | payload.
 * The emitter must be the registered foreign contract for its chain.
 */
@Component
@Slf4j
public class RelayerAttestationSource implements AttestationSource {

    private final byte[] secret;
    private final Map<Integer, String> foreignContracts = new HashMap<>();

    public RelayerAttestationSource(LedgerProperties properties) {
        String configured = properties.getAttestation().getSecret();
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("ledger.attestation.secret must be configured");
        }
        this.secret = configured.getBytes(StandardCharsets.UTF_8);
        properties.getAttestation().getForeignContracts()
                .forEach((chainId, emitter) -> foreignContracts.put(chainId, HexUtils.strip(emitter)));
    }

    @Override
    public AttestedMessage verify(SignedMessage message) {
        int chainId = message.getEmitterChainId();
        String emitter = HexUtils.strip(message.getEmitterAddress());
        byte[] payload;
        byte[] body;
        try {
            payload = HexUtils.fromHex(message.getPayload());
            body = signedBody(chainId, HexUtils.fromHex(emitter), message.getSequence(), payload);
        } catch (IllegalArgumentException e) {
            throw new LedgerException(LedgerError.INVALID_ATTESTATION, "Malformed envelope: " + e.getMessage(), e);
        }

        byte[] expected = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret).hmac(body);
        byte[] provided;
        try {
            provided = HexUtils.fromHex(message.getSignature());
        } catch (IllegalArgumentException e) {
            throw new LedgerException(LedgerError.INVALID_ATTESTATION, "Malformed signature", e);
        }
        if (!MessageDigest.isEqual(expected, provided)) {
            log.warn("[ATTEST] Signature mismatch. emitterChainId={}, sequence={}", chainId, message.getSequence());
            throw new LedgerException(LedgerError.INVALID_ATTESTATION);
        }

        String registered = foreignContracts.get(chainId);
        if (registered == null || !registered.equals(emitter)) {
            log.warn("[ATTEST] Unregistered emitter. emitterChainId={}, emitter={}", chainId, emitter);
            throw new LedgerException(LedgerError.UNREGISTERED_EMITTER,
                    "No registered contract " + emitter + " for chain " + chainId);
        }

        return new AttestedMessage(chainId, "0x" + emitter, message.getSequence(), payload,
                DigestUtils.sha256Hex(body));
    }

    /**
     * Signs an envelope the way a relayer does. Exposed for relayer tooling and tests.
     */
    public String sign(int emitterChainId, String emitterAddress, long sequence, byte[] payload) {
        byte[] body = signedBody(emitterChainId, HexUtils.fromHex(emitterAddress), sequence, payload);
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret).hmacHex(body);
    }

    private static byte[] signedBody(int chainId, byte[] emitter, long sequence, byte[] payload) {
        if (emitter.length != 32) {
            throw new IllegalArgumentException("emitter must be 32 bytes");
        }
        if (chainId < 0 || chainId > 0xffff) {
            throw new IllegalArgumentException("chain id out of range: " + chainId);
        }
        return ByteBuffer.allocate(2 + 32 + 8 + payload.length)
                .putShort((short) chainId)
                .put(emitter)
                .putLong(sequence)
                .put(payload)
                .array();
    }
}
