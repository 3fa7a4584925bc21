package com.chainbills.ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger configuration bound from the {@code ledger.*} namespace.
 *
 * Groups:
 *  - chain identity and payable limits
 *  - supported tokens (a token not listed here is rejected with InvalidToken)
 *  - withdrawal fee policy (percent + rounding per path)
 *  - attestation (relayer secret + registered foreign emitters)
 *  - in-flight message guard backing store
 *  - global rate limit for mutating endpoints
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /** Wormhole-style id of the chain this ledger runs on. */
    private int chainId = 1;

    /** Maximum length of a payable's allowed tokens-and-amounts list. */
    private int maxTokensAndAmounts = 20;

    /** Maximum length (characters) of a payable description. */
    private int maxDescriptionLength = 3000;

    /** Local addresses of the globally supported tokens. */
    private List<String> supportedTokens = new ArrayList<>();

    private WithdrawalFee withdrawalFee = new WithdrawalFee();

    private Attestation attestation = new Attestation();

    private Guard guard = new Guard();

    private RateLimit rateLimit = new RateLimit();

    @Getter
    @Setter
    public static class WithdrawalFee {

        /** Proportional fee kept by the ledger on every withdrawal. */
        private int percent = 2;

        /**
         * Rounding applied to the fee of a local withdrawal.
         * UP keeps net = amount * (100 - percent) / 100 truncated.
         */
        private RoundingMode rounding = RoundingMode.UP;

        /** Rounding applied to the fee of a withdrawal requested from another chain. */
        private RoundingMode crossChainRounding = RoundingMode.UP;
    }

    @Getter
    @Setter
    public static class Attestation {

        /** Shared HMAC key of the relayer that signs message envelopes. */
        private String secret;

        /** Registered emitter (32-byte hex) per remote chain id. */
        private Map<Integer, String> foreignContracts = new HashMap<>();
    }

    @Getter
    @Setter
    public static class Guard {

        /** "memory" (default) or "redis". */
        private String store = "memory";

        /** Expiry of in-flight keys kept in redis. */
        private Duration ttl = Duration.ofMinutes(5);

        private String redisHost = "localhost";

        private int redisPort = 6379;
    }

    @Getter
    @Setter
    public static class RateLimit {

        private long requestsPerMinute = 100;
    }
}
