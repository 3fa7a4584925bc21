package com.chainbills.ledger.config;

import com.chainbills.ledger.dto.ErrorResponse;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Bucket4j;
import io.github.bucket4j.Refill;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Global token bucket (Bucket4j) in front of the state-mutating endpoints.
 *
 * Notes:
 * - The limit is global for the whole node, not per wallet.
 * - Capacity comes from {@code ledger.rate-limit.requests-per-minute}.
 */
@Service
public class RateLimiterService {

    private final Bucket bucket;

    public RateLimiterService(LedgerProperties properties) {
        long perMinute = properties.getRateLimit().getRequestsPerMinute();
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.greedy(perMinute, Duration.ofMinutes(1)));
        this.bucket = Bucket4j.builder().addLimit(limit).build();
    }

    /**
     * Try to consume one token from the bucket.
     * @return true if a request is allowed, false if the limit has been reached.
     */
    public boolean tryConsume() {
        return bucket.tryConsume(1);
    }

    /** 429 body returned by controllers when {@link #tryConsume()} fails. */
    public ResponseEntity<ErrorResponse> tooManyRequests(String path) {
        ErrorResponse error = ErrorResponse.builder()
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error("Too Many Requests")
                .code("RATE_LIMITED")
                .message("Too many requests - please try again later.")
                .path(path)
                .build();
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(error);
    }
}
