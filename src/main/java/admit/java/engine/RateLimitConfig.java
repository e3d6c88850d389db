package admit.java.engine;

import admit.java.keys.KeyExtractor;
import admit.java.keys.KeyExtractors;

import java.time.Duration;

/**
 * Immutable configuration of one RateLimiter.
 *
 * @param capacity Maximum tokens per bucket (burst), at least 1
 * @param refillTokensPerSecond Tokens added per second, finite and > 0
 * @param keyExtractor Request to partition key; null means one global bucket
 * @param keyPrefix Namespace for keys in Redis (distributed backend only)
 * @param ttlSeconds Idle expiry of keys in Redis (distributed backend only)
 * @param failureMode Decision when Redis cannot be consulted (distributed backend only)
 * @param idleEvictionMillis Local buckets idle longer than this are dropped; 0 keeps them forever (local backend only)
 */
public record RateLimitConfig(
    long capacity,
    double refillTokensPerSecond,
    KeyExtractor keyExtractor,
    String keyPrefix,
    long ttlSeconds,
    FailureMode failureMode,
    long idleEvictionMillis
) {
    public static final String DEFAULT_KEY_PREFIX = "ratelimit:";
    public static final long DEFAULT_TTL_SECONDS = 60;

    public RateLimitConfig {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        if (!(refillTokensPerSecond > 0) || Double.isInfinite(refillTokensPerSecond)) {
            throw new IllegalArgumentException("refillRate must be finite and > 0, got: " + refillTokensPerSecond);
        }
        if (ttlSeconds < 1) throw new IllegalArgumentException("ttlSeconds must be >= 1, got: " + ttlSeconds);
        if (idleEvictionMillis < 0) throw new IllegalArgumentException("idleEvictionMillis must be >= 0");

        keyExtractor = keyExtractor == null ? KeyExtractors.global() : keyExtractor;
        keyPrefix = keyPrefix == null ? DEFAULT_KEY_PREFIX : keyPrefix;
        failureMode = failureMode == null ? FailureMode.FAIL_OPEN : failureMode;
    }

    /**
     * Creates a Token Bucket configuration with a global key and default Redis settings.
     *
     * @param capacity Maximum tokens
     * @param refillTokensPerSecond Tokens added per second
     * @return Configuration for Token Bucket
     */
    public static RateLimitConfig tokenBucket(long capacity, double refillTokensPerSecond) {
        return new RateLimitConfig(
            capacity,
            refillTokensPerSecond,
            KeyExtractors.global(),
            DEFAULT_KEY_PREFIX,
            DEFAULT_TTL_SECONDS,
            FailureMode.FAIL_OPEN,
            0L
        );
    }

    public RateLimitConfig withKeyExtractor(KeyExtractor extractor) {
        return new RateLimitConfig(capacity, refillTokensPerSecond, extractor, keyPrefix,
            ttlSeconds, failureMode, idleEvictionMillis);
    }

    public RateLimitConfig withKeyPrefix(String prefix) {
        return new RateLimitConfig(capacity, refillTokensPerSecond, keyExtractor, prefix,
            ttlSeconds, failureMode, idleEvictionMillis);
    }

    public RateLimitConfig withTtlSeconds(long ttl) {
        return new RateLimitConfig(capacity, refillTokensPerSecond, keyExtractor, keyPrefix,
            ttl, failureMode, idleEvictionMillis);
    }

    public RateLimitConfig withFailureMode(FailureMode mode) {
        return new RateLimitConfig(capacity, refillTokensPerSecond, keyExtractor, keyPrefix,
            ttlSeconds, mode, idleEvictionMillis);
    }

    public RateLimitConfig withIdleEviction(Duration idle) {
        if (idle == null || idle.isNegative()) {
            throw new IllegalArgumentException("idle eviction must be >= 0");
        }
        return new RateLimitConfig(capacity, refillTokensPerSecond, keyExtractor, keyPrefix,
            ttlSeconds, failureMode, idle.toMillis());
    }
}
