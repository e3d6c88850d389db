package admit.java.engine;

import admit.core.clock.Clock;
import admit.core.clock.SystemClock;
import admit.core.model.BucketStore;
import admit.core.model.Decision;
import admit.java.keys.AdmissionRequest;
import admit.java.keys.KeyExtractor;
import admit.java.keys.KeyExtractors;
import admit.java.redis.DistributedBucketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;

/**
 * Admission decisions for one configuration.
 *
 * <p>The backend is chosen once, at construction: with a Redis client the buckets are shared
 * by every instance ({@link Backend#DISTRIBUTED}), without one they live in this process
 * ({@link Backend#LOCAL}).
 *
 * <p>Usage example:
 * <pre>
 * RateLimitConfig config = RateLimitConfig.tokenBucket(200, 100.0)
 *     .withKeyExtractor(KeyExtractors.byClientAddress());
 * RateLimiter limiter = RateLimiter.local(config);
 *
 * if (limiter.decide(request) == Decision.DENY) {
 *     // Reject with "too many requests"
 * }
 * </pre>
 *
 * <p>Thread-safety: safe for concurrent use; both stores handle concurrency internally.
 */
public final class RateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitConfig config;
    private final Clock clock;
    private final Backend backend;
    private final BucketStore store;

    private RateLimiter(RateLimitConfig config, Clock clock, Backend backend, BucketStore store) {
        this.config = config;
        this.clock = clock;
        this.backend = backend;
        this.store = store;
    }

    /**
     * Creates a limiter, picking the backend from the presence of a Redis client.
     *
     * @param config Validated configuration
     * @param clock Time source for {@link #decide(AdmissionRequest)}
     * @param jedis Redis client, or null for in-process buckets
     * @throws IllegalArgumentException if config or clock is null
     */
    public static RateLimiter create(RateLimitConfig config, Clock clock, UnifiedJedis jedis) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        RateLimiter limiter = jedis == null
            ? new RateLimiter(config, clock, Backend.LOCAL, new LocalBucketStore(config))
            : new RateLimiter(config, clock, Backend.DISTRIBUTED, new DistributedBucketStore(jedis, config));

        LOG.info("Rate limiter ready: backend={}, capacity={}, refill={}/s",
            limiter.backend, config.capacity(), config.refillTokensPerSecond());
        return limiter;
    }

    public static RateLimiter local(RateLimitConfig config) {
        return create(config, SystemClock.instance(), null);
    }

    public static RateLimiter local(RateLimitConfig config, Clock clock) {
        return create(config, clock, null);
    }

    public static RateLimiter distributed(RateLimitConfig config, UnifiedJedis jedis) {
        return distributed(config, SystemClock.instance(), jedis);
    }

    public static RateLimiter distributed(RateLimitConfig config, Clock clock, UnifiedJedis jedis) {
        if (jedis == null) {
            throw new IllegalArgumentException("jedis cannot be null");
        }
        return create(config, clock, jedis);
    }

    /**
     * Per client address limiter, in-process buckets.
     */
    public static RateLimiter byClientAddress(long capacity, double refillTokensPerSecond) {
        return local(RateLimitConfig.tokenBucket(capacity, refillTokensPerSecond)
            .withKeyExtractor(KeyExtractors.byClientAddress()));
    }

    /**
     * Per client address limiter, buckets shared through Redis.
     */
    public static RateLimiter byClientAddress(UnifiedJedis jedis, long capacity, double refillTokensPerSecond) {
        return distributed(RateLimitConfig.tokenBucket(capacity, refillTokensPerSecond)
            .withKeyExtractor(KeyExtractors.byClientAddress()), jedis);
    }

    /**
     * Extracts the request's key and spends one token from its bucket.
     *
     * @param request Inbound request attributes
     * @return ALLOW or DENY
     * @throws IllegalArgumentException if request is null
     */
    public Decision decide(AdmissionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return decide(keyFor(request), clock.nowMillis());
    }

    /**
     * Spends one token from the bucket of an already extracted key.
     *
     * @param key Partition key
     * @param nowMillis Caller clock in epoch millis
     * @return ALLOW or DENY
     */
    public Decision decide(String key, long nowMillis) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return store.allow(key, nowMillis);
    }

    public String keyFor(AdmissionRequest request) {
        KeyExtractor extractor = config.keyExtractor();
        String key = extractor.extract(request);
        return key == null ? "" : key;
    }

    public Backend backend() {
        return backend;
    }

    public RateLimitConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    BucketStore store() {
        return store;
    }
}
