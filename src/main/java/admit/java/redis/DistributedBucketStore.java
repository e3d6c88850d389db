package admit.java.redis;

import admit.core.model.BucketStore;
import admit.core.model.Decision;
import admit.java.engine.FailureMode;
import admit.java.engine.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.exceptions.JedisNoScriptException;

import java.util.List;

/**
 * Redis-backed token buckets shared by every process that uses the same key prefix.
 *
 * <p>The whole refill/consume transition runs inside one Lua script, so concurrent callers
 * from different processes cannot double-spend a token. The caller supplies "now"; instances
 * sharing a budget are expected to run with loosely synchronized clocks (NTP).
 *
 * <p>Failures (connection refused, timeout, pool exhausted, script error, unexpected reply)
 * are never propagated: the configured {@link FailureMode} decides, ALLOW by default.
 * No retries, so one check costs at most one round trip plus the client timeout.
 *
 * <p>Key format: {@code {keyPrefix}{key}}, a hash with fields {@code tokens} and
 * {@code last_update}, expiring after {@code ttlSeconds} without access.
 */
public final class DistributedBucketStore implements BucketStore {

    private static final Logger LOG = LoggerFactory.getLogger(DistributedBucketStore.class);

    private final UnifiedJedis jedis;
    private final String keyPrefix;
    private final String capacity;
    private final String refillRate;
    private final String ttlSeconds;
    private final FailureMode failureMode;

    /**
     * @param jedis Thread-safe pooled client (e.g. JedisPooled); timeouts are configured on it
     * @param config Bucket parameters, key prefix, TTL and failure mode
     * @throws IllegalArgumentException if any parameter is null
     */
    public DistributedBucketStore(UnifiedJedis jedis, RateLimitConfig config) {
        if (jedis == null) {
            throw new IllegalArgumentException("jedis cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.jedis = jedis;
        this.keyPrefix = config.keyPrefix();
        this.capacity = String.valueOf(config.capacity());
        this.refillRate = String.valueOf(config.refillTokensPerSecond());
        this.ttlSeconds = String.valueOf(config.ttlSeconds());
        this.failureMode = config.failureMode();
    }

    @Override
    public Decision allow(String key, long nowMillis) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        String redisKey = keyPrefix + key;
        try {
            Object reply = runScript(redisKey, nowMillis);
            return parseDecision(reply);
        } catch (JedisException | IllegalStateException e) {
            LOG.warn("Redis rate limit check failed for key {}, returning {}",
                redisKey, failureMode.decision(), e);
            return failureMode.decision();
        }
    }

    private Object runScript(String redisKey, long nowMillis) {
        List<String> keys = List.of(redisKey);
        List<String> args = List.of(refillRate, capacity, String.valueOf(nowMillis), ttlSeconds);
        try {
            return jedis.evalsha(TokenBucketScript.SHA1, keys, args);
        } catch (JedisNoScriptException e) {
            // Script cache flushed or never loaded on this node; EVAL loads it again
            return jedis.eval(TokenBucketScript.SOURCE, keys, args);
        }
    }

    private static Decision parseDecision(Object reply) {
        if (reply instanceof Long allowed) {
            return allowed == 1L ? Decision.ALLOW : Decision.DENY;
        }
        throw new IllegalStateException("Unexpected reply from token bucket script: " + reply);
    }
}
