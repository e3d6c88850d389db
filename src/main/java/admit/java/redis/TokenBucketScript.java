package admit.java.redis;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Lua script for an atomic token bucket transition in Redis.
 *
 * <p>Arguments:
 * <ol>
 *   <li>KEYS[1] - bucket key (prefix already applied)</li>
 *   <li>ARGV[1] - refill rate (tokens per second)</li>
 *   <li>ARGV[2] - capacity (max tokens)</li>
 *   <li>ARGV[3] - caller's current time in epoch milliseconds</li>
 *   <li>ARGV[4] - key TTL in seconds</li>
 * </ol>
 *
 * <p>Returns 1 when a token was spent, 0 otherwise. State is written and the TTL refreshed
 * on both outcomes.
 */
final class TokenBucketScript {

    static final String SOURCE =
        """
        local key = KEYS[1]
        local rate = tonumber(ARGV[1])
        local capacity = tonumber(ARGV[2])
        local now = tonumber(ARGV[3])
        local ttl = tonumber(ARGV[4])

        local data = redis.call('HMGET', key, 'tokens', 'last_update')
        local tokens = tonumber(data[1])
        local last_update = tonumber(data[2])

        -- New key: full bucket
        if tokens == nil or last_update == nil then
            tokens = capacity
            last_update = now
        end

        -- A caller clock behind the stored one adds nothing and does not rewind last_update
        local elapsed_ms = now - last_update
        if elapsed_ms < 0 then
            elapsed_ms = 0
        else
            last_update = now
        end
        tokens = math.min(capacity, tokens + (elapsed_ms / 1000.0) * rate)

        local allowed = 0
        if tokens >= 1 then
            tokens = tokens - 1
            allowed = 1
        end

        redis.call('HSET', key, 'tokens', tostring(tokens), 'last_update', tostring(last_update))
        redis.call('EXPIRE', key, ttl)
        return allowed
        """;

    static final String SHA1 = sha1(SOURCE);

    private TokenBucketScript() {
    }

    private static String sha1(String script) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(script.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
