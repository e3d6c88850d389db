package admit.java.redis;

import admit.java.config.AdmissionSettings;
import redis.clients.jedis.ConnectionPoolConfig;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;

import java.time.Duration;

/**
 * Builds the pooled Redis client used by DistributedBucketStore.
 *
 * One timeout bounds every step of a check: connect, socket read and waiting for a pooled
 * connection. Whatever happens, a check returns within roughly that time.
 */
public final class RedisConnections {

    private static final int DEFAULT_POOL_SIZE = 32;

    private RedisConnections() {
        // Utility class, no instantiation
    }

    public static JedisPooled open(String host, int port, Duration timeout) {
        return open(host, port, timeout, DEFAULT_POOL_SIZE);
    }

    public static JedisPooled open(String host, int port, Duration timeout, int poolSize) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }

        int timeoutMillis = Math.toIntExact(timeout.toMillis());
        JedisClientConfig clientConfig = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeoutMillis)
            .socketTimeoutMillis(timeoutMillis)
            .build();

        ConnectionPoolConfig poolConfig = new ConnectionPoolConfig();
        poolConfig.setMaxTotal(poolSize);
        poolConfig.setMaxIdle(poolSize);
        poolConfig.setMaxWait(timeout);
        poolConfig.setBlockWhenExhausted(true);

        return new JedisPooled(new HostAndPort(host, port), clientConfig, poolConfig);
    }

    public static JedisPooled open(AdmissionSettings settings) {
        return open(settings.redisHost(), settings.redisPort(), settings.redisTimeout());
    }
}
