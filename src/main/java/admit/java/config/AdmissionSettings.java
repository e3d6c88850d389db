package admit.java.config;

import admit.java.engine.FailureMode;
import admit.java.engine.RateLimitConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of the standalone decision server.
 *
 * <p>Loaded from {@value #RESOURCE} on the classpath; any JVM system property with the same
 * name wins (e.g. {@code -Dadmission.redis.host=redis.internal}). A blank
 * {@code admission.redis.host} selects in-process buckets.
 *
 * @param port gRPC listen port
 * @param capacity bucket capacity (burst)
 * @param refillTokensPerSecond refill rate
 * @param failureMode decision when Redis cannot be consulted
 * @param idleEviction local idle eviction window, zero to keep buckets forever
 * @param redisHost Redis host, "" for the local backend
 * @param redisPort Redis port
 * @param redisTimeout connect, read and pool-wait timeout for one check
 * @param keyPrefix Redis key namespace
 * @param ttlSeconds Redis idle key expiry
 */
public record AdmissionSettings(
    int port,
    long capacity,
    double refillTokensPerSecond,
    FailureMode failureMode,
    Duration idleEviction,
    String redisHost,
    int redisPort,
    Duration redisTimeout,
    String keyPrefix,
    long ttlSeconds
) {
    public static final String RESOURCE = "admission.properties";

    static final String PORT = "admission.server.port";
    static final String CAPACITY = "admission.capacity";
    static final String RATE = "admission.rate";
    static final String FAILURE_MODE = "admission.failure-mode";
    static final String IDLE_EVICTION_SECONDS = "admission.local.idle-eviction-seconds";
    static final String REDIS_HOST = "admission.redis.host";
    static final String REDIS_PORT = "admission.redis.port";
    static final String REDIS_TIMEOUT_MILLIS = "admission.redis.timeout-millis";
    static final String REDIS_KEY_PREFIX = "admission.redis.key-prefix";
    static final String REDIS_TTL_SECONDS = "admission.redis.ttl-seconds";

    public AdmissionSettings {
        redisHost = redisHost == null ? "" : redisHost.trim();
        keyPrefix = keyPrefix == null ? RateLimitConfig.DEFAULT_KEY_PREFIX : keyPrefix;
    }

    /**
     * Classpath defaults overridden by system properties.
     */
    public static AdmissionSettings load() {
        Properties merged = new Properties();
        try (InputStream in = AdmissionSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        System.getProperties().forEach((name, value) -> {
            if (name.toString().startsWith("admission.")) {
                merged.put(name, value);
            }
        });
        return from(merged);
    }

    /**
     * @throws IllegalArgumentException naming the offending property if a value does not parse
     */
    public static AdmissionSettings from(Properties props) {
        return new AdmissionSettings(
            intValue(props, PORT, 9090),
            longValue(props, CAPACITY, 200),
            doubleValue(props, RATE, 100.0),
            failureMode(props),
            Duration.ofSeconds(longValue(props, IDLE_EVICTION_SECONDS, 0)),
            props.getProperty(REDIS_HOST, ""),
            intValue(props, REDIS_PORT, 6379),
            Duration.ofMillis(longValue(props, REDIS_TIMEOUT_MILLIS, 100)),
            props.getProperty(REDIS_KEY_PREFIX, RateLimitConfig.DEFAULT_KEY_PREFIX),
            longValue(props, REDIS_TTL_SECONDS, RateLimitConfig.DEFAULT_TTL_SECONDS)
        );
    }

    public boolean distributed() {
        return !redisHost.isEmpty();
    }

    public AdmissionSettings withPort(int newPort) {
        return new AdmissionSettings(newPort, capacity, refillTokensPerSecond, failureMode, idleEviction,
            redisHost, redisPort, redisTimeout, keyPrefix, ttlSeconds);
    }

    /**
     * Bucket configuration with a global key extractor; the decision service receives keys
     * already extracted by its callers.
     *
     * @throws IllegalArgumentException if the values are not a valid bucket configuration
     */
    public RateLimitConfig toRateLimitConfig() {
        return RateLimitConfig.tokenBucket(capacity, refillTokensPerSecond)
            .withKeyPrefix(keyPrefix)
            .withTtlSeconds(ttlSeconds)
            .withFailureMode(failureMode)
            .withIdleEviction(idleEviction);
    }

    private static String raw(Properties props, String name) {
        String value = props.getProperty(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Properties props, String name, int defaultValue) {
        String value = raw(props, name);
        try {
            return value == null ? defaultValue : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    private static long longValue(Properties props, String name, long defaultValue) {
        String value = raw(props, name);
        try {
            return value == null ? defaultValue : Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    private static double doubleValue(Properties props, String name, double defaultValue) {
        String value = raw(props, name);
        try {
            return value == null ? defaultValue : Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    private static FailureMode failureMode(Properties props) {
        String value = raw(props, FAILURE_MODE);
        if (value == null) {
            return FailureMode.FAIL_OPEN;
        }
        try {
            return FailureMode.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(FAILURE_MODE + " must be FAIL_OPEN or FAIL_CLOSED: " + value, e);
        }
    }
}
