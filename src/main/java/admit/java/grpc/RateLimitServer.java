package admit.java.grpc;

import admit.core.clock.SystemClock;
import admit.java.config.AdmissionSettings;
import admit.java.engine.RateLimitConfig;
import admit.java.engine.RateLimiter;
import admit.java.redis.RedisConnections;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the decision service.
 *
 * <p>Features:
 * <ul>
 *   <li>Settings from admission.properties and system properties</li>
 *   <li>Port override from the first argument</li>
 *   <li>Redis-backed buckets when admission.redis.host is set, in-process otherwise</li>
 *   <li>Graceful shutdown with timeout; the Redis pool is closed after the server</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * java -Dadmission.redis.host=localhost -cp ... admit.java.grpc.RateLimitServer 8080
 * </pre>
 */
public final class RateLimitServer {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimitServer.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final AutoCloseable redis;

    /**
     * Creates a server with a custom limiter (useful for testing).
     *
     * @param port Port to listen on
     * @param limiter Rate limiter
     */
    public RateLimitServer(int port, RateLimiter limiter) {
        this(port, limiter, null);
    }

    private RateLimitServer(int port, RateLimiter limiter, AutoCloseable redis) {
        this.server = ServerBuilder.forPort(port)
            .addService(new RateLimitServiceImpl(limiter))
            .build();
        this.redis = redis;
    }

    /**
     * Builds the limiter described by the settings, opening a Redis pool if a host is set.
     *
     * @throws IllegalArgumentException if the settings are not a valid bucket configuration;
     *         no Redis pool is opened in that case
     */
    public static RateLimitServer fromSettings(AdmissionSettings settings) {
        // Validate before opening anything that needs closing
        RateLimitConfig config = settings.toRateLimitConfig();
        if (!settings.distributed()) {
            RateLimiter limiter = RateLimiter.local(config, SystemClock.instance());
            return new RateLimitServer(settings.port(), limiter, null);
        }

        JedisPooled jedis = RedisConnections.open(settings);
        RateLimiter limiter = RateLimiter.distributed(config, SystemClock.instance(), jedis);
        LOG.info("Sharing buckets through Redis at {}:{} (prefix '{}')",
            settings.redisHost(), settings.redisPort(), settings.keyPrefix());
        return new RateLimitServer(settings.port(), limiter, jedis);
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        LOG.info("RateLimitServer started on port: {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                RateLimitServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Shutdown interrupted", e);
            }
        }));
    }

    /**
     * Stops the server gracefully, then releases the Redis pool.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        try {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            LOG.info("RateLimitServer stopped.");
        } finally {
            closeRedis();
        }
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    private void closeRedis() {
        if (redis == null) {
            return;
        }
        try {
            redis.close();
        } catch (Exception e) {
            LOG.warn("Failed to close Redis pool", e);
        }
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        AdmissionSettings settings = AdmissionSettings.load();

        if (args.length > 0) {
            try {
                settings = settings.withPort(Integer.parseInt(args[0]));
            } catch (NumberFormatException e) {
                LOG.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        RateLimitServer server = RateLimitServer.fromSettings(settings);
        server.start();
        server.blockUntilShutdown();
    }
}
