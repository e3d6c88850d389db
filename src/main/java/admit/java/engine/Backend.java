package admit.java.engine;

/**
 * Where bucket state lives. Chosen once, when the RateLimiter is built.
 */
public enum Backend {
    /**
     * Buckets in this process only. Each instance enforces its own budget.
     */
    LOCAL,

    /**
     * Buckets in Redis, shared by every instance using the same key prefix.
     */
    DISTRIBUTED
}
