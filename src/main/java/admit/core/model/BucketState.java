package admit.core.model;

/**
 * Snapshot of one token bucket.
 *
 * @param tokens available tokens, between 0 and the bucket capacity
 * @param lastUpdateMillis epoch millis of the last refill/consume transition
 */
public record BucketState(
    double tokens,
    long lastUpdateMillis
) {
    public static BucketState full(long capacity, long nowMillis) {
        return new BucketState(capacity, nowMillis);
    }
}
