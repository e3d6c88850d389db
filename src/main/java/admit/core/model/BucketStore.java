package admit.core.model;

/**
 * Keyed token bucket storage: one bucket per key, one token per admitted request.
 * "nowMillis" comes from the caller so that refill math stays deterministic.
 */
public interface BucketStore {
    Decision allow(String key, long nowMillis);
}
