package admit.java.keys;

/**
 * Maps a request to the partition key of its token bucket.
 * Requests with the same key share the same budget.
 *
 * Implementations must be pure: same request attributes, same key.
 */
@FunctionalInterface
public interface KeyExtractor {
    String extract(AdmissionRequest request);
}
