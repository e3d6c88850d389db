package admit.core.clock;

/**
 * Time source in epoch milliseconds.
 * Distributed buckets compare timestamps from different processes, so this is wall time.
 */
public interface Clock {
    long nowMillis();
}
