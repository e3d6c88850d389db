package admit.java.engine;

import admit.core.algorithms.token_bucket.TokenBucket;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A token bucket with its own lock.
 *
 * The lock must be held to touch the bucket or the evicted flag. Once evicted, an entry
 * is no longer in the store map and must not be charged; callers look the key up again.
 */
final class BucketEntry {

    private final TokenBucket bucket;
    private final ReentrantLock lock;
    private boolean evicted;

    BucketEntry(TokenBucket bucket) {
        if (bucket == null) {
            throw new IllegalArgumentException("bucket cannot be null");
        }
        this.bucket = bucket;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    /**
     * MUST be called while holding the lock.
     */
    TokenBucket getBucket() {
        return bucket;
    }

    ReentrantLock getLock() {
        return lock;
    }

    /**
     * MUST be called while holding the lock.
     */
    boolean isEvicted() {
        return evicted;
    }

    /**
     * MUST be called while holding the lock.
     */
    void markEvicted() {
        evicted = true;
    }
}
