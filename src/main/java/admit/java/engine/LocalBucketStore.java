package admit.java.engine;

import admit.core.algorithms.token_bucket.TokenBucket;
import admit.core.model.BucketState;
import admit.core.model.BucketStore;
import admit.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-process token buckets, one per key.
 *
 * Architecture:
 * - HashMap of BucketEntry (TokenBucket + ReentrantLock), guarded by a read/write lock
 * - Lookup takes the read lock; a miss takes the write lock, re-checks and inserts
 * - The refill/consume transition runs under the bucket's own lock only, so different
 *   keys never contend and the map lock is never held while a bucket is charged
 *
 * Memory management:
 * - With idleEvictionMillis = 0, buckets live for the lifetime of the store. High key
 *   cardinality (per-address limits under attack) then grows memory without bound.
 * - With idleEvictionMillis > 0, inserting a new key sweeps buckets idle longer than the
 *   window, at most once per window. Only buckets that have refilled to capacity are
 *   dropped: a dropped key comes back full, so a partially drained bucket must stay.
 */
public final class LocalBucketStore implements BucketStore {

    private static final Logger LOG = LoggerFactory.getLogger(LocalBucketStore.class);

    private final long capacity;
    private final double refillTokensPerSecond;
    private final long idleEvictionMillis;

    private final Map<String, BucketEntry> buckets = new HashMap<>();
    private final Lock readLock;
    private final Lock writeLock;

    // Guarded by writeLock
    private long lastSweepMillis;

    /**
     * @param capacity Maximum tokens per bucket
     * @param refillTokensPerSecond Tokens added per second
     * @param idleEvictionMillis Idle window after which buckets may be dropped, 0 to disable
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public LocalBucketStore(long capacity, double refillTokensPerSecond, long idleEvictionMillis) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        if (!(refillTokensPerSecond > 0) || Double.isInfinite(refillTokensPerSecond)) {
            throw new IllegalArgumentException("refillRate must be finite and > 0");
        }
        if (idleEvictionMillis < 0) {
            throw new IllegalArgumentException("idleEvictionMillis must be >= 0");
        }

        this.capacity = capacity;
        this.refillTokensPerSecond = refillTokensPerSecond;
        this.idleEvictionMillis = idleEvictionMillis;

        ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    public LocalBucketStore(RateLimitConfig config) {
        this(config.capacity(), config.refillTokensPerSecond(), config.idleEvictionMillis());
    }

    /**
     * Refills the key's bucket up to nowMillis and spends one token if available.
     *
     * @param key Partition key (not null, may be empty)
     * @param nowMillis Caller clock in epoch millis
     * @return ALLOW if a token was spent, DENY otherwise
     * @throws IllegalArgumentException if key is null
     */
    @Override
    public Decision allow(String key, long nowMillis) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        while (true) {
            BucketEntry entry = getOrCreate(key, nowMillis);

            ReentrantLock lock = entry.getLock();
            lock.lock();
            try {
                if (entry.isEvicted()) {
                    // Swept between lookup and lock; charge the replacement instead
                    continue;
                }
                return entry.getBucket().tryConsume(nowMillis);
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Drops buckets whose last transition is older than the idle window and that have
     * refilled to capacity. No-op when idle eviction is disabled.
     *
     * @param nowMillis Reference time
     * @return Number of buckets removed
     */
    public int evictIdle(long nowMillis) {
        if (idleEvictionMillis == 0) {
            return 0;
        }
        writeLock.lock();
        try {
            lastSweepMillis = nowMillis;
            return sweep(nowMillis);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Snapshot of a bucket, without refilling it.
     */
    public Optional<BucketState> state(String key) {
        BucketEntry entry;
        readLock.lock();
        try {
            entry = buckets.get(key);
        } finally {
            readLock.unlock();
        }
        if (entry == null) {
            return Optional.empty();
        }

        entry.getLock().lock();
        try {
            return entry.isEvicted() ? Optional.empty() : Optional.of(entry.getBucket().state());
        } finally {
            entry.getLock().unlock();
        }
    }

    /**
     * Returns the number of currently tracked keys.
     */
    public int size() {
        readLock.lock();
        try {
            return buckets.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Drops every bucket. Primarily useful for testing.
     */
    public void clear() {
        writeLock.lock();
        try {
            for (BucketEntry entry : buckets.values()) {
                entry.getLock().lock();
                try {
                    entry.markEvicted();
                } finally {
                    entry.getLock().unlock();
                }
            }
            buckets.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private BucketEntry getOrCreate(String key, long nowMillis) {
        // Fast path: bucket already exists
        readLock.lock();
        try {
            BucketEntry entry = buckets.get(key);
            if (entry != null) {
                return entry;
            }
        } finally {
            readLock.unlock();
        }

        // Slow path: re-check under the write lock so only one bucket is ever created per key
        writeLock.lock();
        try {
            BucketEntry entry = buckets.get(key);
            if (entry == null) {
                sweepIfDue(nowMillis);
                entry = new BucketEntry(new TokenBucket(capacity, refillTokensPerSecond, nowMillis));
                buckets.put(key, entry);
            }
            return entry;
        } finally {
            writeLock.unlock();
        }
    }

    // Caller holds writeLock
    private void sweepIfDue(long nowMillis) {
        if (idleEvictionMillis == 0 || nowMillis - lastSweepMillis < idleEvictionMillis) {
            return;
        }
        lastSweepMillis = nowMillis;
        int removed = sweep(nowMillis);
        if (removed > 0) {
            LOG.debug("Evicted {} idle buckets, {} remaining", removed, buckets.size());
        }
    }

    // Caller holds writeLock. Bucket locks are only ever taken after the map lock, never before.
    private int sweep(long nowMillis) {
        int removed = 0;
        Iterator<BucketEntry> it = buckets.values().iterator();
        while (it.hasNext()) {
            BucketEntry entry = it.next();
            entry.getLock().lock();
            try {
                TokenBucket bucket = entry.getBucket();
                if (nowMillis - bucket.lastUpdateMillis() >= idleEvictionMillis && bucket.isFullAt(nowMillis)) {
                    entry.markEvicted();
                    it.remove();
                    removed++;
                }
            } finally {
                entry.getLock().unlock();
            }
        }
        return removed;
    }
}
