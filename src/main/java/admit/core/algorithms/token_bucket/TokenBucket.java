package admit.core.algorithms.token_bucket;

import admit.core.model.BucketState;
import admit.core.model.Decision;

/**
 * Token Bucket:
 * - capacity: max tokens (burst)
 * - refillTokensPerSecond: continuous refill
 *
 * A new bucket starts full. Each admitted request spends one token.
 * Both outcomes move lastUpdate forward so fractional refill restarts from "now".
 *
 * Thread-safety: none. Callers serialize access (see LocalBucketStore).
 */
public final class TokenBucket {
    private final long capacity;
    private final double refillPerMillis;

    private double tokens;
    private long lastMillis;

    public TokenBucket(long capacity, double refillTokensPerSecond, long nowMillis) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (!(refillTokensPerSecond > 0) || Double.isInfinite(refillTokensPerSecond)) {
            throw new IllegalArgumentException("refill must be finite and > 0");
        }
        this.capacity = capacity;
        this.refillPerMillis = refillTokensPerSecond / 1_000d;
        this.tokens = capacity;
        this.lastMillis = nowMillis;
    }

    public Decision tryConsume(long nowMillis) {
        refill(nowMillis);

        if (tokens >= 1) {
            tokens -= 1;
            return Decision.ALLOW;
        }
        return Decision.DENY;
    }

    public BucketState state() {
        return new BucketState(tokens, lastMillis);
    }

    public long lastUpdateMillis() {
        return lastMillis;
    }

    /**
     * True if the bucket would hold capacity tokens at nowMillis. Does not refill.
     */
    public boolean isFullAt(long nowMillis) {
        long elapsed = Math.max(0L, nowMillis - lastMillis);
        return tokens + elapsed * refillPerMillis >= capacity;
    }

    private void refill(long nowMillis) {
        // A clock that steps backwards adds nothing and never rewinds lastMillis.
        long elapsed = Math.max(0L, nowMillis - lastMillis);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + elapsed * refillPerMillis);
        lastMillis = nowMillis;
    }
}
