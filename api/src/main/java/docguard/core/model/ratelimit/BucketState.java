package docguard.core.model.ratelimit;

/**
 * Token bucket state for one client.
 *
 * <p>The bucket refills continuously: credit is computed from the wall-clock time elapsed
 * since {@code lastRefillMillis} at the moment of each check, so a fraction of the refill
 * interval yields a fraction of a token.
 *
 * @param tokens           the current (fractional) number of tokens
 * @param lastRefillMillis the timestamp of the last refill computation (epoch millis)
 */
public record BucketState(double tokens, long lastRefillMillis) {

    public BucketState {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must be non-negative");
        }
    }

    /**
     * Creates a full bucket.
     *
     * @param capacity  the bucket capacity
     * @param nowMillis the creation time
     * @return the initial state
     */
    public static BucketState full(double capacity, long nowMillis) {
        return new BucketState(capacity, nowMillis);
    }

    /**
     * Returns the state after crediting tokens for the time elapsed up to {@code nowMillis}.
     *
     * <p>Time moving backwards credits nothing but still advances the refill mark.
     *
     * @param capacity            the maximum number of tokens
     * @param refillRatePerSecond tokens credited per second
     * @param nowMillis           the current time
     * @return the refilled state
     */
    public BucketState refill(double capacity, double refillRatePerSecond, long nowMillis) {
        final var elapsedSeconds = Math.max(0, nowMillis - lastRefillMillis) / 1000.0;
        final var newTokens = Math.min(capacity, tokens + elapsedSeconds * refillRatePerSecond);
        return new BucketState(newTokens, nowMillis);
    }

    public boolean hasToken() {
        return tokens >= 1.0;
    }

    /**
     * Returns the state after consuming one token.
     *
     * @return the new state with one fewer token
     * @throws IllegalStateException if less than one token is available
     */
    public BucketState consume() {
        if (!hasToken()) {
            throw new IllegalStateException("No tokens available to consume");
        }
        return new BucketState(tokens - 1.0, lastRefillMillis);
    }

    /**
     * Seconds until one full token is available.
     *
     * @param refillRatePerSecond tokens credited per second
     * @return whole seconds to wait, at least 1 when the bucket is short
     */
    public long secondsUntilToken(double refillRatePerSecond) {
        if (hasToken()) {
            return 0;
        }
        return Math.max(1, (long) Math.ceil((1.0 - tokens) / refillRatePerSecond));
    }
}
