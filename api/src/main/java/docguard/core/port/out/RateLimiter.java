package docguard.core.port.out;

import docguard.core.model.ratelimit.ClientRateLimitStats;
import docguard.core.model.ratelimit.ConcurrencyPermit;
import docguard.core.model.ratelimit.GlobalRateLimitStats;
import docguard.core.model.security.RateLimitException;

/**
 * Port interface for per-client throttling.
 *
 * <p>Three mechanisms are tracked independently per client id: a continuously refilling
 * token bucket, a ceiling on concurrent requests, and a cooldown window opened by
 * {@link #recordError(String)}. One client's state never affects another's.
 *
 * <p>All operations are atomic with respect to concurrent callers.
 */
public interface RateLimiter {

    /**
     * Consume one token for the client.
     *
     * @param clientId the client
     * @throws RateLimitException with {@code IN_COOLDOWN} during cooldown, or
     *                            {@code RATE_LIMIT_EXCEEDED} when the bucket holds less than one token
     */
    void checkLimit(String clientId);

    /**
     * Consume one token and take one concurrency slot.
     *
     * <p>Nothing is committed when any check fails.
     *
     * @param clientId the client
     * @return a permit to hand back to {@link #release(ConcurrencyPermit)}
     * @throws RateLimitException with {@code IN_COOLDOWN}, {@code RATE_LIMIT_EXCEEDED} or
     *                            {@code CONCURRENT_LIMIT_EXCEEDED}
     */
    ConcurrencyPermit acquire(String clientId);

    /**
     * Give back a concurrency slot. Unknown and already released permits are ignored.
     *
     * @param permit the permit (may be null)
     */
    void release(ConcurrencyPermit permit);

    /**
     * Start the cooldown window for the client.
     *
     * @param clientId the client
     */
    void recordError(String clientId);

    /**
     * Forget all state for the client, including held permits.
     *
     * @param clientId the client
     */
    void reset(String clientId);

    /**
     * Forget all state for every client.
     */
    void resetAll();

    /**
     * Current statistics for one client. A client never seen reports a full bucket.
     *
     * @param clientId the client
     * @return the statistics
     */
    ClientRateLimitStats getStats(String clientId);

    /**
     * Totals across all tracked clients.
     *
     * @return the statistics
     */
    GlobalRateLimitStats getGlobalStats();
}
