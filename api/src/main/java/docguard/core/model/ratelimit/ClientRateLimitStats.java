package docguard.core.model.ratelimit;

/**
 * Rate limit statistics for one client.
 *
 * @param tokensRemaining   available tokens, rounded down to one decimal
 * @param concurrentActive  permits currently held
 * @param inCooldown        whether the client is cooling down
 * @param cooldownRemaining seconds of cooldown left (0 when not cooling down)
 * @param totalRequests     lifetime accepted requests
 */
public record ClientRateLimitStats(
        double tokensRemaining, int concurrentActive, boolean inCooldown, long cooldownRemaining, long totalRequests) {}
