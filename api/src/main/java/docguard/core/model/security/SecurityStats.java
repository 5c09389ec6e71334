package docguard.core.model.security;

import docguard.core.model.memory.GlobalMemoryStats;
import docguard.core.model.ratelimit.GlobalRateLimitStats;

/**
 * Aggregate runtime statistics of the validation pipeline.
 *
 * @param rateLimiter rate limiter totals
 * @param memory      memory accounting totals
 */
public record SecurityStats(GlobalRateLimitStats rateLimiter, GlobalMemoryStats memory) {}
