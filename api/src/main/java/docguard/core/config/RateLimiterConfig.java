package docguard.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for per-client request throttling.
 *
 * <p>Configuration prefix: {@code docguard.rate-limiter}
 *
 * <p>Each client gets a token bucket holding {@link #requestsPerMinute()} tokens that
 * refills continuously, a ceiling on in-flight requests, and a cooldown window that
 * starts whenever an error is recorded against the client.
 *
 * @see docguard.adapter.out.ratelimit.InMemoryRateLimiter
 */
@ConfigMapping(prefix = "docguard.rate-limiter")
public interface RateLimiterConfig {

    /**
     * Bucket capacity and refill rate.
     *
     * @return requests per minute (default: 20)
     */
    @WithDefault("20")
    int requestsPerMinute();

    /**
     * Maximum concurrent in-flight requests per client.
     *
     * @return max concurrent (default: 3)
     */
    @WithDefault("3")
    int maxConcurrent();

    /**
     * Length of the cooldown window after an error is recorded.
     *
     * @return cooldown in seconds (default: 5)
     */
    @WithDefault("5")
    int cooldownSeconds();
}
