package docguard.adapter.out.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import docguard.core.config.RateLimiterConfig;
import docguard.core.port.out.RateLimiter;

/**
 * CDI producer for the rate limiter.
 *
 * <p>State lives in process memory only; it is not persisted across restarts.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimiterConfig config;
    private final Clock clock;

    @Inject
    public RateLimiterProducer(RateLimiterConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        final var rateLimiter = new InMemoryRateLimiter(
                config.requestsPerMinute(), config.maxConcurrent(), config.cooldownSeconds(), clock);
        LOG.infov(
                "Rate limiting enabled with requestsPerMinute={0}, maxConcurrent={1}, cooldown={2}s",
                config.requestsPerMinute(), config.maxConcurrent(), config.cooldownSeconds());
        return rateLimiter;
    }
}
