package docguard.adapter.out.ratelimit;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import docguard.core.model.ratelimit.ClientRateLimitStats;
import docguard.core.model.ratelimit.ClientRateState;
import docguard.core.model.ratelimit.ConcurrencyPermit;
import docguard.core.model.ratelimit.GlobalRateLimitStats;
import docguard.core.model.security.ErrorCode;
import docguard.core.model.security.RateLimitException;
import docguard.core.port.out.RateLimiter;

/**
 * In-memory rate limiter implementation.
 *
 * <p>
 * Stores one immutable {@link ClientRateState} per client in a concurrent hash map and
 * replaces it through {@link ConcurrentMap#compute}, so every check-and-update for a
 * client is atomic. Clients never share a lock.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * <li>No automatic cleanup of idle clients</li>
 * </ul>
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private final ConcurrentMap<String, ClientRateState> states;
    private final int requestsPerMinute;
    private final int maxConcurrent;
    private final long cooldownMillis;
    private final double refillRatePerSecond;
    private final Clock clock;

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param requestsPerMinute bucket capacity and refill rate
     * @param maxConcurrent     concurrent permits per client
     * @param cooldownSeconds   cooldown window after a recorded error
     * @param clock             time source
     * @throws IllegalArgumentException for non-positive limits or a negative cooldown
     */
    public InMemoryRateLimiter(int requestsPerMinute, int maxConcurrent, int cooldownSeconds, Clock clock) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be greater than 0");
        }
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be greater than 0");
        }
        if (cooldownSeconds < 0) {
            throw new IllegalArgumentException("cooldownSeconds must be non-negative");
        }
        this.states = new ConcurrentHashMap<>();
        this.requestsPerMinute = requestsPerMinute;
        this.maxConcurrent = maxConcurrent;
        this.cooldownMillis = cooldownSeconds * 1000L;
        this.refillRatePerSecond = requestsPerMinute / 60.0;
        this.clock = clock;
    }

    @Override
    public void checkLimit(String clientId) {
        admit(clientId, false);
    }

    @Override
    public ConcurrencyPermit acquire(String clientId) {
        return admit(clientId, true);
    }

    @Override
    public void release(ConcurrencyPermit permit) {
        if (permit == null) {
            return;
        }
        states.computeIfPresent(permit.clientId(), (k, state) -> state.withoutPermit(permit.id()));
    }

    @Override
    public void recordError(String clientId) {
        final var nowMillis = clock.millis();
        states.compute(clientId, (k, state) -> stateOrInitial(state, nowMillis)
                .withCooldownUntil(nowMillis + cooldownMillis));
    }

    @Override
    public void reset(String clientId) {
        states.remove(clientId);
    }

    @Override
    public void resetAll() {
        states.clear();
    }

    @Override
    public ClientRateLimitStats getStats(String clientId) {
        final var nowMillis = clock.millis();
        final var state = stateOrInitial(states.get(clientId), nowMillis);
        final var bucket = state.bucket().refill(requestsPerMinute, refillRatePerSecond, nowMillis);
        return new ClientRateLimitStats(
                Math.floor(bucket.tokens() * 10) / 10,
                state.concurrentActive(),
                state.inCooldown(nowMillis),
                state.cooldownRemainingSeconds(nowMillis),
                state.totalRequests());
    }

    @Override
    public GlobalRateLimitStats getGlobalStats() {
        final var nowMillis = clock.millis();
        long totalRequests = 0;
        int inCooldown = 0;
        int clients = 0;
        for (final var state : states.values()) {
            clients++;
            totalRequests += state.totalRequests();
            if (state.inCooldown(nowMillis)) {
                inCooldown++;
            }
        }
        return new GlobalRateLimitStats(clients, totalRequests, inCooldown);
    }

    /**
     * Returns the current number of tracked clients.
     *
     * @return the number of clients with state
     */
    public int getClientCount() {
        return states.size();
    }

    private ConcurrencyPermit admit(String clientId, boolean takePermit) {
        final var nowMillis = clock.millis();
        final var rejection = new RateLimitException[1];
        final var permit = takePermit ? new ConcurrencyPermit(UUID.randomUUID().toString(), clientId) : null;

        // Atomic compute to handle concurrent requests; nothing changes on rejection
        states.compute(clientId, (k, current) -> {
            final var state = stateOrInitial(current, nowMillis);
            rejection[0] = null;

            if (state.inCooldown(nowMillis)) {
                final var remaining = state.cooldownRemainingSeconds(nowMillis);
                rejection[0] = new RateLimitException(
                        "Client in cooldown for " + remaining + " more seconds", ErrorCode.IN_COOLDOWN, remaining);
                return state;
            }

            final var bucket = state.bucket().refill(requestsPerMinute, refillRatePerSecond, nowMillis);
            if (!bucket.hasToken()) {
                final var wait = bucket.secondsUntilToken(refillRatePerSecond);
                rejection[0] = new RateLimitException(
                        "Rate limit exceeded. Try again in " + wait + " seconds",
                        ErrorCode.RATE_LIMIT_EXCEEDED,
                        wait);
                return state.withBucket(bucket);
            }

            if (takePermit && state.concurrentActive() >= maxConcurrent) {
                rejection[0] = new RateLimitException(
                        "Concurrent limit of " + maxConcurrent + " exceeded", ErrorCode.CONCURRENT_LIMIT_EXCEEDED, 0);
                return state;
            }

            final var consumed = state.consumed(bucket.consume());
            return takePermit ? consumed.withPermit(permit.id()) : consumed;
        });

        if (rejection[0] != null) {
            throw rejection[0];
        }
        return permit;
    }

    private ClientRateState stateOrInitial(ClientRateState state, long nowMillis) {
        return state != null ? state : ClientRateState.initial(requestsPerMinute, nowMillis);
    }
}
