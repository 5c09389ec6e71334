package docguard.core.model.ratelimit;

import java.util.HashSet;
import java.util.Set;

/**
 * Immutable rate limit state for one client id.
 *
 * <p>Token bucket, concurrency and cooldown are tracked independently. Instances are
 * replaced atomically, never mutated.
 *
 * @param bucket              the token bucket
 * @param activePermits       ids of concurrency permits currently held
 * @param cooldownUntilMillis end of the cooldown window (epoch millis), 0 when none
 * @param totalRequests       lifetime count of accepted requests
 */
public record ClientRateState(
        BucketState bucket, Set<String> activePermits, long cooldownUntilMillis, long totalRequests) {

    public ClientRateState {
        activePermits = Set.copyOf(activePermits);
    }

    public static ClientRateState initial(double capacity, long nowMillis) {
        return new ClientRateState(BucketState.full(capacity, nowMillis), Set.of(), 0, 0);
    }

    public int concurrentActive() {
        return activePermits.size();
    }

    public boolean inCooldown(long nowMillis) {
        return cooldownUntilMillis > 0 && nowMillis < cooldownUntilMillis;
    }

    /**
     * Seconds of cooldown left, rounded up.
     *
     * @param nowMillis the current time
     * @return remaining seconds, 0 when not cooling down
     */
    public long cooldownRemainingSeconds(long nowMillis) {
        if (!inCooldown(nowMillis)) {
            return 0;
        }
        return (long) Math.ceil((cooldownUntilMillis - nowMillis) / 1000.0);
    }

    public ClientRateState withBucket(BucketState newBucket) {
        return new ClientRateState(newBucket, activePermits, cooldownUntilMillis, totalRequests);
    }

    public ClientRateState consumed(BucketState newBucket) {
        return new ClientRateState(newBucket, activePermits, cooldownUntilMillis, totalRequests + 1);
    }

    public ClientRateState withPermit(String permitId) {
        final var permits = new HashSet<>(activePermits);
        permits.add(permitId);
        return new ClientRateState(bucket, permits, cooldownUntilMillis, totalRequests);
    }

    public ClientRateState withoutPermit(String permitId) {
        final var permits = new HashSet<>(activePermits);
        permits.remove(permitId);
        return new ClientRateState(bucket, permits, cooldownUntilMillis, totalRequests);
    }

    public ClientRateState withCooldownUntil(long untilMillis) {
        return new ClientRateState(bucket, activePermits, untilMillis, totalRequests);
    }
}
