package docguard.core.model.ratelimit;

import java.util.Objects;

/**
 * Opaque handle for one in-flight request slot.
 *
 * <p>Returned by {@code RateLimiter.acquire} and presented back to release the slot.
 *
 * @param id       unique permit id
 * @param clientId the client holding the slot
 */
public record ConcurrencyPermit(String id, String clientId) {

    public ConcurrencyPermit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(clientId, "clientId");
    }
}
