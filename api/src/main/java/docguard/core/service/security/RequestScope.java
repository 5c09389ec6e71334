package docguard.core.service.security;

import docguard.core.model.memory.AllocationToken;
import docguard.core.model.ratelimit.ConcurrencyPermit;
import docguard.core.port.out.RateLimiter;
import docguard.core.service.memory.MemoryManager;

/**
 * Resources committed for one request while it moves through the pipeline.
 *
 * <p>Closing the scope releases the concurrency permit and, unless it was handed over
 * to the caller, the memory allocation. Used with try-with-resources so release runs on
 * every exit path. Not thread-safe; one scope belongs to one request.
 */
final class RequestScope implements AutoCloseable {

    private final RateLimiter rateLimiter;
    private final MemoryManager memoryManager;
    private ConcurrencyPermit permit;
    private AllocationToken allocation;
    private boolean handedOver;

    RequestScope(RateLimiter rateLimiter, MemoryManager memoryManager) {
        this.rateLimiter = rateLimiter;
        this.memoryManager = memoryManager;
    }

    void hold(ConcurrencyPermit permit) {
        this.permit = permit;
    }

    void hold(AllocationToken allocation) {
        this.allocation = allocation;
    }

    AllocationToken allocation() {
        return allocation;
    }

    /**
     * Transfer the memory allocation to the caller; closing the scope no longer releases it.
     *
     * @return the allocation, or null if none was made
     */
    AllocationToken handOver() {
        handedOver = true;
        return allocation;
    }

    @Override
    public void close() {
        try {
            if (!handedOver && allocation != null) {
                memoryManager.release(allocation);
            }
        } finally {
            rateLimiter.release(permit);
        }
    }
}
