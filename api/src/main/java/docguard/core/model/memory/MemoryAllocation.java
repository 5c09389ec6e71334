package docguard.core.model.memory;

import java.time.Instant;

/**
 * Accounting record for one live allocation. No buffer is reserved.
 *
 * @param token     the capability handed to the caller
 * @param clientId  the owning client
 * @param size      accounted size in bytes
 * @param createdAt when the allocation was committed
 */
public record MemoryAllocation(AllocationToken token, String clientId, long size, Instant createdAt) {}
