package docguard.core.model.memory;

/**
 * Memory accounting across all clients.
 *
 * @param totalUsage       bytes held by all live allocations
 * @param peakUsage        high-water mark of {@code totalUsage}
 * @param activeClients    clients with non-zero current usage
 * @param liveAllocations  allocations not yet released
 * @param totalAllocations lifetime allocation count
 * @param maxTotal         configured aggregate ceiling
 */
public record GlobalMemoryStats(
        long totalUsage, long peakUsage, int activeClients, int liveAllocations, long totalAllocations, long maxTotal) {

    public long available() {
        return Math.max(0, maxTotal - totalUsage);
    }
}
