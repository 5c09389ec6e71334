package docguard.core.model.memory;

/**
 * Memory accounting for one client.
 *
 * @param currentUsage    bytes held by live allocations
 * @param peakUsage       high-water mark of {@code currentUsage} since the last reset
 * @param allocationCount lifetime number of allocations (not the live count)
 */
public record ClientMemoryStats(long currentUsage, long peakUsage, long allocationCount) {

    public static ClientMemoryStats empty() {
        return new ClientMemoryStats(0, 0, 0);
    }

    public ClientMemoryStats allocated(long size) {
        final var usage = currentUsage + size;
        return new ClientMemoryStats(usage, Math.max(peakUsage, usage), allocationCount + 1);
    }

    public ClientMemoryStats released(long size) {
        return new ClientMemoryStats(Math.max(0, currentUsage - size), peakUsage, allocationCount);
    }
}
