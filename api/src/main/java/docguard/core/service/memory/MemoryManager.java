package docguard.core.service.memory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import docguard.core.config.MemoryConfig;
import docguard.core.model.memory.AllocationToken;
import docguard.core.model.memory.ClientMemoryStats;
import docguard.core.model.memory.GlobalMemoryStats;
import docguard.core.model.memory.MemoryAllocation;
import docguard.core.model.security.ErrorCode;
import docguard.core.model.security.MemoryLimitException;

/**
 * Accounts for document memory against per-document, aggregate and batch ceilings.
 *
 * <p>Allocations are pure bookkeeping: no buffer is reserved and the JVM heap is never
 * inspected. The caller holds an {@link AllocationToken} and must present it to
 * {@link #release(AllocationToken)}. Nothing reclaims a token its holder abandons.
 *
 * <p>All state sits behind one lock, so per-client and global counters always agree.
 */
@ApplicationScoped
public class MemoryManager {

    private static final Logger LOG = Logger.getLogger(MemoryManager.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final long maxPerDocument;
    private final long maxTotal;
    private final int maxBatchSize;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<AllocationToken, MemoryAllocation> allocations = new HashMap<>();
    private final Map<String, ClientMemoryStats> clients = new HashMap<>();
    private long totalUsage;
    private long peakTotalUsage;
    private long totalAllocationCount;

    @Inject
    public MemoryManager(MemoryConfig config, Clock clock) {
        this(config.maxPerDocument(), config.maxTotal(), config.maxBatchSize(), clock);
    }

    /**
     * Creates a manager with explicit limits.
     *
     * @param maxPerDocument largest single allocation in bytes
     * @param maxTotal       ceiling on all live allocations in bytes
     * @param maxBatchSize   largest batch count
     * @param clock          time source for allocation timestamps
     * @throws IllegalArgumentException if any limit is not positive
     */
    public MemoryManager(long maxPerDocument, long maxTotal, int maxBatchSize, Clock clock) {
        if (maxPerDocument <= 0) {
            throw new IllegalArgumentException("maxPerDocument must be greater than 0");
        }
        if (maxTotal <= 0) {
            throw new IllegalArgumentException("maxTotal must be greater than 0");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be greater than 0");
        }
        this.maxPerDocument = maxPerDocument;
        this.maxTotal = maxTotal;
        this.maxBatchSize = maxBatchSize;
        this.clock = clock;
    }

    /**
     * Commit one allocation.
     *
     * @param clientId the owning client
     * @param size     bytes to account for
     * @return the capability to release it
     * @throws MemoryLimitException with {@code PER_DOCUMENT_LIMIT_EXCEEDED} or {@code TOTAL_LIMIT_EXCEEDED};
     *                              nothing is committed
     */
    public AllocationToken allocate(String clientId, long size) {
        requireNonNegative(size);
        lock.lock();
        try {
            checkPerDocument(size);
            if (size > maxTotal - totalUsage) {
                throw new MemoryLimitException(
                        String.format(
                                "Insufficient memory: requested %dMB, only %dMB available",
                                toMb(size), toMb(maxTotal - totalUsage)),
                        ErrorCode.TOTAL_LIMIT_EXCEEDED);
            }
            return commit(clientId, size);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commit {@code count} allocations of {@code sizeEach} bytes as one reservation.
     *
     * <p>Either every member is committed or none is.
     *
     * @param clientId the owning client
     * @param count    number of documents
     * @param sizeEach bytes per document
     * @return one token per document
     * @throws MemoryLimitException with {@code BATCH_SIZE_EXCEEDED}, {@code PER_DOCUMENT_LIMIT_EXCEEDED}
     *                              or {@code TOTAL_LIMIT_EXCEEDED}
     */
    public List<AllocationToken> allocateBatch(String clientId, int count, long sizeEach) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        requireNonNegative(sizeEach);
        if (count > maxBatchSize) {
            throw new MemoryLimitException(
                    String.format("Batch size %d exceeds maximum of %d", count, maxBatchSize),
                    ErrorCode.BATCH_SIZE_EXCEEDED);
        }
        lock.lock();
        try {
            checkPerDocument(sizeEach);
            final long batchSize;
            try {
                batchSize = Math.multiplyExact(count, sizeEach);
            } catch (ArithmeticException e) {
                throw new MemoryLimitException(
                        String.format("Batch of %d x %d bytes exceeds the addressable size", count, sizeEach),
                        ErrorCode.TOTAL_LIMIT_EXCEEDED);
            }
            if (batchSize > maxTotal - totalUsage) {
                throw new MemoryLimitException(
                        String.format(
                                "Insufficient memory for batch: requested %dMB, only %dMB available",
                                toMb(batchSize), toMb(maxTotal - totalUsage)),
                        ErrorCode.TOTAL_LIMIT_EXCEEDED);
            }
            final var tokens = new ArrayList<AllocationToken>(count);
            for (int i = 0; i < count; i++) {
                tokens.add(commit(clientId, sizeEach));
            }
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release an allocation. Unknown and already released tokens are ignored.
     *
     * @param token the token (may be null)
     */
    public void release(AllocationToken token) {
        if (token == null) {
            return;
        }
        lock.lock();
        try {
            releaseLocked(token);
        } finally {
            lock.unlock();
        }
    }

    public void releaseBatch(Collection<AllocationToken> tokens) {
        lock.lock();
        try {
            for (final var token : tokens) {
                if (token != null) {
                    releaseLocked(token);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accounting for one client. A client never seen reports zeros.
     *
     * @param clientId the client
     * @return the statistics
     */
    public ClientMemoryStats getClientStats(String clientId) {
        lock.lock();
        try {
            return clients.getOrDefault(clientId, ClientMemoryStats.empty());
        } finally {
            lock.unlock();
        }
    }

    public GlobalMemoryStats getGlobalStats() {
        lock.lock();
        try {
            final var activeClients = (int) clients.values().stream()
                    .filter(s -> s.currentUsage() > 0)
                    .count();
            return new GlobalMemoryStats(
                    totalUsage, peakTotalUsage, activeClients, allocations.size(), totalAllocationCount, maxTotal);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release every allocation of one client and forget its statistics.
     *
     * @param clientId the client
     */
    public void resetClient(String clientId) {
        lock.lock();
        try {
            final var owned = allocations.values().stream()
                    .filter(a -> a.clientId().equals(clientId))
                    .map(MemoryAllocation::token)
                    .toList();
            owned.forEach(this::releaseLocked);
            clients.remove(clientId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget all allocations and statistics. Outstanding tokens become unknown.
     */
    public void resetAll() {
        lock.lock();
        try {
            allocations.clear();
            clients.clear();
            totalUsage = 0;
            peakTotalUsage = 0;
            totalAllocationCount = 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every live allocation, keeping peak and lifetime counters.
     *
     * <p>Recovery switch for operators; outstanding tokens become unknown.
     */
    public void forceGC() {
        lock.lock();
        try {
            final var dropped = allocations.size();
            allocations.clear();
            clients.replaceAll((id, stats) -> stats.released(stats.currentUsage()));
            totalUsage = 0;
            LOG.warnv("Forced release of {0} live memory allocations", dropped);
        } finally {
            lock.unlock();
        }
    }

    public long maxPerDocument() {
        return maxPerDocument;
    }

    public long maxTotal() {
        return maxTotal;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    private void checkPerDocument(long size) {
        if (size > maxPerDocument) {
            throw new MemoryLimitException(
                    String.format(
                            "Document size %dMB exceeds per-document limit of %dMB", toMb(size), toMb(maxPerDocument)),
                    ErrorCode.PER_DOCUMENT_LIMIT_EXCEEDED);
        }
    }

    private AllocationToken commit(String clientId, long size) {
        final var token = new AllocationToken(UUID.randomUUID().toString());
        allocations.put(token, new MemoryAllocation(token, clientId, size, clock.instant()));
        totalUsage += size;
        peakTotalUsage = Math.max(peakTotalUsage, totalUsage);
        totalAllocationCount++;
        clients.merge(clientId, ClientMemoryStats.empty().allocated(size), (old, ignored) -> old.allocated(size));
        return token;
    }

    private void releaseLocked(AllocationToken token) {
        final var allocation = allocations.remove(token);
        if (allocation == null) {
            return;
        }
        totalUsage -= allocation.size();
        clients.computeIfPresent(allocation.clientId(), (id, stats) -> stats.released(allocation.size()));
    }

    private static void requireNonNegative(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative");
        }
    }

    private static long toMb(long bytes) {
        return Math.round(bytes / BYTES_PER_MB);
    }
}
