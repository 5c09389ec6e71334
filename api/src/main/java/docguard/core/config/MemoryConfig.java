package docguard.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for document memory accounting.
 *
 * <p>Configuration prefix: {@code docguard.memory}
 *
 * <p>Allocations are bookkeeping only. No heap is reserved.
 */
@ConfigMapping(prefix = "docguard.memory")
public interface MemoryConfig {

    /**
     * Largest single document.
     *
     * @return bytes (default: 100 MB)
     */
    @WithDefault("104857600")
    long maxPerDocument();

    /**
     * Ceiling on the sum of all live allocations.
     *
     * @return bytes (default: 500 MB)
     */
    @WithDefault("524288000")
    long maxTotal();

    /**
     * Largest number of documents in one batch allocation.
     *
     * @return count (default: 50)
     */
    @WithDefault("50")
    int maxBatchSize();
}
