package docguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the audit trail.
 *
 * <p>Configuration prefix: {@code docguard.audit}
 *
 * @see docguard.adapter.out.audit.JsonlAuditLogger
 */
@ConfigMapping(prefix = "docguard.audit")
public interface AuditConfig {

    /**
     * Directory holding the active file, archives and the machine id.
     *
     * @return directory path (default: logs/audit)
     */
    @WithDefault("logs/audit")
    String logDir();

    /**
     * Active file size that triggers rotation on the next flush.
     *
     * @return bytes (default: 100 MB)
     */
    @WithDefault("104857600")
    long maxFileSize();

    /**
     * Age after which archived files are deleted.
     *
     * @return days (default: 30)
     */
    @WithDefault("30")
    int retentionDays();

    /**
     * Number of buffered entries that triggers an automatic flush.
     *
     * @return entries (default: 10)
     */
    @WithDefault("10")
    int bufferSize();

    /**
     * Entries held in memory while the audit file cannot be written. Older entries are
     * dropped, and counted in the trail, once the limit is reached.
     *
     * @return entries (default: 10000)
     */
    @WithDefault("10000")
    int maxPendingEntries();

    /**
     * Also emit every entry to the {@code docguard.audit} log category at DEBUG.
     *
     * @return true to echo (default: false)
     */
    @WithDefault("false")
    boolean echoToLog();

    /**
     * How often the retention job runs.
     *
     * @return interval (default: 1 hour)
     */
    @WithDefault("1h")
    Duration cleanupInterval();
}
