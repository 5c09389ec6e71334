package docguard.core.port.out;

import java.util.List;
import java.util.Map;

import docguard.core.model.audit.AuditLevel;
import docguard.core.model.audit.AuditLogEntry;
import docguard.core.model.audit.AuditQuery;

/**
 * Port interface for the append-only audit trail.
 *
 * <p>Entries are buffered and become durable on {@link #flush()}, on {@link #close()}, or
 * when the buffer fills up. Logging a metadata tree that cannot be serialized never fails:
 * the tree is replaced with an error marker.
 */
public interface AuditLogger extends AutoCloseable {

    /**
     * Append an entry, stamping time and machine id if absent.
     *
     * @param entry the entry
     * @throws IllegalStateException once the logger is closed
     */
    void log(AuditLogEntry entry);

    default void info(String action, String message, Map<String, ?> metadata) {
        log(AuditLogEntry.of(AuditLevel.INFO, action, message, metadata));
    }

    default void warn(String action, String message, Map<String, ?> metadata) {
        log(AuditLogEntry.of(AuditLevel.WARN, action, message, metadata));
    }

    default void error(String action, String message, Map<String, ?> metadata) {
        log(AuditLogEntry.of(AuditLevel.ERROR, action, message, metadata));
    }

    default void security(String action, String message, Map<String, ?> metadata) {
        log(AuditLogEntry.of(AuditLevel.SECURITY, action, message, metadata));
    }

    /**
     * Record that a user accessed a document. Only a digest of the content is written.
     *
     * @param userId  the user
     * @param content the document content
     */
    void logDocumentAccess(String userId, String content);

    void logAuthAttempt(String userId, boolean success, String ipAddress);

    void logRateLimitViolation(String clientId, String ipAddress);

    void logSecurityViolation(String message, Map<String, ?> metadata);

    /**
     * Write buffered entries, rotating the active file first when it has grown too large.
     *
     * @throws docguard.core.model.audit.AuditWriteException if the entries could not be written;
     *         they stay buffered for the next attempt
     */
    void flush();

    /**
     * Delete archived files older than the retention window. The active file is never touched.
     *
     * @return number of files deleted
     */
    int cleanup();

    /**
     * Read matching entries from the active file and all archives. Malformed lines are skipped.
     *
     * @param query the filter
     * @return matching entries in file order
     */
    List<AuditLogEntry> query(AuditQuery query);

    /**
     * Anonymous identifier of this installation, stable across restarts.
     *
     * @return machine id
     */
    String getMachineId();

    /**
     * Flush and stop accepting entries. Calling it again has no effect.
     */
    @Override
    void close();
}
