package docguard.adapter.out.audit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import docguard.core.model.audit.AuditLevel;
import docguard.core.model.audit.AuditLogEntry;
import docguard.core.model.audit.AuditQuery;
import docguard.core.model.audit.AuditWriteException;
import docguard.core.port.out.AuditLogger;
import docguard.core.util.SecureHash;

/**
 * Audit logger writing newline-delimited JSON to a single active file.
 *
 * <p>Files in the log directory:
 * <ul>
 *   <li>{@code audit.jsonl}: the active file</li>
 *   <li>{@code audit-<timestamp>.jsonl}: archives created by rotation</li>
 *   <li>{@code .machine-id}: the anonymous installation id</li>
 * </ul>
 *
 * <p>Entries are buffered in memory and appended on flush. Before appending, a flush
 * archives the active file once it has reached the maximum size. Writers and readers are
 * serialized by one lock; only this instance may write to the directory.
 *
 * <p>While writes fail the buffer holds at most {@code maxPendingEntries}; beyond that the
 * oldest entries are dropped and counted. The next successful flush writes an
 * {@code audit_entries_dropped} entry carrying the count ahead of the buffered ones.
 */
public final class JsonlAuditLogger implements AuditLogger {

    private static final Logger LOG = Logger.getLogger(JsonlAuditLogger.class);
    private static final Logger ECHO = Logger.getLogger("docguard.audit");

    static final String ACTIVE_FILE = "audit.jsonl";
    static final String ARCHIVE_PREFIX = "audit-";
    static final String EXTENSION = ".jsonl";

    // ISO-8601 in UTC, fixed millisecond precision, ':' replaced by '-'
    private static final DateTimeFormatter ARCHIVE_STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final Pattern ARCHIVE_NAME = Pattern.compile(
            "^audit-(\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}\\.\\d{3}Z)(?:-(\\d{1,9}))?\\.jsonl$");

    static final int DEFAULT_MAX_PENDING_ENTRIES = 10_000;
    static final String DROPPED_ACTION = "audit_entries_dropped";

    private final Path logDir;
    private final Path activeFile;
    private final long maxFileSize;
    private final Duration retention;
    private final int bufferSize;
    private final int maxPendingEntries;
    private final boolean echoToLog;
    private final Clock clock;
    private final AuditEntryCodec codec;
    private final MachineIdentity machineIdentity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<AuditLogEntry> buffer = new ArrayDeque<>();
    private long droppedEntries;
    private boolean closed;

    public JsonlAuditLogger(
            Path logDir,
            long maxFileSize,
            int retentionDays,
            int bufferSize,
            boolean echoToLog,
            Clock clock,
            ObjectMapper mapper) {
        this(logDir, maxFileSize, retentionDays, bufferSize, DEFAULT_MAX_PENDING_ENTRIES, echoToLog, clock, mapper);
    }

    /**
     * Opens the logger, creating the directory and machine id when missing.
     *
     * @param logDir        the log directory
     * @param maxFileSize   active file size that triggers rotation
     * @param retentionDays age after which archives are deleted
     * @param bufferSize    buffered entries that trigger a flush
     * @param maxPendingEntries entries kept while writes fail; at least {@code bufferSize}
     * @param echoToLog     also emit entries on the {@code docguard.audit} category
     * @param clock         time source for timestamps, rotation names and retention
     * @param mapper        JSON mapper
     * @throws IllegalArgumentException for non-positive sizes or retention, or a pending
     *                                  limit below the buffer size
     * @throws UncheckedIOException if the directory cannot be created
     */
    public JsonlAuditLogger(
            Path logDir,
            long maxFileSize,
            int retentionDays,
            int bufferSize,
            int maxPendingEntries,
            boolean echoToLog,
            Clock clock,
            ObjectMapper mapper) {
        if (maxFileSize <= 0) {
            throw new IllegalArgumentException("maxFileSize must be greater than 0");
        }
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be greater than 0");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be greater than 0");
        }
        if (maxPendingEntries < bufferSize) {
            throw new IllegalArgumentException("maxPendingEntries must be at least bufferSize");
        }
        this.logDir = logDir;
        this.activeFile = logDir.resolve(ACTIVE_FILE);
        this.maxFileSize = maxFileSize;
        this.retention = Duration.ofDays(retentionDays);
        this.bufferSize = bufferSize;
        this.maxPendingEntries = maxPendingEntries;
        this.echoToLog = echoToLog;
        this.clock = clock;
        this.codec = new AuditEntryCodec(mapper);
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create audit log directory", e);
        }
        this.machineIdentity = MachineIdentity.loadOrCreate(logDir);
    }

    @Override
    public void log(AuditLogEntry entry) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Audit logger is closed");
            }
            final var stamped = entry.stamp(clock.instant(), machineIdentity.id());
            buffer.addLast(stamped);
            if (buffer.size() > maxPendingEntries) {
                buffer.removeFirst();
                if (droppedEntries++ == 0) {
                    LOG.errorv("Audit buffer full ({0} entries), dropping oldest entries until a write succeeds",
                            maxPendingEntries);
                }
            }
            if (echoToLog && ECHO.isDebugEnabled()) {
                ECHO.debug(codec.encode(stamped));
            }
            if (buffer.size() >= bufferSize) {
                flushLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void logDocumentAccess(String userId, String content) {
        log(AuditLogEntry.builder(AuditLevel.INFO, "document_access", "Document accessed")
                .userId(userId)
                .documentHash(SecureHash.sha256Hex(content))
                .build());
    }

    @Override
    public void logAuthAttempt(String userId, boolean success, String ipAddress) {
        log(AuditLogEntry.builder(
                        AuditLevel.SECURITY,
                        "auth_attempt",
                        success ? "Authentication succeeded" : "Authentication failed")
                .userId(userId)
                .success(success)
                .ipAddress(ipAddress)
                .build());
    }

    @Override
    public void logRateLimitViolation(String clientId, String ipAddress) {
        log(AuditLogEntry.builder(AuditLevel.SECURITY, "rate_limit_violation", "Rate limit exceeded")
                .clientId(clientId)
                .ipAddress(ipAddress)
                .build());
    }

    @Override
    public void logSecurityViolation(String message, Map<String, ?> metadata) {
        log(AuditLogEntry.of(AuditLevel.SECURITY, "security_violation", message, metadata));
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            flushLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanup() {
        final var cutoff = clock.instant().minus(retention);
        var deleted = 0;
        lock.lock();
        try {
            for (final var archive : listArchives()) {
                try {
                    if (Files.getLastModifiedTime(archive).toInstant().isBefore(cutoff)) {
                        Files.deleteIfExists(archive);
                        deleted++;
                    }
                } catch (IOException e) {
                    LOG.warnv(e, "Failed to delete expired audit archive {0}", archive.getFileName());
                }
            }
        } finally {
            lock.unlock();
        }
        if (deleted > 0) {
            LOG.infov("Deleted {0} expired audit archive(s)", deleted);
        }
        return deleted;
    }

    @Override
    public List<AuditLogEntry> query(AuditQuery query) {
        // Held across the read so a rotation cannot move the active file away mid-query
        lock.lock();
        try {
            flushLocked();
            final var results = new ArrayList<AuditLogEntry>();
            final var files = new ArrayList<>(listArchives());
            if (Files.exists(activeFile)) {
                files.add(activeFile);
            }
            for (final var file : files) {
                try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
                    lines.filter(line -> !line.isBlank())
                            .map(line -> codec.decode(line).orElse(null))
                            .filter(entry -> entry != null && query.matches(entry))
                            .forEach(results::add);
                } catch (IOException | UncheckedIOException e) {
                    LOG.warnv(e, "Skipping unreadable audit file {0}", file.getFileName());
                }
            }
            return results;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getMachineId() {
        return machineIdentity.id();
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            flushLocked();
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public Path logDir() {
        return logDir;
    }

    /**
     * Entries dropped because the buffer was full and not yet reported in the file.
     *
     * @return dropped entry count
     */
    public long droppedEntries() {
        lock.lock();
        try {
            return droppedEntries;
        } finally {
            lock.unlock();
        }
    }

    private void flushLocked() {
        if (buffer.isEmpty() && droppedEntries == 0) {
            return;
        }
        var pending = buffer.stream();
        if (droppedEntries > 0) {
            final var notice = AuditLogEntry.of(
                            AuditLevel.ERROR,
                            DROPPED_ACTION,
                            "Audit entries dropped while the trail was unavailable",
                            Map.of("dropped", droppedEntries))
                    .stamp(clock.instant(), machineIdentity.id());
            pending = Stream.concat(Stream.of(notice), pending);
        }
        final var jsonl = pending
                .map(codec::encode)
                .collect(Collectors.joining("\n", "", "\n"));
        try {
            rotateIfNeeded();
            Files.writeString(
                    activeFile,
                    jsonl,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new AuditWriteException("Failed to write " + buffer.size() + " audit entries", e);
        }
        buffer.clear();
        droppedEntries = 0;
    }

    private void rotateIfNeeded() throws IOException {
        if (!Files.exists(activeFile) || Files.size(activeFile) < maxFileSize) {
            return;
        }
        final var stamp = ARCHIVE_STAMP.format(clock.instant());
        var archive = logDir.resolve(ARCHIVE_PREFIX + stamp + EXTENSION);
        for (int suffix = 1; Files.exists(archive); suffix++) {
            archive = logDir.resolve(ARCHIVE_PREFIX + stamp + "-" + suffix + EXTENSION);
        }
        Files.move(activeFile, archive);
        LOG.infov("Rotated audit log to {0}", archive.getFileName());
    }

    private List<Path> listArchives() {
        try (Stream<Path> files = Files.list(logDir)) {
            return files.filter(p -> ARCHIVE_NAME.matcher(p.getFileName().toString()).matches()
                            && Files.isRegularFile(p))
                    .sorted(Comparator.comparing(JsonlAuditLogger::archiveStamp)
                            .thenComparingInt(JsonlAuditLogger::collisionIndex))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list audit directory", e);
        }
    }

    private static String archiveStamp(Path archive) {
        final var matcher = ARCHIVE_NAME.matcher(archive.getFileName().toString());
        return matcher.matches() ? matcher.group(1) : "";
    }

    private static int collisionIndex(Path archive) {
        final var matcher = ARCHIVE_NAME.matcher(archive.getFileName().toString());
        return matcher.matches() && matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
    }
}
