package docguard.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import docguard.core.model.audit.AuditLevel;
import docguard.core.model.audit.AuditLogEntry;
import docguard.core.model.audit.AuditMetadata;
import docguard.core.model.audit.AuditQuery;
import docguard.core.model.audit.AuditWriteException;
import docguard.core.util.SecureHash;
import docguard.mock.MutableClock;

@DisplayName("JsonlAuditLogger")
class JsonlAuditLoggerTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private JsonlAuditLogger logger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        logger = open(100 * 1024 * 1024, 10);
    }

    @AfterEach
    void tearDown() {
        logger.close();
    }

    private JsonlAuditLogger open(long maxFileSize, int bufferSize) {
        return new JsonlAuditLogger(dir, maxFileSize, 30, bufferSize, false, clock, mapper);
    }

    private List<String> activeLines() throws Exception {
        var active = dir.resolve(JsonlAuditLogger.ACTIVE_FILE);
        return Files.exists(active) ? Files.readAllLines(active, StandardCharsets.UTF_8) : List.of();
    }

    private List<Path> archives() throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith(JsonlAuditLogger.ARCHIVE_PREFIX))
                    .sorted()
                    .toList();
        }
    }

    @Nested
    @DisplayName("Buffering")
    class BufferingTests {

        @Test
        @DisplayName("should hold entries until flush")
        void shouldHoldUntilFlush() throws Exception {
            logger.info("request_validated", "Security validation passed", Map.of("clientId", "c1"));

            assertTrue(activeLines().isEmpty());

            logger.flush();

            var lines = activeLines();
            assertEquals(1, lines.size());
            var json = mapper.readTree(lines.get(0));
            assertEquals("INFO", json.get("level").asText());
            assertEquals("request_validated", json.get("action").asText());
            assertEquals("2024-03-01T10:00:00Z", json.get("timestamp").asText());
            assertEquals(logger.getMachineId(), json.get("machineId").asText());
            assertEquals("c1", json.get("metadata").get("clientId").asText());
            assertFalse(json.has("userId"));
        }

        @Test
        @DisplayName("should flush automatically when the buffer fills up")
        void shouldAutoFlush() throws Exception {
            for (int i = 0; i < 9; i++) {
                logger.info("tick", "Tick " + i, null);
            }
            assertTrue(activeLines().isEmpty());

            logger.info("tick", "Tick 9", null);

            assertEquals(10, activeLines().size());
        }

        @Test
        @DisplayName("should flush on close and then refuse new entries")
        void shouldFlushOnClose() throws Exception {
            logger.warn("pii_detected", "PII found", Map.of("field", "id"));

            logger.close();
            logger.close();

            assertEquals(1, activeLines().size());
            assertThrows(IllegalStateException.class, () -> logger.info("late", "Too late", null));
        }

        @Test
        @DisplayName("should keep entries buffered when a write fails")
        void shouldKeepEntriesOnWriteFailure() throws Exception {
            var active = dir.resolve(JsonlAuditLogger.ACTIVE_FILE);
            Files.createDirectory(active);
            logger.error("security_error", "Boom", null);

            assertThrows(AuditWriteException.class, () -> logger.flush());

            Files.delete(active);
            logger.flush();
            assertEquals(1, activeLines().size());
        }

        @Test
        @DisplayName("should drop the oldest entries beyond the pending limit and record the loss")
        void shouldCapPendingEntries() throws Exception {
            logger.close();
            logger = new JsonlAuditLogger(dir, 100 * 1024 * 1024, 30, 2, 3, false, clock, mapper);
            var active = dir.resolve(JsonlAuditLogger.ACTIVE_FILE);
            Files.createDirectory(active);

            for (int i = 0; i < 5; i++) {
                try {
                    logger.info("tick", "Tick " + i, null);
                } catch (AuditWriteException e) {
                    // auto-flush fails while the file is unavailable
                }
            }

            assertEquals(2, logger.droppedEntries());

            Files.delete(active);
            var entries = logger.query(AuditQuery.all());

            assertEquals(
                    List.of(JsonlAuditLogger.DROPPED_ACTION, "tick", "tick", "tick"),
                    entries.stream().map(AuditLogEntry::action).toList());
            assertEquals(AuditLevel.ERROR, entries.get(0).level());
            assertEquals(2, ((Number) entries.get(0).metadata().toPlain().get("dropped")).intValue());
            assertEquals(
                    List.of("Tick 2", "Tick 3", "Tick 4"),
                    entries.stream().skip(1).map(AuditLogEntry::message).toList());
            assertEquals(0, logger.droppedEntries());
        }

        @Test
        @DisplayName("should require a pending limit of at least the buffer size")
        void shouldRejectSmallPendingLimit() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new JsonlAuditLogger(dir, 1024, 30, 10, 9, false, clock, mapper));
        }

        @Test
        @DisplayName("should keep explicit timestamps")
        void shouldKeepExplicitTimestamp() throws Exception {
            var at = Instant.parse("2023-12-31T23:59:59Z");
            logger.log(AuditLogEntry.builder(AuditLevel.INFO, "import", "Imported").timestamp(at).build());
            logger.flush();

            assertEquals(at.toString(), mapper.readTree(activeLines().get(0)).get("timestamp").asText());
        }
    }

    @Nested
    @DisplayName("Convenience entries")
    class ConvenienceTests {

        @Test
        @DisplayName("should log a digest of accessed documents, never the content")
        void shouldHashDocumentContent() throws Exception {
            var content = "Confidential contract for 123456782";

            logger.logDocumentAccess("user-7", content);
            logger.flush();

            var line = activeLines().get(0);
            assertFalse(line.contains("Confidential"));
            var json = mapper.readTree(line);
            assertEquals(SecureHash.sha256Hex(content), json.get("documentHash").asText());
            assertEquals("user-7", json.get("userId").asText());
        }

        @Test
        @DisplayName("should record authentication attempts")
        void shouldRecordAuthAttempts() {
            logger.logAuthAttempt("user-7", false, "10.0.0.1");

            var entries = logger.query(AuditQuery.forAction("auth_attempt"));

            assertEquals(1, entries.size());
            assertEquals(AuditLevel.SECURITY, entries.get(0).level());
            assertEquals(Boolean.FALSE, entries.get(0).success());
            assertEquals("10.0.0.1", entries.get(0).ipAddress());
            assertEquals("Authentication failed", entries.get(0).message());
        }

        @Test
        @DisplayName("should record rate limit and security violations")
        void shouldRecordViolations() {
            logger.logRateLimitViolation("client-1", "10.0.0.2");
            logger.logSecurityViolation("Path traversal attempt", Map.of("path", "../etc/passwd"));

            var entries = logger.query(AuditQuery.forLevel(AuditLevel.SECURITY));

            assertEquals(2, entries.size());
            assertEquals("client-1", entries.get(0).clientId());
            assertEquals("security_violation", entries.get(1).action());
            assertEquals(
                    "../etc/passwd",
                    entries.get(1).metadata().toPlain().get("path"));
        }

        @Test
        @DisplayName("should replace self-referencing metadata with a marker")
        void shouldReplaceCircularMetadata() {
            var metadata = new HashMap<String, Object>();
            metadata.put("self", metadata);

            logger.info("weird", "Self reference", metadata);
            var entry = logger.query(AuditQuery.forAction("weird")).get(0);

            assertEquals(AuditMetadata.circularReferenceMarker(), entry.metadata());
        }
    }

    @Nested
    @DisplayName("Rotation and retention")
    class RotationTests {

        @Test
        @DisplayName("should archive the active file once it reaches the maximum size")
        void shouldRotate() throws Exception {
            logger.close();
            logger = open(1, 1);

            logger.info("a", "first", null);
            logger.info("b", "second", null);
            logger.info("c", "third", null);

            var archives = archives();
            assertEquals(2, archives.size());
            assertEquals(
                    List.of("audit-2024-03-01T10-00-00.000Z-1.jsonl", "audit-2024-03-01T10-00-00.000Z.jsonl"),
                    archives.stream().map(p -> p.getFileName().toString()).toList());
            assertEquals(1, activeLines().size());
        }

        @Test
        @DisplayName("query should read archives oldest first, then the active file")
        void shouldQueryAcrossArchives() {
            logger.close();
            logger = open(1, 1);

            logger.info("a", "first", null);
            logger.info("b", "second", null);
            logger.info("c", "third", null);

            var messages = logger.query(AuditQuery.all()).stream()
                    .map(AuditLogEntry::message)
                    .toList();

            assertEquals(List.of("first", "second", "third"), messages);
        }

        @Test
        @DisplayName("query should see every written entry while rotation runs concurrently")
        void shouldQueryConsistentlyDuringRotation() throws Exception {
            logger.close();
            logger = open(1, 1);
            var written = new AtomicInteger();
            var writer = new Thread(() -> {
                for (int i = 0; i < 200; i++) {
                    logger.info("tick", String.valueOf(i), null);
                    written.incrementAndGet();
                }
            });
            writer.start();

            while (writer.isAlive()) {
                var before = written.get();
                var messages = logger.query(AuditQuery.forAction("tick")).stream()
                        .map(AuditLogEntry::message)
                        .toList();

                assertTrue(messages.size() >= before, "query lost entries: " + messages.size() + " < " + before);
                for (int i = 0; i < messages.size(); i++) {
                    assertEquals(String.valueOf(i), messages.get(i));
                }
            }
            writer.join();

            assertEquals(200, logger.query(AuditQuery.forAction("tick")).size());
        }

        @Test
        @DisplayName("cleanup should delete only archives older than the retention window")
        void shouldDeleteExpiredArchives() throws Exception {
            var expired = Files.writeString(dir.resolve("audit-2024-01-01T00-00-00.000Z.jsonl"), "{}\n");
            var recent = Files.writeString(dir.resolve("audit-2024-02-20T00-00-00.000Z.jsonl"), "{}\n");
            var active = Files.writeString(dir.resolve(JsonlAuditLogger.ACTIVE_FILE), "{}\n");
            Files.setLastModifiedTime(expired, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
            Files.setLastModifiedTime(recent, FileTime.from(Instant.parse("2024-02-20T00:00:00Z")));
            Files.setLastModifiedTime(active, FileTime.from(Instant.parse("2023-01-01T00:00:00Z")));

            var deleted = logger.cleanup();

            assertEquals(1, deleted);
            assertFalse(Files.exists(expired));
            assertTrue(Files.exists(recent));
            assertTrue(Files.exists(active));

            clock.advance(Duration.ofDays(60));
            assertEquals(1, logger.cleanup());
        }
    }

    @Nested
    @DisplayName("Query")
    class QueryTests {

        @Test
        @DisplayName("should ignore files that only look like archives")
        void shouldIgnoreForeignArchiveNames() throws Exception {
            var foreign = List.of(
                    "audit-2024-03-01T10-00-00.000Z-99999999999999999999.jsonl",
                    "audit-backup.jsonl",
                    "audit-2024-03-01.jsonl");
            for (var name : foreign) {
                Files.writeString(
                        dir.resolve(name),
                        "{\"level\":\"INFO\",\"action\":\"foreign\",\"message\":\"m\",\"timestamp\":\"2024-03-01T09:00:00Z\"}\n");
                Files.setLastModifiedTime(dir.resolve(name), FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
            }
            logger.info("real", "Real entry", null);

            var entries = logger.query(AuditQuery.all());

            assertEquals(List.of("real"), entries.stream().map(AuditLogEntry::action).toList());
            assertEquals(0, logger.cleanup());
            for (var name : foreign) {
                assertTrue(Files.exists(dir.resolve(name)), name);
            }
        }

        @Test
        @DisplayName("should filter by action, level and time range")
        void shouldFilter() {
            logger.info("request_validated", "ok", null);
            clock.advance(Duration.ofMinutes(5));
            logger.warn("validation_failed", "bad input", null);
            clock.advance(Duration.ofMinutes(5));
            logger.info("request_validated", "ok again", null);

            assertEquals(2, logger.query(AuditQuery.forAction("request_validated")).size());
            assertEquals(1, logger.query(AuditQuery.forLevel(AuditLevel.WARN)).size());
            var window = AuditQuery.all()
                    .between(Instant.parse("2024-03-01T10:04:00Z"), Instant.parse("2024-03-01T10:11:00Z"));
            assertEquals(
                    List.of("bad input", "ok again"),
                    logger.query(window).stream().map(AuditLogEntry::message).toList());
        }

        @Test
        @DisplayName("should skip malformed lines")
        void shouldSkipMalformedLines() throws Exception {
            Files.writeString(
                    dir.resolve(JsonlAuditLogger.ACTIVE_FILE),
                    "not json\n{\"level\":\"INFO\"}\n{\"level\":\"NOPE\",\"action\":\"a\",\"message\":\"m\"}\n");
            logger.info("real", "Real entry", null);

            var entries = logger.query(AuditQuery.all());

            assertEquals(1, entries.size());
            assertEquals("real", entries.get(0).action());
        }
    }

    @Nested
    @DisplayName("Machine id")
    class MachineIdTests {

        @Test
        @DisplayName("should persist the machine id across instances")
        void shouldPersistMachineId() {
            var first = logger.getMachineId();
            logger.close();

            logger = open(1024, 10);

            assertNotNull(first);
            assertEquals(first, logger.getMachineId());
            assertTrue(Files.exists(dir.resolve(MachineIdentity.FILE_NAME)));
        }

        @Test
        @DisplayName("should reject invalid settings")
        void shouldRejectInvalidSettings() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new JsonlAuditLogger(dir, 0, 30, 10, false, clock, mapper));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new JsonlAuditLogger(dir, 1024, 0, 10, false, clock, mapper));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new JsonlAuditLogger(dir, 1024, 30, 0, false, clock, mapper));
        }
    }
}
