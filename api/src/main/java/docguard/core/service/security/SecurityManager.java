package docguard.core.service.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import docguard.core.config.SecurityConfig;
import docguard.core.model.audit.AuditLevel;
import docguard.core.model.audit.AuditLogEntry;
import docguard.core.model.audit.AuditQuery;
import docguard.core.model.memory.AllocationToken;
import docguard.core.model.security.ErrorCode;
import docguard.core.model.security.HebrewSecurityException;
import docguard.core.model.security.MemoryLimitException;
import docguard.core.model.security.PathSecurityException;
import docguard.core.model.security.RateLimitException;
import docguard.core.model.security.SecurityError;
import docguard.core.model.security.SecurityLayer;
import docguard.core.model.security.SecurityLayerException;
import docguard.core.model.security.SecurityRequest;
import docguard.core.model.security.SecurityResult;
import docguard.core.model.security.SecurityStats;
import docguard.core.model.security.TemplateIntegrityException;
import docguard.core.model.security.ValidationException;
import docguard.core.model.template.TemplateLocation;
import docguard.core.port.in.RequestValidationUseCase;
import docguard.core.port.out.AuditLogger;
import docguard.core.port.out.PathSanitizer;
import docguard.core.port.out.PiiHandler;
import docguard.core.port.out.RateLimiter;
import docguard.core.port.out.TemplateVerifier;
import docguard.core.service.memory.MemoryManager;
import docguard.core.service.text.HebrewSanitizer;
import docguard.core.service.validation.InputValidator;
import docguard.core.util.UnicodeControls;

/**
 * Runs document generation requests through the security layers in a fixed order.
 *
 * <p>Stages:
 * <ol>
 *   <li>rate limit: one token and one concurrency permit</li>
 *   <li>template path resolution</li>
 *   <li>memory allocation of the declared request size</li>
 *   <li>schema validation, when the request carries a schema</li>
 *   <li>Unicode sanitization of every string value</li>
 *   <li>template checksum verification, when a checksum is known</li>
 *   <li>PII redaction</li>
 * </ol>
 *
 * <p>The first failing stage ends the request. Every decision is audited and the audit
 * trail is flushed before the result is emitted. The concurrency permit is released when
 * the pipeline ends; the memory allocation is released on rejection and handed to the
 * caller on success.
 */
@ApplicationScoped
public class SecurityManager implements RequestValidationUseCase {

    public static final String PIPELINE_EXECUTOR = "security-pipeline";

    private static final Logger LOG = Logger.getLogger(SecurityManager.class);
    private static final Logger SECURITY = Logger.getLogger("docguard.security");

    private final RateLimiter rateLimiter;
    private final PathSanitizer pathSanitizer;
    private final MemoryManager memoryManager;
    private final InputValidator inputValidator;
    private final HebrewSanitizer hebrewSanitizer;
    private final TemplateVerifier templateVerifier;
    private final PiiHandler piiHandler;
    private final AuditLogger auditLogger;
    private final SecurityConfig config;
    private final Executor executor;

    @Inject
    public SecurityManager(
            RateLimiter rateLimiter,
            PathSanitizer pathSanitizer,
            MemoryManager memoryManager,
            InputValidator inputValidator,
            HebrewSanitizer hebrewSanitizer,
            TemplateVerifier templateVerifier,
            PiiHandler piiHandler,
            AuditLogger auditLogger,
            SecurityConfig config,
            @Named(PIPELINE_EXECUTOR) Executor executor) {
        this.rateLimiter = rateLimiter;
        this.pathSanitizer = pathSanitizer;
        this.memoryManager = memoryManager;
        this.inputValidator = inputValidator;
        this.hebrewSanitizer = hebrewSanitizer;
        this.templateVerifier = templateVerifier;
        this.piiHandler = piiHandler;
        this.auditLogger = auditLogger;
        this.config = config;
        this.executor = executor;
    }

    @Override
    public Uni<SecurityResult> validateRequest(SecurityRequest request) {
        return Uni.createFrom().item(() -> evaluate(request)).runSubscriptionOn(executor);
    }

    /**
     * Run the pipeline on the calling thread. Blocks on audit file I/O.
     *
     * @param request the request
     * @return the decision; never throws
     */
    public SecurityResult evaluate(SecurityRequest request) {
        final var requestId = request.requestId() != null ? request.requestId() : "req-" + UUID.randomUUID();
        try (var scope = new RequestScope(rateLimiter, memoryManager)) {
            SecurityResult result;
            try {
                result = runPipeline(request, requestId, scope);
            } catch (SecurityLayerException e) {
                result = reject(request, requestId, e);
            } catch (RuntimeException e) {
                LOG.errorv(e, "Unexpected error validating request {0}", requestId);
                auditLogger.error(
                        "security_error",
                        "Unexpected security error",
                        Map.of("requestId", requestId, "error", e.getClass().getSimpleName()));
                result = internalError();
            }
            if (!flushAudit(request, requestId)) {
                return internalError();
            }
            if (result.allowed()) {
                return SecurityResult.allowed(result.sanitizedData(), scope.handOver());
            }
            return result;
        } catch (RuntimeException e) {
            LOG.errorv(e, "Failed to finish request {0}, denying it", requestId);
            return internalError();
        }
    }

    // Entries already buffered for the request reach the file later; the denial entry follows them
    private boolean flushAudit(SecurityRequest request, String requestId) {
        try {
            auditLogger.flush();
            return true;
        } catch (RuntimeException e) {
            LOG.errorv(e, "Audit trail unavailable, denying request {0}", requestId);
            final var metadata = new LinkedHashMap<String, Object>();
            metadata.put("requestId", requestId);
            metadata.put("clientId", request.clientId());
            metadata.put("error", e.getClass().getSimpleName());
            try {
                auditLogger.error("security_error", "Request denied: audit trail unavailable", metadata);
            } catch (RuntimeException logFailure) {
                LOG.errorv(logFailure, "Could not record audit failure for request {0}", requestId);
            }
            return false;
        }
    }

    @Override
    public void releaseAllocation(AllocationToken token) {
        memoryManager.release(token);
    }

    @Override
    public SecurityStats getStats() {
        return new SecurityStats(rateLimiter.getGlobalStats(), memoryManager.getGlobalStats());
    }

    /**
     * Search the audit trail.
     *
     * @param query the filter
     * @return matching entries
     */
    public List<AuditLogEntry> queryAuditLog(AuditQuery query) {
        return auditLogger.query(query);
    }

    private SecurityResult runPipeline(SecurityRequest request, String requestId, RequestScope scope) {
        final var clientId = request.clientId();

        scope.hold(rateLimiter.acquire(clientId));
        final var template = pathSanitizer.sanitize(request.templatePath());
        scope.hold(memoryManager.allocate(clientId, request.requestSize()));

        Map<String, Object> data = request.schemaOpt()
                .map(schema -> inputValidator.validate(request.fieldData(), schema))
                .orElseGet(() -> new LinkedHashMap<>(request.fieldData()));

        data = sanitizeText(data, clientId);
        verifyTemplate(request, template);
        data = redactPii(data);

        final var metadata = new LinkedHashMap<String, Object>();
        metadata.put("clientId", clientId);
        metadata.put("requestId", requestId);
        metadata.put("templatePath", request.templatePath());
        auditLogger.info("request_validated", "Security validation passed", metadata);
        return SecurityResult.allowed(data, scope.allocation());
    }

    private Map<String, Object> sanitizeText(Map<String, Object> data, String clientId) {
        return walkMap("", data, (path, value) -> {
            final String sanitized;
            try {
                sanitized = hebrewSanitizer.sanitize(value);
            } catch (HebrewSecurityException e) {
                final var metadata = new LinkedHashMap<String, Object>();
                metadata.put("field", path);
                metadata.put("clientId", clientId);
                metadata.put("scripts", e.detectedScripts().stream().map(Enum::name).toList());
                auditLogger.logSecurityViolation("Homograph attack detected", metadata);
                throw e;
            }
            if (!sanitized.equals(value)) {
                if (UnicodeControls.containsBiDi(value)) {
                    auditLogger.logSecurityViolation("BiDi override attack detected", changeMetadata(path, value, sanitized));
                } else if (UnicodeControls.containsZeroWidth(value)) {
                    auditLogger.logSecurityViolation("Zero-width characters removed", changeMetadata(path, value, sanitized));
                }
            }
            return sanitized;
        });
    }

    /**
     * A manifest entry for the template is always checked. A checksum sent by the caller is
     * checked in addition and can never replace the manifest entry.
     */
    private void verifyTemplate(SecurityRequest request, TemplateLocation template) {
        final var file = template.file().toString();
        final var trusted = templateVerifier.trustedChecksum(template.relativePath());
        final var supplied = request.expectedChecksumOpt();
        if (trusted.isEmpty() && supplied.isEmpty()) {
            LOG.debugv("No checksum known for template {0}, skipping verification", template.relativePath());
            return;
        }
        if (trusted.isPresent() && !templateVerifier.verify(file, trusted.get())) {
            throw new TemplateIntegrityException("Template integrity check failed");
        }
        if (supplied.isPresent() && !templateVerifier.verify(file, supplied.get())) {
            throw new TemplateIntegrityException("Template integrity check failed");
        }
    }

    private Map<String, Object> redactPii(Map<String, Object> data) {
        return walkMap("", data, (path, value) -> {
            final var detection = piiHandler.detectPii(value);
            if (!detection.detected()) {
                return value;
            }
            final var metadata = new LinkedHashMap<String, Object>();
            metadata.put("field", path);
            metadata.put("types", detection.types().stream().map(Enum::name).toList());
            auditLogger.warn("pii_detected", "PII found in field data", metadata);
            return piiHandler.sanitize(value);
        });
    }

    private SecurityResult reject(SecurityRequest request, String requestId, SecurityLayerException e) {
        final var clientId = request.clientId();
        SECURITY.infov(
                "Rejected request {0} from client {1} at {2}: {3}",
                requestId, clientId, e.layer().displayName(), e.code());

        if (e instanceof RateLimitException rle) {
            auditLogger.log(AuditLogEntry.builder(AuditLevel.SECURITY, "rate_limit_violation", "Rate limit exceeded")
                    .clientId(clientId)
                    .metadata(Map.of("requestId", requestId, "code", e.code().name()))
                    .build());
            final var message = e.code() == ErrorCode.RATE_LIMIT_EXCEEDED
                    ? "Rate limit exceeded. Retry after " + rle.retryAfterSeconds() + "s"
                    : e.getMessage();
            return SecurityResult.rejected(
                    "Rate limit exceeded",
                    new SecurityError(e.layer().displayName(), e.code(), message, rle.retryAfterSeconds()));
        }
        if (e instanceof PathSecurityException pse) {
            final var metadata = new LinkedHashMap<String, Object>();
            metadata.put("path", request.templatePath());
            metadata.put("clientId", clientId);
            metadata.put("reason", pse.reason().name());
            auditLogger.logSecurityViolation("Path traversal attempt", metadata);
            applyCooldown(clientId);
            return SecurityResult.rejected("Invalid template path", SecurityError.from(e));
        }
        if (e instanceof MemoryLimitException) {
            final var metadata = new LinkedHashMap<String, Object>();
            metadata.put("requestId", requestId);
            metadata.put("clientId", clientId);
            metadata.put("requestSize", request.requestSize());
            metadata.put("code", e.code().name());
            auditLogger.security("memory_limit_exceeded", "Memory allocation failed", metadata);
            return SecurityResult.rejected("Memory limit exceeded", SecurityError.from(e));
        }
        if (e instanceof ValidationException ve) {
            final var errors = ve.errors().stream()
                    .map(fe -> Map.of("path", fe.path(), "code", fe.code()))
                    .toList();
            auditLogger.warn("validation_failed", "Input validation failed", Map.of("errors", errors, "clientId", clientId));
            final var message = ve.errors().stream()
                    .map(fe -> (fe.path().isEmpty() ? "root" : fe.path()) + ": " + fe.message())
                    .collect(Collectors.joining(", "));
            return SecurityResult.rejected(
                    "Input validation failed", SecurityError.of(SecurityLayer.INPUT_VALIDATOR, e.code(), message));
        }
        if (e instanceof HebrewSecurityException) {
            applyCooldown(clientId);
            return SecurityResult.rejected("Homograph attack detected", SecurityError.from(e));
        }
        if (e instanceof TemplateIntegrityException) {
            final var metadata = new LinkedHashMap<String, Object>();
            metadata.put("templatePath", request.templatePath());
            metadata.put("clientId", clientId);
            auditLogger.logSecurityViolation("Template integrity check failed", metadata);
            applyCooldown(clientId);
            return SecurityResult.rejected("Template integrity check failed", SecurityError.from(e));
        }
        throw new IllegalStateException("Unhandled security layer exception: " + e.getClass().getName(), e);
    }

    private void applyCooldown(String clientId) {
        if (config.cooldownOnViolation()) {
            rateLimiter.recordError(clientId);
        }
    }

    private static SecurityResult internalError() {
        return SecurityResult.rejected(
                "Internal security error",
                SecurityError.of(SecurityLayer.SECURITY_MANAGER, ErrorCode.INTERNAL_ERROR, "Internal security error"));
    }

    private static Map<String, Object> changeMetadata(String path, String original, String sanitized) {
        final var metadata = new LinkedHashMap<String, Object>();
        metadata.put("field", path);
        metadata.put("originalLength", original.length());
        metadata.put("sanitizedLength", sanitized.length());
        return metadata;
    }

    /**
     * Applies a string transformation to every string inside nested maps and lists.
     */
    @FunctionalInterface
    private interface StringVisitor {
        String visit(String path, String value);
    }

    private static Map<String, Object> walkMap(String basePath, Map<?, ?> map, StringVisitor visitor) {
        final var result = new LinkedHashMap<String, Object>();
        for (final var entry : map.entrySet()) {
            final var key = String.valueOf(entry.getKey());
            result.put(key, walk(basePath.isEmpty() ? key : basePath + "." + key, entry.getValue(), visitor));
        }
        return result;
    }

    private static Object walk(String path, Object value, StringVisitor visitor) {
        if (value instanceof String s) {
            return visitor.visit(path, s);
        }
        if (value instanceof Map<?, ?> map) {
            return walkMap(path, map, visitor);
        }
        if (value instanceof Collection<?> collection) {
            final var result = new ArrayList<Object>(collection.size());
            var index = 0;
            for (final var item : collection) {
                result.add(walk(path + "." + index++, item, visitor));
            }
            return result;
        }
        return value;
    }
}
