package docguard.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import jakarta.ws.rs.core.Response.Status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import docguard.core.model.security.ErrorCode;
import docguard.core.model.security.SecurityError;
import docguard.core.model.security.SecurityLayer;

@DisplayName("DocumentProblem")
class DocumentProblemTest {

    @Nested
    @DisplayName("rejected")
    class RejectedTests {

        @Test
        @DisplayName("should carry layer and code as extension members")
        void shouldCarryExtensions() {
            var error = SecurityError.of(SecurityLayer.PATH_SANITIZER, ErrorCode.PATH_TRAVERSAL, "Path traversal detected");

            var problem = DocumentProblem.rejected("Invalid template path", error);

            assertEquals(400, problem.getStatusCode());
            assertEquals("Invalid template path", problem.getTitle());
            assertEquals("Path traversal detected", problem.getDetail());
            assertEquals("PathSanitizer", problem.getParameters().get("layer"));
            assertEquals("PATH_TRAVERSAL", problem.getParameters().get("code"));
            assertFalse(problem.getParameters().containsKey("retryAfter"));
            assertFalse(problem.getHeaders().containsKey("Retry-After"));
        }

        @Test
        @DisplayName("should add a retry hint for rate limit rejections")
        void shouldAddRetryHint() {
            var error = new SecurityError(
                    "RateLimiter", ErrorCode.RATE_LIMIT_EXCEEDED, "Rate limit exceeded. Retry after 3s", 3);

            var problem = DocumentProblem.rejected("Rate limit exceeded", error);

            assertEquals(429, problem.getStatusCode());
            assertEquals(3L, problem.getParameters().get("retryAfter"));
            assertEquals(3L, problem.getHeaders().get("Retry-After"));
        }
    }

    @Nested
    @DisplayName("statusFor")
    class StatusTests {

        @ParameterizedTest
        @EnumSource(value = ErrorCode.class, names = {"RATE_LIMIT_EXCEEDED", "CONCURRENT_LIMIT_EXCEEDED", "IN_COOLDOWN"})
        @DisplayName("should map rate limit codes to 429")
        void shouldMapRateLimits(ErrorCode code) {
            assertEquals(Status.TOO_MANY_REQUESTS, DocumentProblem.statusFor(code));
        }

        @ParameterizedTest
        @EnumSource(value = ErrorCode.class, names = {"PER_DOCUMENT_LIMIT_EXCEEDED", "TOTAL_LIMIT_EXCEEDED", "BATCH_SIZE_EXCEEDED"})
        @DisplayName("should map memory codes to 413")
        void shouldMapMemoryLimits(ErrorCode code) {
            assertEquals(Status.REQUEST_ENTITY_TOO_LARGE, DocumentProblem.statusFor(code));
        }

        @ParameterizedTest
        @EnumSource(value = ErrorCode.class, names = {"PATH_TRAVERSAL", "VALIDATION_FAILED", "HOMOGRAPH_ATTACK"})
        @DisplayName("should map input rejections to 400")
        void shouldMapInputRejections(ErrorCode code) {
            assertEquals(Status.BAD_REQUEST, DocumentProblem.statusFor(code));
        }

        @Test
        @DisplayName("should map integrity and internal failures")
        void shouldMapOtherFailures() {
            assertEquals(Status.FORBIDDEN, DocumentProblem.statusFor(ErrorCode.TEMPLATE_INTEGRITY_FAILED));
            assertEquals(Status.INTERNAL_SERVER_ERROR, DocumentProblem.statusFor(ErrorCode.INTERNAL_ERROR));
        }
    }

    @Test
    @DisplayName("should build plain bad request and internal error problems")
    void shouldBuildPlainProblems() {
        assertEquals(400, DocumentProblem.badRequest("clientId is required").getStatusCode());
        assertEquals("clientId is required", DocumentProblem.badRequest("clientId is required").getDetail());
        assertEquals(500, DocumentProblem.internalError("Audit trail unavailable").getStatusCode());
    }
}
