package docguard.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import docguard.core.model.security.ErrorCode;
import docguard.core.model.security.SecurityError;

/**
 * RFC 7807 Problem Details factory for validation service errors.
 *
 * <p>Rejected pipeline results carry their layer, error code and retry hint as extension
 * members so callers can react without parsing the detail text.
 */
public final class DocumentProblem {

    private DocumentProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Pipeline Rejections ==========

    /**
     * Create a problem for a request the security pipeline rejected.
     *
     * @param reason short rejection reason, used as the title
     * @param error  structured rejection details
     * @return problem with {@code layer}, {@code code} and, when known, {@code retryAfter}
     */
    public static HttpProblem rejected(String reason, SecurityError error) {
        final var builder = HttpProblem.builder()
                .withTitle(reason)
                .withStatus(statusFor(error.code()))
                .withDetail(error.message())
                .with("layer", error.layer())
                .with("code", error.code().name());
        if (error.retryAfterSeconds() > 0) {
            builder.with("retryAfter", error.retryAfterSeconds());
            builder.withHeader("Retry-After", error.retryAfterSeconds());
        }
        return builder.build();
    }

    static Status statusFor(ErrorCode code) {
        if (code.isRateLimit()) {
            return Status.TOO_MANY_REQUESTS;
        }
        if (code.isMemoryLimit()) {
            return Status.REQUEST_ENTITY_TOO_LARGE;
        }
        return switch (code) {
            case TEMPLATE_INTEGRITY_FAILED -> Status.FORBIDDEN;
            case INTERNAL_ERROR -> Status.INTERNAL_SERVER_ERROR;
            default -> Status.BAD_REQUEST;
        };
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
