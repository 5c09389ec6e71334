package docguard.core.model.security;

/**
 * Structured description of why a request was rejected.
 *
 * @param layer             display name of the rejecting layer (e.g. {@code PathSanitizer})
 * @param code              stable error code
 * @param message           caller-safe message
 * @param retryAfterSeconds seconds until a retry may succeed, or 0 when not applicable
 */
public record SecurityError(String layer, ErrorCode code, String message, long retryAfterSeconds) {

    public static SecurityError of(SecurityLayer layer, ErrorCode code, String message) {
        return new SecurityError(layer.displayName(), code, message, 0);
    }

    public static SecurityError from(SecurityLayerException e) {
        final var retryAfter = e instanceof RateLimitException rle ? rle.retryAfterSeconds() : 0;
        return new SecurityError(e.layer().displayName(), e.code(), e.getMessage(), retryAfter);
    }
}
