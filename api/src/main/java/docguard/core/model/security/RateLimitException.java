package docguard.core.model.security;

/**
 * Raised when a client exceeds its throughput or concurrency budget, or is cooling down.
 */
public class RateLimitException extends SecurityLayerException {

    private final long retryAfterSeconds;

    public RateLimitException(String message, ErrorCode code, long retryAfterSeconds) {
        super(message, code, SecurityLayer.RATE_LIMITER);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * Seconds until the client may retry, or 0 when unknown (concurrency rejections).
     *
     * @return retry delay in seconds
     */
    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
