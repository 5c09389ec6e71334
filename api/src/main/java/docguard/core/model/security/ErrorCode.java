package docguard.core.model.security;

/**
 * Stable error codes surfaced to API callers.
 *
 * <p>Codes never change meaning once published; clients localize messages from them.
 */
public enum ErrorCode {
    RATE_LIMIT_EXCEEDED,
    CONCURRENT_LIMIT_EXCEEDED,
    IN_COOLDOWN,
    PATH_TRAVERSAL,
    PER_DOCUMENT_LIMIT_EXCEEDED,
    TOTAL_LIMIT_EXCEEDED,
    BATCH_SIZE_EXCEEDED,
    VALIDATION_FAILED,
    HOMOGRAPH_ATTACK,
    TEMPLATE_INTEGRITY_FAILED,
    INTERNAL_ERROR;

    /**
     * Whether this code belongs to the rate limiting family.
     *
     * @return true for throughput, concurrency and cooldown rejections
     */
    public boolean isRateLimit() {
        return this == RATE_LIMIT_EXCEEDED || this == CONCURRENT_LIMIT_EXCEEDED || this == IN_COOLDOWN;
    }

    /**
     * Whether this code belongs to the memory accounting family.
     *
     * @return true for per-document, total and batch ceiling rejections
     */
    public boolean isMemoryLimit() {
        return this == PER_DOCUMENT_LIMIT_EXCEEDED || this == TOTAL_LIMIT_EXCEEDED || this == BATCH_SIZE_EXCEEDED;
    }
}
