package docguard.core.model.security;

/**
 * The stages of the request validation pipeline, in execution order.
 *
 * <p>{@link #displayName()} is the layer name reported in rejected results.
 */
public enum SecurityLayer {
    RATE_LIMITER("RateLimiter"),
    PATH_SANITIZER("PathSanitizer"),
    MEMORY_MANAGER("MemoryManager"),
    INPUT_VALIDATOR("InputValidator"),
    HEBREW_SANITIZER("HebrewSanitizer"),
    TEMPLATE_VERIFIER("TemplateVerifier"),
    PII_HANDLER("PIIHandler"),
    AUDIT_LOGGER("AuditLogger"),
    SECURITY_MANAGER("SecurityManager");

    private final String displayName;

    SecurityLayer(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
