package docguard.core.model.security;

/**
 * Raised when a template path escapes the allowed roots or is otherwise unsafe.
 *
 * <p>All variants surface as {@link ErrorCode#PATH_TRAVERSAL}; {@link #reason()} keeps the
 * finer-grained cause for the audit trail.
 */
public class PathSecurityException extends SecurityLayerException {

    /**
     * Why a path was rejected.
     */
    public enum Reason {
        INVALID_PATH,
        TRAVERSAL,
        NOT_ALLOWED,
        SYMLINK_NOT_ALLOWED
    }

    private final Reason reason;

    public PathSecurityException(String message, Reason reason) {
        super(message, ErrorCode.PATH_TRAVERSAL, SecurityLayer.PATH_SANITIZER);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
