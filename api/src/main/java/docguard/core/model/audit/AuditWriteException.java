package docguard.core.model.audit;

/**
 * Raised when audit entries cannot be made durable.
 */
public class AuditWriteException extends RuntimeException {

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
