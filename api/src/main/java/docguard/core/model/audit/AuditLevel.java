package docguard.core.model.audit;

/**
 * Severity of an audit entry. {@code SECURITY} marks policy violations and authentication events.
 */
public enum AuditLevel {
    INFO,
    WARN,
    ERROR,
    SECURITY
}
