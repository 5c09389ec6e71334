package docguard.core.model.security;

/**
 * Raised when an allocation would exceed the per-document, total or batch ceiling.
 */
public class MemoryLimitException extends SecurityLayerException {

    public MemoryLimitException(String message, ErrorCode code) {
        super(message, code, SecurityLayer.MEMORY_MANAGER);
    }
}
