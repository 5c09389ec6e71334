package docguard.core.model.security;

/**
 * Raised when a template does not match its trusted checksum.
 */
public class TemplateIntegrityException extends SecurityLayerException {

    public TemplateIntegrityException(String message) {
        super(message, ErrorCode.TEMPLATE_INTEGRITY_FAILED, SecurityLayer.TEMPLATE_VERIFIER);
    }
}
