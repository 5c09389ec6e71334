package docguard.core.model.security;

import java.util.List;

import docguard.core.model.text.Script;

/**
 * Raised when text mixes scripts that are considered mutually suspicious.
 */
public class HebrewSecurityException extends SecurityLayerException {

    private final List<Script> detectedScripts;

    public HebrewSecurityException(String message, List<Script> detectedScripts) {
        super(message, ErrorCode.HOMOGRAPH_ATTACK, SecurityLayer.HEBREW_SANITIZER);
        this.detectedScripts = List.copyOf(detectedScripts);
    }

    public List<Script> detectedScripts() {
        return detectedScripts;
    }
}
