package docguard.core.port.out;

import docguard.core.model.security.PathSecurityException;
import docguard.core.model.template.TemplateLocation;

/**
 * Port interface for resolving caller-supplied template paths.
 */
public interface PathSanitizer {

    /**
     * Resolve a template path inside one of the allowed roots.
     *
     * @param path the requested path
     * @return the root and the normalized, resolved file
     * @throws PathSecurityException on traversal, symlinks or paths outside the allowed roots
     */
    TemplateLocation sanitize(String path);
}
