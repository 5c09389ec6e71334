package docguard.core.config;

import java.util.List;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for template location and integrity checks.
 *
 * <p>Configuration prefix: {@code docguard.templates}
 *
 * <p>Example:
 * <pre>
 * docguard.templates.allowed-base-paths=templates,/srv/shared-templates
 * docguard.templates.checksums."invoice.pdf"=9f86d081884c7d65...
 * </pre>
 */
@ConfigMapping(prefix = "docguard.templates")
public interface TemplateConfig {

    /**
     * Roots a template path must resolve inside. Relative paths resolve against the first.
     *
     * @return base paths (default: templates)
     */
    @WithDefault("templates")
    List<String> allowedBasePaths();

    /**
     * Whether a template may be reached through a symbolic link.
     *
     * @return true to allow (default: false)
     */
    @WithDefault("false")
    boolean allowSymlinks();

    /**
     * Digest used for template checksums, {@code SHA-256} or {@code SHA-512}.
     *
     * @return algorithm name (default: SHA-256)
     */
    @WithDefault("SHA-256")
    String checksumAlgorithm();

    /**
     * Trusted manifest: template path as requested, mapped to its hex checksum.
     *
     * @return manifest entries (default: empty)
     */
    @WithDefault("")
    Map<String, String> checksums();
}
