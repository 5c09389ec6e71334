package docguard.core.port.out;

import java.util.Optional;

/**
 * Port interface for template integrity checks.
 */
public interface TemplateVerifier {

    /**
     * Compare the template's digest with an expected checksum.
     *
     * @param path             resolved template path
     * @param expectedChecksum hex digest
     * @return true when the digests match; false on mismatch or an unreadable template
     */
    boolean verify(String path, String expectedChecksum);

    /**
     * Look up the trusted checksum of a template in the configured manifest.
     *
     * @param relativePath the template path below its root, {@code /}-separated and normalized
     * @return the trusted checksum, if the manifest lists the template
     */
    Optional<String> trustedChecksum(String relativePath);
}
