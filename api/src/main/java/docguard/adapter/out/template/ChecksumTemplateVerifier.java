package docguard.adapter.out.template;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import docguard.core.config.TemplateConfig;
import docguard.core.port.out.TemplateVerifier;
import docguard.core.util.SecureHash;

/**
 * Verifies template files against hex digests.
 *
 * <p>The trusted manifest maps a template path below its root to its checksum. Manifest keys
 * are normalized once ({@code \} to {@code /}, {@code .} segments and empty segments dropped) so
 * they match {@link docguard.core.model.template.TemplateLocation#relativePath()}. A missing
 * or unreadable template never verifies.
 */
@ApplicationScoped
public class ChecksumTemplateVerifier implements TemplateVerifier {

    private static final Logger LOG = Logger.getLogger(ChecksumTemplateVerifier.class);

    private final String algorithm;
    private final Map<String, String> manifest;

    @Inject
    public ChecksumTemplateVerifier(TemplateConfig config) {
        this(config.checksumAlgorithm(), config.checksums());
    }

    /**
     * Creates a verifier.
     *
     * @param algorithm {@code SHA-256} or {@code SHA-512}
     * @param manifest  trusted checksums keyed by template path
     * @throws IllegalArgumentException for an unsupported algorithm
     */
    public ChecksumTemplateVerifier(String algorithm, Map<String, String> manifest) {
        if (!SecureHash.isSupported(algorithm)) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm);
        }
        this.algorithm = algorithm.toUpperCase(Locale.ROOT);
        final var normalized = new HashMap<String, String>();
        manifest.forEach((path, checksum) -> {
            if (normalized.put(normalizeKey(path), checksum) != null) {
                throw new IllegalArgumentException("Duplicate checksum manifest entry: " + path);
            }
        });
        this.manifest = Map.copyOf(normalized);
    }

    @Override
    public boolean verify(String path, String expectedChecksum) {
        final var file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            LOG.warnv("Template {0} not found for checksum verification", file.getFileName());
            return false;
        }
        try {
            return SecureHash.digestsMatch(expectedChecksum, SecureHash.fileDigestHex(file, algorithm));
        } catch (IOException e) {
            LOG.warnv(e, "Failed to read template {0} for checksum verification", file.getFileName());
            return false;
        }
    }

    @Override
    public Optional<String> trustedChecksum(String relativePath) {
        if (relativePath == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(manifest.get(normalizeKey(relativePath)));
    }

    static String normalizeKey(String path) {
        final var parts = new ArrayList<String>();
        for (final var segment : path.replace('\\', '/').split("/")) {
            if (!segment.isEmpty() && !segment.equals(".")) {
                parts.add(segment);
            }
        }
        return String.join("/", parts);
    }
}
