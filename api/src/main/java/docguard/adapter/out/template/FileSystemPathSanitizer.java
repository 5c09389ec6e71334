package docguard.adapter.out.template;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import docguard.core.config.TemplateConfig;
import docguard.core.model.security.PathSecurityException;
import docguard.core.model.security.PathSecurityException.Reason;
import docguard.core.model.template.TemplateLocation;
import docguard.core.port.out.PathSanitizer;

/**
 * Resolves template paths against the configured template roots.
 *
 * <p>Checks, in order: non-empty, no NUL or control characters, relative, no {@code ..}
 * segment, resolved path inside an allowed root, and (unless allowed) no symbolic link
 * anywhere between the root and the template.
 *
 * <p>Roots are searched in configuration order; the first root containing the template is
 * used. A template that exists in no root resolves against the first root.
 */
@ApplicationScoped
public class FileSystemPathSanitizer implements PathSanitizer {

    private static final Logger LOG = Logger.getLogger(FileSystemPathSanitizer.class);

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F]");
    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[a-zA-Z]:");

    private final List<Path> allowedBases;
    private final boolean allowSymlinks;

    @Inject
    public FileSystemPathSanitizer(TemplateConfig config) {
        this(config.allowedBasePaths().stream().map(Path::of).toList(), config.allowSymlinks());
    }

    /**
     * Creates a sanitizer for explicit roots.
     *
     * @param allowedBases  template roots, searched in order
     * @param allowSymlinks whether symbolic links may be followed
     * @throws IllegalArgumentException if no root is given
     */
    public FileSystemPathSanitizer(List<Path> allowedBases, boolean allowSymlinks) {
        if (allowedBases == null || allowedBases.isEmpty()) {
            throw new IllegalArgumentException("At least one base path must be provided");
        }
        this.allowedBases = allowedBases.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .toList();
        this.allowSymlinks = allowSymlinks;
    }

    @Override
    public TemplateLocation sanitize(String path) {
        if (path == null || path.isBlank()) {
            throw new PathSecurityException("Path cannot be empty", Reason.INVALID_PATH);
        }
        if (path.indexOf('\0') >= 0) {
            throw new PathSecurityException("Path contains null bytes", Reason.INVALID_PATH);
        }
        if (CONTROL_CHARS.matcher(path).find()) {
            throw new PathSecurityException("Path contains control characters", Reason.INVALID_PATH);
        }

        final var normalized = path.replace('\\', '/');
        if (normalized.startsWith("/") || WINDOWS_DRIVE.matcher(normalized).find()) {
            throw new PathSecurityException("Absolute paths are not allowed", Reason.NOT_ALLOWED);
        }
        for (final var segment : normalized.split("/")) {
            if (segment.equals("..")) {
                throw new PathSecurityException("Path traversal detected", Reason.TRAVERSAL);
            }
        }

        final var location = resolve(normalized);
        if (!allowSymlinks) {
            checkNoSymlinks(location.root(), location.file());
        }
        return location;
    }

    // First root that holds the template wins; a template found in none belongs to the first root
    private TemplateLocation resolve(String normalized) {
        TemplateLocation fallback = null;
        for (final var base : allowedBases) {
            final Path resolved;
            try {
                resolved = base.resolve(normalized).normalize();
            } catch (InvalidPathException e) {
                throw new PathSecurityException("Path is not valid", Reason.INVALID_PATH);
            }
            if (!resolved.startsWith(base)) {
                throw new PathSecurityException("Resolved path escapes base directory", Reason.TRAVERSAL);
            }
            final var location = new TemplateLocation(base, resolved);
            if (Files.exists(resolved, LinkOption.NOFOLLOW_LINKS)) {
                return location;
            }
            if (fallback == null) {
                fallback = location;
            }
        }
        return fallback;
    }

    private static void checkNoSymlinks(Path base, Path resolved) {
        var current = base;
        for (final var part : base.relativize(resolved)) {
            current = current.resolve(part);
            if (Files.isSymbolicLink(current)) {
                LOG.debugv("Rejected symbolic link in template path below {0}", base);
                throw new PathSecurityException("Symlinks are not allowed", Reason.SYMLINK_NOT_ALLOWED);
            }
        }
    }
}
