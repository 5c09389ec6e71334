package docguard.core.model.template;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A template path after resolution inside one of the allowed template roots.
 *
 * @param root the template root the file was resolved in
 * @param file the normalized absolute file path, inside {@code root}
 */
public record TemplateLocation(Path root, Path file) {

    public TemplateLocation {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(file, "file must not be null");
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("file must be inside root");
        }
    }

    /**
     * The canonical name of the template: its path below the root, {@code /}-separated.
     *
     * <p>Every spelling of the same template ({@code ./a/b}, {@code a/./b}, {@code a\b})
     * yields the same value.
     *
     * @return the root-relative path
     */
    public String relativePath() {
        final var relative = root.relativize(file);
        final var joined = new StringBuilder();
        for (final var part : relative) {
            if (joined.length() > 0) {
                joined.append('/');
            }
            joined.append(part);
        }
        return joined.toString();
    }
}
