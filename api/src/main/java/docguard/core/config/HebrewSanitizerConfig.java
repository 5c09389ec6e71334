package docguard.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for Unicode text sanitization.
 *
 * <p>Configuration prefix: {@code docguard.hebrew}
 *
 * <p>Every stage can be switched off independently. Stages run in the order the
 * methods are declared here.
 */
@ConfigMapping(prefix = "docguard.hebrew")
public interface HebrewSanitizerConfig {

    /**
     * Strip bidirectional embedding, override, isolate and mark characters.
     *
     * @return true to strip (default: true)
     */
    @WithDefault("true")
    boolean removeBidi();

    /**
     * Strip zero-width space, non-joiner and joiner.
     *
     * @return true to strip (default: true)
     */
    @WithDefault("true")
    boolean removeZeroWidth();

    /**
     * Apply canonical composition (NFC).
     *
     * @return true to normalize (default: true)
     */
    @WithDefault("true")
    boolean normalizeUnicode();

    /**
     * Reject text mixing mutually suspicious scripts.
     *
     * @return true to detect (default: true)
     */
    @WithDefault("true")
    boolean detectHomographs();

    /**
     * Script pairs treated as a homograph attack when both occur in one string.
     *
     * <p>Each entry is written {@code SCRIPT+SCRIPT} using the names of
     * {@link docguard.core.model.text.Script}.
     *
     * @return pairs (default: LATIN+CYRILLIC, HEBREW+CYRILLIC)
     */
    @WithDefault("LATIN+CYRILLIC,HEBREW+CYRILLIC")
    List<String> suspiciousScriptPairs();
}
