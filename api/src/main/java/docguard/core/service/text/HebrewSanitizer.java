package docguard.core.service.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import docguard.core.config.HebrewSanitizerConfig;
import docguard.core.model.security.HebrewSecurityException;
import docguard.core.model.text.Script;
import docguard.core.model.text.ScriptPair;
import docguard.core.util.UnicodeControls;

/**
 * Removes Unicode tricks from untrusted text and rejects homograph spoofing.
 *
 * <p>Stages, each switchable:
 * <ol>
 *   <li>strip bidirectional controls</li>
 *   <li>strip zero-width characters</li>
 *   <li>canonical composition (NFC)</li>
 *   <li>reject text in which both scripts of a suspicious pair occur</li>
 * </ol>
 *
 * <p>Hebrew mixed with Latin is always legitimate in Israeli documents and is never a
 * suspicious pair by default. The result of {@link #sanitize(String)} is a fixed point:
 * sanitizing it again returns it unchanged.
 */
@ApplicationScoped
public class HebrewSanitizer {

    private final boolean removeBiDi;
    private final boolean removeZeroWidth;
    private final boolean normalizeUnicode;
    private final boolean detectHomographs;
    private final List<ScriptPair> suspiciousPairs;

    @Inject
    public HebrewSanitizer(HebrewSanitizerConfig config) {
        this(
                config.removeBidi(),
                config.removeZeroWidth(),
                config.normalizeUnicode(),
                config.detectHomographs(),
                config.suspiciousScriptPairs().stream().map(ScriptPair::parse).toList());
    }

    public HebrewSanitizer(
            boolean removeBiDi,
            boolean removeZeroWidth,
            boolean normalizeUnicode,
            boolean detectHomographs,
            List<ScriptPair> suspiciousPairs) {
        this.removeBiDi = removeBiDi;
        this.removeZeroWidth = removeZeroWidth;
        this.normalizeUnicode = normalizeUnicode;
        this.detectHomographs = detectHomographs;
        this.suspiciousPairs = List.copyOf(suspiciousPairs);
    }

    /**
     * Sanitizer with every stage enabled and the default suspicious pairs.
     *
     * @return a strict sanitizer
     */
    public static HebrewSanitizer strict() {
        return new HebrewSanitizer(true, true, true, true, defaultPairs());
    }

    public static List<ScriptPair> defaultPairs() {
        return List.of(new ScriptPair(Script.LATIN, Script.CYRILLIC), new ScriptPair(Script.HEBREW, Script.CYRILLIC));
    }

    /**
     * Sanitize one string.
     *
     * @param text the text (null is returned as is)
     * @return the sanitized text
     * @throws HebrewSecurityException when a suspicious script pair is present
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        var result = UnicodeControls.strip(text, removeBiDi, removeZeroWidth);
        if (normalizeUnicode && !Normalizer.isNormalized(result, Normalizer.Form.NFC)) {
            result = Normalizer.normalize(result, Normalizer.Form.NFC);
        }
        if (detectHomographs) {
            checkHomographs(result);
        }
        return result;
    }

    /**
     * Sanitize several strings, stopping at the first rejection.
     *
     * @param texts the texts
     * @return sanitized texts in the same order
     * @throws HebrewSecurityException for the first text that is rejected
     */
    public List<String> sanitizeBatch(List<String> texts) {
        final var result = new ArrayList<String>(texts.size());
        for (final var text : texts) {
            result.add(sanitize(text));
        }
        return result;
    }

    /**
     * Scripts present in the text, in order of first occurrence. Neutral characters are skipped.
     *
     * @param text the text
     * @return the detected scripts
     */
    public Set<Script> detectScripts(String text) {
        final var scripts = new LinkedHashSet<Script>();
        text.codePoints()
                .filter(cp -> !Script.isNeutral(cp))
                .mapToObj(Script::of)
                .forEach(scripts::add);
        return scripts;
    }

    private void checkHomographs(String text) {
        final var scripts = detectScripts(text);
        if (scripts.size() < 2) {
            return;
        }
        final var present = new ArrayList<>(scripts);
        for (int i = 0; i < present.size(); i++) {
            for (int j = i + 1; j < present.size(); j++) {
                if (isSuspicious(present.get(i), present.get(j))) {
                    final var letters = present.stream()
                            .filter(s -> s != Script.DIGIT)
                            .toList();
                    throw new HebrewSecurityException(
                            "Homograph attack detected: mixed scripts ("
                                    + letters.stream().map(Script::displayName).collect(Collectors.joining(", "))
                                    + ")",
                            letters);
                }
            }
        }
    }

    private boolean isSuspicious(Script a, Script b) {
        for (final var pair : suspiciousPairs) {
            if (pair.matches(a, b)) {
                return true;
            }
        }
        return false;
    }
}
