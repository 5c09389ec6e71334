package docguard.core.model.text;

import java.util.Locale;
import java.util.Objects;

/**
 * An unordered pair of scripts whose co-occurrence in one string is treated as a
 * homograph attack.
 *
 * <p>{@code ScriptPair(LATIN, CYRILLIC)} equals {@code ScriptPair(CYRILLIC, LATIN)}.
 */
public record ScriptPair(Script first, Script second) {

    public ScriptPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first == second) {
            throw new IllegalArgumentException("A suspicious script pair needs two different scripts: " + first);
        }
        if (first.ordinal() > second.ordinal()) {
            final var tmp = first;
            first = second;
            second = tmp;
        }
    }

    /**
     * Parse a pair written as {@code LATIN+CYRILLIC} (case-insensitive).
     *
     * @param value the textual pair
     * @return the parsed pair
     * @throws IllegalArgumentException if the value is malformed or names an unknown script
     */
    public static ScriptPair parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Script pair must not be null");
        }
        final var parts = value.trim().split("\\+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Script pair must look like SCRIPT+SCRIPT: " + value);
        }
        return new ScriptPair(parseScript(parts[0]), parseScript(parts[1]));
    }

    public boolean matches(Script a, Script b) {
        return (first == a && second == b) || (first == b && second == a);
    }

    private static Script parseScript(String name) {
        try {
            return Script.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown script: " + name.trim(), e);
        }
    }
}
