package docguard.core.util;

/**
 * Invisible Unicode control characters used to disguise text.
 */
public final class UnicodeControls {

    private UnicodeControls() {}

    /**
     * Bidirectional embedding, override and isolate controls, directional marks and the
     * Arabic letter mark: U+202A-U+202E, U+2066-U+2069, U+200E, U+200F, U+061C.
     *
     * @param c the character
     * @return true for a BiDi control
     */
    public static boolean isBiDiControl(char c) {
        return (c >= '\u202A' && c <= '\u202E')
                || (c >= '\u2066' && c <= '\u2069')
                || c == '\u200E'
                || c == '\u200F'
                || c == '\u061C';
    }

    /**
     * Zero-width space, non-joiner and joiner: U+200B-U+200D.
     *
     * @param c the character
     * @return true for a zero-width character
     */
    public static boolean isZeroWidth(char c) {
        return c >= '\u200B' && c <= '\u200D';
    }

    public static String stripBiDi(String text) {
        return strip(text, true, false);
    }

    public static String stripZeroWidth(String text) {
        return strip(text, false, true);
    }

    public static boolean containsBiDi(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isBiDiControl(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsZeroWidth(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isZeroWidth(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remove the selected classes of controls in one pass.
     *
     * <p>All controls are in the BMP, so a char-wise scan never splits a surrogate pair.
     *
     * @param text      the text
     * @param biDi      remove BiDi controls
     * @param zeroWidth remove zero-width characters
     * @return the stripped text, or the same instance when nothing was removed
     */
    public static String strip(String text, boolean biDi, boolean zeroWidth) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            final var c = text.charAt(i);
            final var drop = (biDi && isBiDiControl(c)) || (zeroWidth && isZeroWidth(c));
            if (drop && sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            } else if (!drop && sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
