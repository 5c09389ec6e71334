package docguard.core.model.text;

/**
 * Writing systems distinguished by homograph detection.
 */
public enum Script {
    LATIN("Latin"),
    CYRILLIC("Cyrillic"),
    HEBREW("Hebrew"),
    DIGIT("Digit"),
    OTHER("Other");

    private final String displayName;

    Script(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Whether a code point carries no script of its own: whitespace, punctuation, symbols,
     * combining marks and format characters.
     *
     * @param codePoint the code point
     * @return true when the code point is ignored by script detection
     */
    public static boolean isNeutral(int codePoint) {
        if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
            case Character.MATH_SYMBOL:
            case Character.CURRENCY_SYMBOL:
            case Character.MODIFIER_SYMBOL:
            case Character.OTHER_SYMBOL:
            case Character.NON_SPACING_MARK:
            case Character.ENCLOSING_MARK:
            case Character.COMBINING_SPACING_MARK:
            case Character.FORMAT:
            case Character.CONTROL:
                return true;
            default:
                return false;
        }
    }

    /**
     * Classify a single code point.
     *
     * @param codePoint the code point
     * @return the script it belongs to
     */
    public static Script of(int codePoint) {
        if (codePoint >= '0' && codePoint <= '9') {
            return DIGIT;
        }
        final Character.UnicodeScript script;
        try {
            script = Character.UnicodeScript.of(codePoint);
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
        switch (script) {
            case LATIN:
                return LATIN;
            case CYRILLIC:
                return CYRILLIC;
            case HEBREW:
                return HEBREW;
            default:
                return Character.isDigit(codePoint) ? DIGIT : OTHER;
        }
    }
}
