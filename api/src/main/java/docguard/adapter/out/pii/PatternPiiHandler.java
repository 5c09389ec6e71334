package docguard.adapter.out.pii;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import docguard.core.config.PiiConfig;
import docguard.core.model.pii.PiiDetection;
import docguard.core.model.pii.PiiType;
import docguard.core.port.out.PiiHandler;
import docguard.core.util.SecureHash;

/**
 * Detects Israeli personal data with regular expressions and check digits.
 *
 * <p>Recognised:
 * <ul>
 *   <li>Israeli ID numbers: nine digits, optionally grouped 3-3-3, with a valid check digit</li>
 *   <li>payment card numbers: 13 to 19 digits passing the Luhn check</li>
 *   <li>email addresses, including Hebrew domain labels</li>
 *   <li>Israeli mobile and landline numbers, with or without the 972 prefix</li>
 * </ul>
 *
 * <p>IDs are matched before phones so a valid ID is never reported twice.
 */
@ApplicationScoped
public class PatternPiiHandler implements PiiHandler {

    private static final Pattern ISRAELI_ID = Pattern.compile("\\b\\d{3}-?\\d{3}-?\\d{3}(?!\\d)");
    private static final Pattern CREDIT_CARD = Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4,7}\\b");
    private static final Pattern EMAIL = Pattern.compile(
            "\\b[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}|[a-zA-Z0-9._%+-]+@[\\u0590-\\u05FF.-]+\\.[a-zA-Z]{2,}\\b");
    private static final Pattern PHONE = Pattern.compile(
            "\\+?972[\\s-]?5[0-9][\\s-]?\\d{7}|\\b05[0-9][\\s-]?\\d{7}\\b|\\+?972[\\s-]?[2-9][\\s-]?\\d{7}|\\b0[2-9][\\s-]?\\d{7}\\b");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]");

    private final String replacement;
    private final int hashLength;

    @Inject
    public PatternPiiHandler(PiiConfig config) {
        this(config.replacement(), config.hashLength());
    }

    /**
     * Creates a handler.
     *
     * @param replacement placeholder template; {@code {type}} and {@code {hash}} are substituted
     * @param hashLength  hex characters of the value digest kept in the placeholder (1-64)
     */
    public PatternPiiHandler(String replacement, int hashLength) {
        if (hashLength < 1 || hashLength > 64) {
            throw new IllegalArgumentException("hashLength must be between 1 and 64");
        }
        this.replacement = replacement;
        this.hashLength = hashLength;
    }

    @Override
    public PiiDetection detectPii(String text) {
        if (text == null || text.isEmpty()) {
            return PiiDetection.none();
        }
        final var types = EnumSet.noneOf(PiiType.class);
        findAll(text).forEach(m -> types.add(m.type()));
        return PiiDetection.of(types);
    }

    @Override
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        var result = text;
        for (final var match : findAll(text)) {
            final var hash = SecureHash.truncatedSha256(match.value(), hashLength);
            final var placeholder = replacement.replace("{type}", match.type().name()).replace("{hash}", hash);
            result = result.replace(match.value(), placeholder);
        }
        return result;
    }

    private List<Match> findAll(String text) {
        final var seen = new LinkedHashSet<String>();
        final var matches = new ArrayList<Match>();

        final var ids = ISRAELI_ID.matcher(text);
        while (ids.find()) {
            final var value = ids.group();
            if (isValidIsraeliId(SEPARATORS.matcher(value).replaceAll("")) && seen.add(value)) {
                matches.add(new Match(PiiType.ISRAELI_ID, value));
            }
        }
        final var cards = CREDIT_CARD.matcher(text);
        while (cards.find()) {
            final var value = cards.group();
            if (!seen.contains(value) && isValidCardNumber(SEPARATORS.matcher(value).replaceAll(""))) {
                seen.add(value);
                matches.add(new Match(PiiType.CREDIT_CARD, value));
            }
        }
        final var emails = EMAIL.matcher(text);
        while (emails.find()) {
            if (seen.add(emails.group())) {
                matches.add(new Match(PiiType.EMAIL, emails.group()));
            }
        }
        final var phones = PHONE.matcher(text);
        while (phones.find()) {
            if (seen.add(phones.group())) {
                matches.add(new Match(PiiType.PHONE, phones.group()));
            }
        }
        return matches;
    }

    static boolean isValidIsraeliId(String digits) {
        return digits.length() == 9 && digits.chars().allMatch(Character::isDigit) && luhn(digits);
    }

    static boolean isValidCardNumber(String digits) {
        return digits.length() >= 13
                && digits.length() <= 19
                && digits.chars().allMatch(Character::isDigit)
                && luhn(digits);
    }

    private static boolean luhn(String digits) {
        var sum = 0;
        var doubled = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            var d = digits.charAt(i) - '0';
            if (doubled) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            doubled = !doubled;
        }
        return sum % 10 == 0;
    }

    private record Match(PiiType type, String value) {}
}
