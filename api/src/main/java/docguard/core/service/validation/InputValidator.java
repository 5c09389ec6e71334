package docguard.core.service.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import docguard.core.model.security.ValidationException;
import docguard.core.model.text.Script;
import docguard.core.model.validation.FieldError;
import docguard.core.model.validation.FieldRule;
import docguard.core.model.validation.FieldType;
import docguard.core.model.validation.ValidationOutcome;
import docguard.core.model.validation.ValidationSchema;
import docguard.core.util.UnicodeControls;

/**
 * Validates untrusted field records against a {@link ValidationSchema}.
 *
 * <p>Semantics:
 * <ul>
 *   <li>a {@code null} value is treated as absent; an absent optional field is left out of
 *       the result, an absent required field is an error</li>
 *   <li>fields the schema does not declare are dropped from the result</li>
 *   <li>every invalid field is reported, each once, with a dotted path for nested fields</li>
 * </ul>
 *
 * <p>The validator is stateless and thread-safe.
 */
@ApplicationScoped
public class InputValidator {

    private static final Logger LOG = Logger.getLogger(InputValidator.class);

    private static final Pattern EMAIL = Pattern.compile(
            "^(?!\\.)(?!.*\\.\\.)[A-Z0-9_'+\\-.]*[A-Z0-9_+-]@([A-Z0-9][A-Z0-9\\-]*\\.)+[A-Z]{2,}$",
            Pattern.CASE_INSENSITIVE);

    /**
     * Validate a record, throwing on failure.
     *
     * @param data   the record (null is a root error)
     * @param schema the schema; null passes every field through unchanged
     * @return the validated record in schema declaration order
     * @throws ValidationException listing every invalid field
     */
    public Map<String, Object> validate(Map<String, ?> data, ValidationSchema schema) {
        final var outcome = validateQuietly(data, schema);
        if (!outcome.valid()) {
            throw new ValidationException(outcome.errors());
        }
        return outcome.data();
    }

    /**
     * Validate a record without throwing.
     *
     * @param data   the record
     * @param schema the schema; null passes every field through unchanged
     * @return the outcome
     */
    public ValidationOutcome validateQuietly(Map<String, ?> data, ValidationSchema schema) {
        if (data == null) {
            return ValidationOutcome.failure(
                    List.of(new FieldError("", "Expected object, received null", FieldError.INVALID_TYPE)));
        }
        if (schema == null) {
            return ValidationOutcome.success(new LinkedHashMap<>(data));
        }
        final var errors = new ArrayList<FieldError>();
        final var result = validateObject("", data, schema, errors);
        if (!errors.isEmpty()) {
            LOG.debugv("Validation rejected {0} field(s)", errors.size());
            return ValidationOutcome.failure(errors);
        }
        return ValidationOutcome.success(result);
    }

    private Map<String, Object> validateObject(
            String basePath, Map<?, ?> data, ValidationSchema schema, List<FieldError> errors) {
        final var result = new LinkedHashMap<String, Object>();
        for (final var field : schema.fields().entrySet()) {
            final var path = basePath.isEmpty() ? field.getKey() : basePath + "." + field.getKey();
            final var rule = field.getValue();
            final var value = data.get(field.getKey());
            if (value == null) {
                if (rule.isRequired()) {
                    errors.add(new FieldError(path, "Required", FieldError.REQUIRED));
                }
                continue;
            }
            final var checked = validateField(path, value, rule, errors);
            if (checked != null) {
                result.put(field.getKey(), checked);
            }
        }
        return result;
    }

    /**
     * Returns the validated value, or null after recording an error.
     */
    private Object validateField(String path, Object value, FieldRule rule, List<FieldError> errors) {
        final var before = errors.size();
        final Object checked;
        switch (rule.type()) {
            case STRING:
            case EMAIL:
            case URL:
                checked = checkString(path, value, rule, errors);
                break;
            case NUMBER:
                checked = checkNumber(path, value, rule, errors);
                break;
            case BOOLEAN:
                checked = value instanceof Boolean ? value : typeError(path, "boolean", value, errors);
                break;
            case ARRAY:
                checked = checkArray(path, value, rule, errors);
                break;
            case OBJECT:
                checked = checkObject(path, value, rule, errors);
                break;
            default:
                throw new IllegalStateException("Unhandled field type: " + rule.type());
        }
        if (errors.size() > before) {
            return null;
        }
        return applyCustom(path, checked, rule, errors);
    }

    private Object applyCustom(String path, Object value, FieldRule rule, List<FieldError> errors) {
        var result = value;
        if (rule.transform().isPresent()) {
            try {
                result = rule.transform().get().apply(result);
            } catch (RuntimeException e) {
                LOG.debugv("Transform failed for field {0}: {1}", path, e.getMessage());
                errors.add(new FieldError(path, "Transform failed", FieldError.CUSTOM));
                return null;
            }
        }
        if (rule.custom().isPresent()) {
            try {
                result = rule.custom().get().apply(result);
            } catch (RuntimeException e) {
                LOG.debugv("Custom validation failed for field {0}: {1}", path, e.getMessage());
                final var message = e.getMessage() == null || e.getMessage().isBlank()
                        ? "Custom validation failed"
                        : e.getMessage();
                errors.add(new FieldError(path, message, FieldError.CUSTOM));
                return null;
            }
        }
        return result;
    }

    private Object checkString(String path, Object value, FieldRule rule, List<FieldError> errors) {
        if (!(value instanceof CharSequence)) {
            return typeError(path, "string", value, errors);
        }
        var s = value.toString();
        if (rule.trim()) {
            s = s.strip();
        }
        final var length = s.codePointCount(0, s.length());
        if (rule.isRequired() && length == 0) {
            return fail(path, "String must contain at least 1 character(s)", FieldError.TOO_SMALL, errors);
        }
        if (rule.minLength().isPresent() && length < rule.minLength().getAsInt()) {
            return fail(
                    path,
                    "String must contain at least " + rule.minLength().getAsInt() + " character(s)",
                    FieldError.TOO_SMALL,
                    errors);
        }
        if (rule.maxLength().isPresent() && length > rule.maxLength().getAsInt()) {
            return fail(
                    path,
                    "String must contain at most " + rule.maxLength().getAsInt() + " character(s)",
                    FieldError.TOO_BIG,
                    errors);
        }
        if (rule.pattern().isPresent() && !rule.pattern().get().matcher(s).find()) {
            return fail(path, "Invalid", FieldError.INVALID_STRING, errors);
        }
        if (rule.type() == FieldType.EMAIL && !EMAIL.matcher(s).matches()) {
            return fail(path, "Invalid email", FieldError.INVALID_STRING, errors);
        }
        if (rule.type() == FieldType.URL && !isUrl(s)) {
            return fail(path, "Invalid url", FieldError.INVALID_STRING, errors);
        }
        if (!rule.allowHebrew() && containsHebrew(s)) {
            return fail(path, "Hebrew characters are not allowed", FieldError.INVALID_STRING, errors);
        }
        if (rule.sanitizeBiDi()) {
            s = UnicodeControls.stripBiDi(s);
        }
        return s;
    }

    private Object checkNumber(String path, Object value, FieldRule rule, List<FieldError> errors) {
        if (!(value instanceof Number number)) {
            return typeError(path, "number", value, errors);
        }
        final var d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return fail(path, "Expected number, received nan", FieldError.INVALID_TYPE, errors);
        }
        if (rule.isInteger() && !isIntegral(number)) {
            return fail(path, "Expected integer, received float", FieldError.NOT_INTEGER, errors);
        }
        if (rule.min().isPresent() && d < rule.min().getAsDouble()) {
            return fail(
                    path,
                    "Number must be greater than or equal to " + format(rule.min().getAsDouble()),
                    FieldError.TOO_SMALL,
                    errors);
        }
        if (rule.max().isPresent() && d > rule.max().getAsDouble()) {
            return fail(
                    path,
                    "Number must be less than or equal to " + format(rule.max().getAsDouble()),
                    FieldError.TOO_BIG,
                    errors);
        }
        return number;
    }

    private Object checkArray(String path, Object value, FieldRule rule, List<FieldError> errors) {
        if (!(value instanceof Collection<?> collection)) {
            return typeError(path, "array", value, errors);
        }
        final var size = collection.size();
        if (rule.minLength().isPresent() && size < rule.minLength().getAsInt()) {
            return fail(
                    path,
                    "Array must contain at least " + rule.minLength().getAsInt() + " element(s)",
                    FieldError.TOO_SMALL,
                    errors);
        }
        if (rule.maxLength().isPresent() && size > rule.maxLength().getAsInt()) {
            return fail(
                    path,
                    "Array must contain at most " + rule.maxLength().getAsInt() + " element(s)",
                    FieldError.TOO_BIG,
                    errors);
        }
        return new ArrayList<Object>(collection);
    }

    private Object checkObject(String path, Object value, FieldRule rule, List<FieldError> errors) {
        if (!(value instanceof Map<?, ?> map)) {
            return typeError(path, "object", value, errors);
        }
        if (rule.properties().isEmpty()) {
            final var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return validateObject(path, map, rule.properties().get(), errors);
    }

    private static Object typeError(String path, String expected, Object value, List<FieldError> errors) {
        return fail(path, "Expected " + expected + ", received " + describe(value), FieldError.INVALID_TYPE, errors);
    }

    private static Object fail(String path, String message, String code, List<FieldError> errors) {
        errors.add(new FieldError(path, message, code));
        return null;
    }

    private static String describe(Object value) {
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return true;
        }
        if (number instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        final var d = number.doubleValue();
        return d == Math.rint(d);
    }

    private static boolean isUrl(String s) {
        try {
            final var uri = new URI(s);
            if (uri.getScheme() == null) {
                return false;
            }
            final var scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (scheme.equals("http") || scheme.equals("https")) {
                return uri.getHost() != null;
            }
            return true;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean containsHebrew(String s) {
        return s.codePoints().anyMatch(cp -> Script.of(cp) == Script.HEBREW);
    }

    private static String format(double d) {
        return d == Math.rint(d) && !Double.isInfinite(d) ? Long.toString((long) d) : Double.toString(d);
    }
}
