package docguard.core.model.validation;

/**
 * One failing field.
 *
 * @param path    dotted path to the field ({@code user.email}); empty for the root record
 * @param message human-readable description
 * @param code    machine-readable failure kind, one of the constants below
 */
public record FieldError(String path, String message, String code) {

    public static final String INVALID_TYPE = "invalid_type";
    public static final String REQUIRED = "required";
    public static final String TOO_SMALL = "too_small";
    public static final String TOO_BIG = "too_big";
    public static final String INVALID_STRING = "invalid_string";
    public static final String NOT_INTEGER = "not_integer";
    public static final String CUSTOM = "custom";
}
