package docguard.core.model.security;

import java.util.List;
import java.util.stream.Collectors;

import docguard.core.model.validation.FieldError;

/**
 * Raised when field data fails schema validation.
 *
 * <p>Carries one {@link FieldError} per invalid field, never just the first.
 */
public class ValidationException extends SecurityLayerException {

    private final List<FieldError> errors;

    public ValidationException(List<FieldError> errors) {
        super(buildMessage(errors), ErrorCode.VALIDATION_FAILED, SecurityLayer.INPUT_VALIDATOR);
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> errors() {
        return errors;
    }

    private static String buildMessage(List<FieldError> errors) {
        return "Validation failed: "
                + errors.stream()
                        .map(e -> e.path().isEmpty() ? "root" : e.path())
                        .collect(Collectors.joining(", "));
    }
}
