package docguard.core.model.validation;

import java.util.List;
import java.util.Map;

/**
 * Non-throwing validation result.
 *
 * @param valid  whether every field passed
 * @param data   the validated record when valid, otherwise null
 * @param errors one entry per invalid field; empty when valid
 */
public record ValidationOutcome(boolean valid, Map<String, Object> data, List<FieldError> errors) {

    public static ValidationOutcome success(Map<String, Object> data) {
        return new ValidationOutcome(true, data, List.of());
    }

    public static ValidationOutcome failure(List<FieldError> errors) {
        return new ValidationOutcome(false, null, List.copyOf(errors));
    }
}
