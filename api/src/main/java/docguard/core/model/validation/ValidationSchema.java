package docguard.core.model.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative description of the fields a record may contain.
 *
 * <p>Immutable once built and safe to share across threads and validation calls.
 * Fields keep their declaration order.
 */
public final class ValidationSchema {

    private static final ValidationSchema EMPTY = new ValidationSchema(Map.of());

    private final Map<String, FieldRule> fields;

    private ValidationSchema(Map<String, FieldRule> fields) {
        this.fields = fields;
    }

    public static ValidationSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, FieldRule> fields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidationSchema other)) {
            return false;
        }
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ValidationSchema" + fields.keySet();
    }

    /**
     * Builder for {@link ValidationSchema}.
     */
    public static final class Builder {

        private final Map<String, FieldRule> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder field(String name, FieldRule rule) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(rule, "rule");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Field name must not be blank");
            }
            fields.put(name, rule);
            return this;
        }

        public ValidationSchema build() {
            return new ValidationSchema(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
