package docguard.core.model.validation;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Constraints for a single field of a {@link ValidationSchema}.
 *
 * <p>Which constraints apply depends on {@link #type()}:
 * <ul>
 *   <li>textual types: {@code minLength}, {@code maxLength}, {@code pattern}, {@code trim},
 *       {@code allowHebrew}, {@code sanitizeBiDi}</li>
 *   <li>{@code NUMBER}: {@code min}, {@code max}, {@code integer}</li>
 *   <li>{@code ARRAY}: {@code minLength}, {@code maxLength} on the element count</li>
 *   <li>{@code OBJECT}: nested {@code properties}; without them any map passes through</li>
 * </ul>
 *
 * <p>After the built-in checks, {@code transform} is applied and then {@code custom}. A
 * custom validator returns the (possibly replaced) value or throws to reject it.
 */
public final class FieldRule {

    private final FieldType type;
    private final boolean required;
    private final Integer minLength;
    private final Integer maxLength;
    private final Double min;
    private final Double max;
    private final boolean integer;
    private final Pattern pattern;
    private final boolean trim;
    private final boolean allowHebrew;
    private final boolean sanitizeBiDi;
    private final UnaryOperator<Object> transform;
    private final UnaryOperator<Object> custom;
    private final ValidationSchema properties;

    private FieldRule(Builder b) {
        this.type = b.type;
        this.required = b.required;
        this.minLength = b.minLength;
        this.maxLength = b.maxLength;
        this.min = b.min;
        this.max = b.max;
        this.integer = b.integer;
        this.pattern = b.pattern;
        this.trim = b.trim;
        this.allowHebrew = b.allowHebrew;
        this.sanitizeBiDi = b.sanitizeBiDi;
        this.transform = b.transform;
        this.custom = b.custom;
        this.properties = b.properties;
    }

    public static Builder builder(FieldType type) {
        return new Builder(type);
    }

    public static FieldRule required(FieldType type) {
        return builder(type).required(true).build();
    }

    public static FieldRule optional(FieldType type) {
        return builder(type).build();
    }

    public FieldType type() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public OptionalInt minLength() {
        return minLength == null ? OptionalInt.empty() : OptionalInt.of(minLength);
    }

    public OptionalInt maxLength() {
        return maxLength == null ? OptionalInt.empty() : OptionalInt.of(maxLength);
    }

    public OptionalDouble min() {
        return min == null ? OptionalDouble.empty() : OptionalDouble.of(min);
    }

    public OptionalDouble max() {
        return max == null ? OptionalDouble.empty() : OptionalDouble.of(max);
    }

    public boolean isInteger() {
        return integer;
    }

    public Optional<Pattern> pattern() {
        return Optional.ofNullable(pattern);
    }

    public boolean trim() {
        return trim;
    }

    public boolean allowHebrew() {
        return allowHebrew;
    }

    public boolean sanitizeBiDi() {
        return sanitizeBiDi;
    }

    public Optional<UnaryOperator<Object>> transform() {
        return Optional.ofNullable(transform);
    }

    public Optional<UnaryOperator<Object>> custom() {
        return Optional.ofNullable(custom);
    }

    public Optional<ValidationSchema> properties() {
        return Optional.ofNullable(properties);
    }

    @Override
    public String toString() {
        return "FieldRule[" + type + (required ? ", required" : "") + "]";
    }

    /**
     * Builder for {@link FieldRule}. Strings are trimmed and may contain Hebrew unless told otherwise.
     */
    public static final class Builder {

        private final FieldType type;
        private boolean required;
        private Integer minLength;
        private Integer maxLength;
        private Double min;
        private Double max;
        private boolean integer;
        private Pattern pattern;
        private boolean trim = true;
        private boolean allowHebrew = true;
        private boolean sanitizeBiDi;
        private UnaryOperator<Object> transform;
        private UnaryOperator<Object> custom;
        private ValidationSchema properties;

        private Builder(FieldType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder minLength(int minLength) {
            if (minLength < 0) {
                throw new IllegalArgumentException("minLength must be non-negative");
            }
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            if (maxLength < 0) {
                throw new IllegalArgumentException("maxLength must be non-negative");
            }
            this.maxLength = maxLength;
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder integer(boolean integer) {
            this.integer = integer;
            return this;
        }

        public Builder pattern(Pattern pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder pattern(String regex) {
            this.pattern = regex == null ? null : Pattern.compile(regex);
            return this;
        }

        public Builder trim(boolean trim) {
            this.trim = trim;
            return this;
        }

        public Builder allowHebrew(boolean allowHebrew) {
            this.allowHebrew = allowHebrew;
            return this;
        }

        public Builder sanitizeBiDi(boolean sanitizeBiDi) {
            this.sanitizeBiDi = sanitizeBiDi;
            return this;
        }

        public Builder transform(UnaryOperator<Object> transform) {
            this.transform = transform;
            return this;
        }

        public Builder custom(UnaryOperator<Object> custom) {
            this.custom = custom;
            return this;
        }

        public Builder properties(ValidationSchema properties) {
            this.properties = properties;
            return this;
        }

        public FieldRule build() {
            if (minLength != null && maxLength != null && minLength > maxLength) {
                throw new IllegalArgumentException("minLength must not exceed maxLength");
            }
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("min must not exceed max");
            }
            if (properties != null && type != FieldType.OBJECT) {
                throw new IllegalArgumentException("properties only apply to OBJECT fields");
            }
            return new FieldRule(this);
        }
    }
}
