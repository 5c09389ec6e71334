package docguard.adapter.in.dto;

import java.util.Map;

import docguard.core.model.validation.FieldRule;
import docguard.core.model.validation.FieldType;
import docguard.core.model.validation.ValidationSchema;

/**
 * JSON form of a single field rule in a request schema.
 *
 * <p>Only {@code type} is mandatory. Omitted flags take the {@link FieldRule} defaults.
 *
 * @param type         field type name ({@code string}, {@code number}, {@code email}, ...)
 * @param required     whether the field must be present
 * @param minLength    minimum string length
 * @param maxLength    maximum string length
 * @param min          minimum numeric value
 * @param max          maximum numeric value
 * @param integer      whether numbers must be whole
 * @param pattern      regular expression strings must contain a match of
 * @param trim         whether to trim strings before checking them
 * @param allowHebrew  whether Hebrew letters are accepted in strings
 * @param sanitizeBiDi whether to strip BiDi control characters from strings
 * @param properties   rules for the members of an object field
 */
public record FieldRuleDto(
        String type,
        Boolean required,
        Integer minLength,
        Integer maxLength,
        Double min,
        Double max,
        Boolean integer,
        String pattern,
        Boolean trim,
        Boolean allowHebrew,
        Boolean sanitizeBiDi,
        Map<String, FieldRuleDto> properties) {

    /**
     * Converts this DTO to a FieldRule model.
     *
     * @throws IllegalArgumentException for an unknown type, an invalid pattern or inconsistent bounds
     */
    public FieldRule toModel() {
        final var builder = FieldRule.builder(FieldType.fromName(type));
        if (required != null) {
            builder.required(required);
        }
        if (minLength != null) {
            builder.minLength(minLength);
        }
        if (maxLength != null) {
            builder.maxLength(maxLength);
        }
        if (min != null) {
            builder.min(min);
        }
        if (max != null) {
            builder.max(max);
        }
        if (integer != null) {
            builder.integer(integer);
        }
        if (pattern != null) {
            builder.pattern(pattern);
        }
        if (trim != null) {
            builder.trim(trim);
        }
        if (allowHebrew != null) {
            builder.allowHebrew(allowHebrew);
        }
        if (sanitizeBiDi != null) {
            builder.sanitizeBiDi(sanitizeBiDi);
        }
        if (properties != null) {
            builder.properties(toSchema(properties));
        }
        return builder.build();
    }

    /**
     * Converts a map of field rules to a ValidationSchema, keeping declaration order.
     */
    public static ValidationSchema toSchema(Map<String, FieldRuleDto> rules) {
        final var schema = ValidationSchema.builder();
        rules.forEach((name, rule) -> {
            if (rule == null) {
                throw new IllegalArgumentException("Missing rule for field: " + name);
            }
            schema.field(name, rule.toModel());
        });
        return schema.build();
    }
}
