package docguard.core.model.validation;

import java.util.Locale;

/**
 * Value types a {@link FieldRule} can require.
 */
public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    EMAIL,
    URL,
    ARRAY,
    OBJECT;

    /**
     * Whether values of this type are strings and take the string constraints.
     *
     * @return true for {@code STRING}, {@code EMAIL} and {@code URL}
     */
    public boolean isTextual() {
        return this == STRING || this == EMAIL || this == URL;
    }

    /**
     * Parse a type name as written in JSON schema definitions ({@code "string"}, {@code "email"}, ...).
     *
     * @param name the type name
     * @return the type
     * @throws IllegalArgumentException for unsupported names
     */
    public static FieldType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field type is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported field type: " + name, e);
        }
    }
}
