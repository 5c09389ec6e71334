package docguard.core.model.audit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Serializable metadata value attached to an audit entry.
 *
 * <p>The variants are closed, so every metadata tree can be written as JSON. Arbitrary
 * caller objects are converted with {@link #from(Map)}; a tree that refers back to itself
 * is replaced with an error marker instead of failing the log call.
 */
public sealed interface AuditMetadata {

    String CIRCULAR_REFERENCE = "Circular reference detected";

    /**
     * Unwrap into plain JDK values: strings, numbers, booleans, lists and maps.
     *
     * @return the plain value
     */
    Object toPlain();

    /** A string value. */
    record Text(String value) implements AuditMetadata {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    /** A numeric value. */
    record Numeric(Number value) implements AuditMetadata {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    /** A boolean value. */
    record Flag(boolean value) implements AuditMetadata {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    /** An ordered list of values. */
    record Sequence(List<AuditMetadata> values) implements AuditMetadata {
        public Sequence {
            values = List.copyOf(values);
        }

        @Override
        public List<Object> toPlain() {
            return values.stream().map(AuditMetadata::toPlain).toList();
        }
    }

    /** A nested object; keys keep insertion order. */
    record Nested(Map<String, AuditMetadata> fields) implements AuditMetadata {
        public Nested {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Map<String, Object> toPlain() {
            final var plain = new LinkedHashMap<String, Object>();
            fields.forEach((k, v) -> plain.put(k, v.toPlain()));
            return plain;
        }
    }

    static AuditMetadata text(String value) {
        return new Text(value);
    }

    static AuditMetadata number(Number value) {
        return new Numeric(value);
    }

    static AuditMetadata flag(boolean value) {
        return new Flag(value);
    }

    /**
     * Marker substituted for metadata that cannot be represented.
     *
     * @return {@code {"error": "Circular reference detected"}}
     */
    static Nested circularReferenceMarker() {
        return new Nested(Map.of("error", new Text(CIRCULAR_REFERENCE)));
    }

    /**
     * Convert a loosely typed map into metadata.
     *
     * <p>Strings, numbers and booleans map to their variants, maps and collections recurse,
     * {@code null} values are dropped and anything else is recorded by its {@code toString()}.
     *
     * @param source the map to convert (may be null)
     * @return the converted tree, the circular reference marker, or null for a null source
     */
    static Nested from(Map<String, ?> source) {
        if (source == null) {
            return null;
        }
        try {
            return (Nested) convert(source, Collections.newSetFromMap(new IdentityHashMap<>()));
        } catch (CircularReferenceException e) {
            return circularReferenceMarker();
        }
    }

    private static AuditMetadata convert(Object value, Set<Object> path) {
        if (value instanceof AuditMetadata metadata) {
            return metadata;
        }
        if (value instanceof CharSequence s) {
            return new Text(s.toString());
        }
        if (value instanceof Number n) {
            return new Numeric(n);
        }
        if (value instanceof Boolean b) {
            return new Flag(b);
        }
        if (value instanceof Map<?, ?> map) {
            if (!path.add(map)) {
                throw new CircularReferenceException();
            }
            final var fields = new LinkedHashMap<String, AuditMetadata>();
            for (final var e : map.entrySet()) {
                if (e.getValue() != null) {
                    fields.put(String.valueOf(e.getKey()), convert(e.getValue(), path));
                }
            }
            path.remove(map);
            return new Nested(fields);
        }
        if (value instanceof Collection<?> collection) {
            if (!path.add(collection)) {
                throw new CircularReferenceException();
            }
            final var values = new ArrayList<AuditMetadata>(collection.size());
            for (final var item : collection) {
                if (item != null) {
                    values.add(convert(item, path));
                }
            }
            path.remove(collection);
            return new Sequence(values);
        }
        return new Text(String.valueOf(value));
    }

    /**
     * Signals a self-referencing metadata tree during conversion.
     */
    final class CircularReferenceException extends RuntimeException {
        CircularReferenceException() {
            super(CIRCULAR_REFERENCE, null, false, false);
        }
    }
}
