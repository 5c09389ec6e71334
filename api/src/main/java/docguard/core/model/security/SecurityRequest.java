package docguard.core.model.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import docguard.core.model.validation.ValidationSchema;

/**
 * A document generation request entering the validation pipeline.
 *
 * @param clientId         identifier used for rate limiting and memory accounting
 * @param templatePath     the template the caller wants filled
 * @param fieldData        untyped field values; may contain nested maps and lists
 * @param requestSize      declared size of the document in bytes
 * @param requestId        caller-supplied correlation id (may be null)
 * @param schema           schema to validate {@code fieldData} against (may be null)
 * @param expectedChecksum trusted template checksum supplied by the caller (may be null)
 */
public record SecurityRequest(
        String clientId,
        String templatePath,
        Map<String, Object> fieldData,
        long requestSize,
        String requestId,
        ValidationSchema schema,
        String expectedChecksum) {

    public SecurityRequest {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(templatePath, "templatePath must not be null");
        if (requestSize < 0) {
            throw new IllegalArgumentException("requestSize must be non-negative");
        }
        fieldData = fieldData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldData));
    }

    /**
     * Create a request without schema, correlation id or checksum.
     *
     * @param clientId     the client identifier
     * @param templatePath the template path
     * @param fieldData    the field values
     * @param requestSize  declared size in bytes
     * @return the request
     */
    public static SecurityRequest of(
            String clientId, String templatePath, Map<String, Object> fieldData, long requestSize) {
        return new SecurityRequest(clientId, templatePath, fieldData, requestSize, null, null, null);
    }

    public SecurityRequest withSchema(ValidationSchema schema) {
        return new SecurityRequest(clientId, templatePath, fieldData, requestSize, requestId, schema, expectedChecksum);
    }

    public SecurityRequest withRequestId(String requestId) {
        return new SecurityRequest(clientId, templatePath, fieldData, requestSize, requestId, schema, expectedChecksum);
    }

    public SecurityRequest withExpectedChecksum(String expectedChecksum) {
        return new SecurityRequest(clientId, templatePath, fieldData, requestSize, requestId, schema, expectedChecksum);
    }

    public Optional<ValidationSchema> schemaOpt() {
        return Optional.ofNullable(schema);
    }

    public Optional<String> expectedChecksumOpt() {
        return Optional.ofNullable(expectedChecksum).filter(s -> !s.isBlank());
    }
}
