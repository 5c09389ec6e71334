package docguard.adapter.in.dto;

import java.util.Map;

import docguard.core.model.security.SecurityRequest;

/**
 * DTO for document validation requests.
 *
 * @param clientId         client identifier (required)
 * @param templatePath     template to fill (required)
 * @param fieldData        field values, possibly nested
 * @param requestSize      declared document size in bytes (required)
 * @param requestId        optional correlation id
 * @param schema           optional per-field rules
 * @param expectedChecksum optional trusted template checksum
 */
public record ValidateRequestDto(
        String clientId,
        String templatePath,
        Map<String, Object> fieldData,
        Long requestSize,
        String requestId,
        Map<String, FieldRuleDto> schema,
        String expectedChecksum) {

    /**
     * Converts this DTO to a SecurityRequest model.
     *
     * @throws IllegalArgumentException when a required member is missing or the schema is invalid
     */
    public SecurityRequest toModel() {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        if (templatePath == null) {
            throw new IllegalArgumentException("templatePath is required");
        }
        if (requestSize == null) {
            throw new IllegalArgumentException("requestSize is required");
        }
        return new SecurityRequest(
                clientId,
                templatePath,
                fieldData,
                requestSize,
                requestId,
                schema == null ? null : FieldRuleDto.toSchema(schema),
                expectedChecksum);
    }
}
