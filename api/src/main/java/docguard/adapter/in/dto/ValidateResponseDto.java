package docguard.adapter.in.dto;

import java.util.Map;

import docguard.core.model.security.SecurityResult;

/**
 * DTO for an allowed validation result.
 *
 * @param allowed       always true; rejections are returned as problem responses
 * @param sanitizedData cleaned field data
 * @param allocation    memory allocation token the caller must release when done
 */
public record ValidateResponseDto(boolean allowed, Map<String, Object> sanitizedData, String allocation) {

    public static ValidateResponseDto fromModel(SecurityResult result) {
        return new ValidateResponseDto(
                result.allowed(),
                result.sanitizedData(),
                result.allocation() == null ? null : result.allocation().value());
    }
}
