package docguard.core.model.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import docguard.core.model.memory.AllocationToken;

/**
 * Outcome of running a request through the validation pipeline.
 *
 * <p>An allowed result carries the sanitized field data and the memory allocation made
 * for the request. The caller owns that allocation and must release it once the document
 * has been produced. A rejected result never carries an allocation: everything committed
 * for it has already been released.
 *
 * @param allowed       whether the request may proceed
 * @param reason        short rejection reason (null when allowed)
 * @param sanitizedData Hebrew-sanitized, PII-redacted field data (null when rejected)
 * @param error         structured rejection details (null when allowed)
 * @param allocation    memory allocation handed to the caller (null when rejected)
 */
public record SecurityResult(
        boolean allowed,
        String reason,
        Map<String, Object> sanitizedData,
        SecurityError error,
        AllocationToken allocation) {

    /**
     * Create an allowed result.
     *
     * @param sanitizedData the cleaned field data
     * @param allocation    the allocation now owned by the caller
     * @return an allowed result
     */
    public static SecurityResult allowed(Map<String, Object> sanitizedData, AllocationToken allocation) {
        return new SecurityResult(
                true, null, Collections.unmodifiableMap(new LinkedHashMap<>(sanitizedData)), null, allocation);
    }

    /**
     * Create a rejected result.
     *
     * @param reason short reason
     * @param error  structured details
     * @return a rejected result
     */
    public static SecurityResult rejected(String reason, SecurityError error) {
        return new SecurityResult(false, reason, null, error, null);
    }

    public Optional<SecurityError> errorOpt() {
        return Optional.ofNullable(error);
    }
}
