package docguard.core.model.memory;

import java.util.Objects;

/**
 * Capability handle for one committed memory allocation.
 *
 * <p>Holding the token is the only way to release the allocation; the manager keeps the
 * actual accounting record.
 *
 * @param value opaque token value
 */
public record AllocationToken(String value) {

    public AllocationToken {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Allocation token must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
