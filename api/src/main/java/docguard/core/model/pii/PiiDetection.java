package docguard.core.model.pii;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of scanning text for personally identifying data.
 *
 * @param detected whether anything was found
 * @param types    the kinds found in declaration order, empty when nothing was
 */
public record PiiDetection(boolean detected, Set<PiiType> types) {

    private static final PiiDetection NONE = new PiiDetection(false, Set.of());

    public PiiDetection {
        types = types.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(types));
    }

    public static PiiDetection none() {
        return NONE;
    }

    public static PiiDetection of(Set<PiiType> types) {
        return types.isEmpty() ? NONE : new PiiDetection(true, types);
    }
}
