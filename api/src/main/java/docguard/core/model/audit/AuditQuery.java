package docguard.core.model.audit;

import java.time.Instant;

/**
 * Filter for {@code AuditLogger.query}. Null components match everything.
 *
 * @param from   inclusive lower bound on the entry timestamp
 * @param to     inclusive upper bound on the entry timestamp
 * @param action exact action to match
 * @param level  exact level to match
 */
public record AuditQuery(Instant from, Instant to, String action, AuditLevel level) {

    private static final AuditQuery ALL = new AuditQuery(null, null, null, null);

    public static AuditQuery all() {
        return ALL;
    }

    public static AuditQuery forAction(String action) {
        return new AuditQuery(null, null, action, null);
    }

    public static AuditQuery forLevel(AuditLevel level) {
        return new AuditQuery(null, null, null, level);
    }

    public AuditQuery between(Instant from, Instant to) {
        return new AuditQuery(from, to, action, level);
    }

    /**
     * Whether an entry passes this filter. Entries without a timestamp are not excluded by the time bounds.
     *
     * @param entry the entry
     * @return true if the entry matches
     */
    public boolean matches(AuditLogEntry entry) {
        final var ts = entry.timestamp();
        if (from != null && ts != null && ts.isBefore(from)) {
            return false;
        }
        if (to != null && ts != null && ts.isAfter(to)) {
            return false;
        }
        if (action != null && !action.equals(entry.action())) {
            return false;
        }
        return level == null || level == entry.level();
    }
}
