package docguard.core.model.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable audit trail record, written as a single JSON line.
 *
 * <p>{@code timestamp} and {@code machineId} are stamped by the logger when the caller
 * leaves them empty. All other optional components may be null.
 *
 * @param timestamp   when the entry was generated
 * @param level       severity
 * @param action      stable action identifier ({@code request_validated}, {@code auth_attempt}, ...)
 * @param message     human-readable description
 * @param machineId   anonymous identifier of the writing instance
 * @param metadata    structured context
 * @param documentHash hex digest of an accessed document
 * @param userId      acting user
 * @param ipAddress   remote address
 * @param success     outcome of an authentication or operation
 * @param clientId    rate limited client
 */
public record AuditLogEntry(
        Instant timestamp,
        AuditLevel level,
        String action,
        String message,
        String machineId,
        AuditMetadata.Nested metadata,
        String documentHash,
        String userId,
        String ipAddress,
        Boolean success,
        String clientId) {

    public AuditLogEntry {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(message, "message");
    }

    public static Builder builder(AuditLevel level, String action, String message) {
        return new Builder(level, action, message);
    }

    /**
     * Shorthand for an entry carrying only level, action, message and metadata.
     *
     * @param level    the level
     * @param action   the action
     * @param message  the message
     * @param metadata loosely typed metadata (may be null)
     * @return the entry
     */
    public static AuditLogEntry of(AuditLevel level, String action, String message, Map<String, ?> metadata) {
        return builder(level, action, message).metadata(metadata).build();
    }

    /**
     * Fill in generation time and machine id where the caller did not provide them.
     *
     * @param now       generation time
     * @param machineId writing instance
     * @return the stamped entry
     */
    public AuditLogEntry stamp(Instant now, String machineId) {
        return new AuditLogEntry(
                timestamp != null ? timestamp : now,
                level,
                action,
                message,
                this.machineId != null ? this.machineId : machineId,
                metadata,
                documentHash,
                userId,
                ipAddress,
                success,
                clientId);
    }

    /**
     * Builder for {@link AuditLogEntry}.
     */
    public static final class Builder {

        private final AuditLevel level;
        private final String action;
        private final String message;
        private Instant timestamp;
        private String machineId;
        private AuditMetadata.Nested metadata;
        private String documentHash;
        private String userId;
        private String ipAddress;
        private Boolean success;
        private String clientId;

        private Builder(AuditLevel level, String action, String message) {
            this.level = level;
            this.action = action;
            this.message = message;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder machineId(String machineId) {
            this.machineId = machineId;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = AuditMetadata.from(metadata);
            return this;
        }

        public Builder metadata(AuditMetadata.Nested metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder documentHash(String documentHash) {
            this.documentHash = documentHash;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder success(Boolean success) {
            this.success = success;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public AuditLogEntry build() {
            return new AuditLogEntry(
                    timestamp,
                    level,
                    action,
                    message,
                    machineId,
                    metadata,
                    documentHash,
                    userId,
                    ipAddress,
                    success,
                    clientId);
        }
    }
}
