package docguard.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import docguard.core.model.audit.AuditLogEntry;

/**
 * DTO for an audit trail entry returned by the audit query endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEntryDto(
        String timestamp,
        String level,
        String action,
        String message,
        String machineId,
        Map<String, Object> metadata,
        String documentHash,
        String userId,
        String ipAddress,
        Boolean success,
        String clientId) {

    public static AuditEntryDto fromModel(AuditLogEntry entry) {
        return new AuditEntryDto(
                entry.timestamp() == null ? null : entry.timestamp().toString(),
                entry.level().name(),
                entry.action(),
                entry.message(),
                entry.machineId(),
                entry.metadata() == null ? null : entry.metadata().toPlain(),
                entry.documentHash(),
                entry.userId(),
                entry.ipAddress(),
                entry.success(),
                entry.clientId());
    }
}
