package docguard.adapter.out.audit;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import docguard.core.model.audit.AuditLevel;
import docguard.core.model.audit.AuditLogEntry;
import docguard.core.model.audit.AuditMetadata;

/**
 * Converts audit entries to and from single-line JSON.
 *
 * <p>Absent optional components are omitted from the output. Decoding is lenient about
 * unknown properties but rejects lines missing {@code level}, {@code action} or
 * {@code message}.
 */
final class AuditEntryCodec {

    private final ObjectMapper mapper;

    AuditEntryCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String encode(AuditLogEntry entry) {
        final var node = mapper.createObjectNode();
        if (entry.timestamp() != null) {
            node.put("timestamp", entry.timestamp().toString());
        }
        node.put("level", entry.level().name());
        node.put("action", entry.action());
        node.put("message", entry.message());
        putIfPresent(node, "machineId", entry.machineId());
        if (entry.metadata() != null) {
            node.set("metadata", toJson(entry.metadata()));
        }
        putIfPresent(node, "documentHash", entry.documentHash());
        putIfPresent(node, "userId", entry.userId());
        putIfPresent(node, "ipAddress", entry.ipAddress());
        if (entry.success() != null) {
            node.put("success", entry.success());
        }
        putIfPresent(node, "clientId", entry.clientId());
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // a tree of plain nodes always serializes
            throw new IllegalStateException("Failed to serialize audit entry", e);
        }
    }

    /**
     * Parse one line.
     *
     * @param line the line
     * @return the entry, or empty if the line is not a valid entry
     */
    Optional<AuditLogEntry> decode(String line) {
        final JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        final var level = text(node, "level");
        final var action = text(node, "action");
        final var message = text(node, "message");
        if (level == null || action == null || message == null) {
            return Optional.empty();
        }
        try {
            final var builder = AuditLogEntry.builder(AuditLevel.valueOf(level), action, message)
                    .machineId(text(node, "machineId"))
                    .documentHash(text(node, "documentHash"))
                    .userId(text(node, "userId"))
                    .ipAddress(text(node, "ipAddress"))
                    .clientId(text(node, "clientId"));
            final var timestamp = text(node, "timestamp");
            if (timestamp != null) {
                builder.timestamp(Instant.parse(timestamp));
            }
            final var success = node.get("success");
            if (success != null && success.isBoolean()) {
                builder.success(success.booleanValue());
            }
            final var metadata = node.get("metadata");
            if (metadata != null && metadata.isObject()) {
                builder.metadata((AuditMetadata.Nested) fromJson(metadata));
            }
            return Optional.of(builder.build());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private JsonNode toJson(AuditMetadata metadata) {
        if (metadata instanceof AuditMetadata.Text text) {
            return mapper.getNodeFactory().textNode(text.value());
        }
        if (metadata instanceof AuditMetadata.Numeric numeric) {
            return mapper.valueToTree(numeric.value());
        }
        if (metadata instanceof AuditMetadata.Flag flag) {
            return mapper.getNodeFactory().booleanNode(flag.value());
        }
        if (metadata instanceof AuditMetadata.Sequence sequence) {
            final var array = mapper.createArrayNode();
            sequence.values().forEach(v -> array.add(toJson(v)));
            return array;
        }
        final var object = mapper.createObjectNode();
        ((AuditMetadata.Nested) metadata).fields().forEach((k, v) -> object.set(k, toJson(v)));
        return object;
    }

    private static AuditMetadata fromJson(JsonNode node) {
        if (node.isObject()) {
            final var fields = new LinkedHashMap<String, AuditMetadata>();
            node.fields().forEachRemaining(e -> {
                if (!e.getValue().isNull()) {
                    fields.put(e.getKey(), fromJson(e.getValue()));
                }
            });
            return new AuditMetadata.Nested(fields);
        }
        if (node.isArray()) {
            final var values = new ArrayList<AuditMetadata>();
            node.forEach(v -> {
                if (!v.isNull()) {
                    values.add(fromJson(v));
                }
            });
            return new AuditMetadata.Sequence(values);
        }
        if (node.isNumber()) {
            return new AuditMetadata.Numeric(node.numberValue());
        }
        if (node.isBoolean()) {
            return new AuditMetadata.Flag(node.booleanValue());
        }
        return new AuditMetadata.Text(node.asText());
    }

    private static String text(JsonNode node, String field) {
        final var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
