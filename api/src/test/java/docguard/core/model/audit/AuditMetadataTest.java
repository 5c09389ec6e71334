package docguard.core.model.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditMetadata")
class AuditMetadataTest {

    @Test
    @DisplayName("should convert scalars, lists and nested maps")
    void shouldConvertTree() {
        var source = new LinkedHashMap<String, Object>();
        source.put("field", "name");
        source.put("length", 12);
        source.put("trimmed", true);
        source.put("errors", List.of(Map.of("code", "TOO_LONG")));

        var metadata = AuditMetadata.from(source);

        assertEquals(new AuditMetadata.Text("name"), metadata.fields().get("field"));
        assertEquals(new AuditMetadata.Numeric(12), metadata.fields().get("length"));
        assertEquals(new AuditMetadata.Flag(true), metadata.fields().get("trimmed"));
        assertEquals(source, metadata.toPlain());
    }

    @Test
    @DisplayName("should keep insertion order")
    void shouldKeepOrder() {
        var source = new LinkedHashMap<String, Object>();
        source.put("z", 1);
        source.put("a", 2);
        source.put("m", 3);

        assertEquals(List.of("z", "a", "m"), new ArrayList<>(AuditMetadata.from(source).fields().keySet()));
    }

    @Test
    @DisplayName("should drop null values and stringify unknown objects")
    void shouldDropNullsAndStringify() {
        var source = new HashMap<String, Object>();
        source.put("missing", null);
        source.put("path", java.nio.file.Path.of("a", "b"));
        var list = new ArrayList<Object>();
        list.add(null);
        list.add("x");
        source.put("list", list);

        var metadata = AuditMetadata.from(source);

        assertFalse(metadata.fields().containsKey("missing"));
        assertEquals(new AuditMetadata.Text(java.nio.file.Path.of("a", "b").toString()), metadata.fields().get("path"));
        assertEquals(List.of("x"), metadata.fields().get("list").toPlain());
    }

    @Test
    @DisplayName("should replace a self-referencing tree with the circular marker")
    void shouldMarkCircularReference() {
        var source = new HashMap<String, Object>();
        source.put("self", source);

        assertEquals(AuditMetadata.circularReferenceMarker(), AuditMetadata.from(source));
        assertEquals(Map.of("error", AuditMetadata.CIRCULAR_REFERENCE), AuditMetadata.from(source).toPlain());
    }

    @Test
    @DisplayName("should allow the same object in sibling branches")
    void shouldAllowSharedSiblings() {
        var shared = Map.of("k", "v");
        var source = new LinkedHashMap<String, Object>();
        source.put("left", shared);
        source.put("right", shared);

        assertEquals(Map.of("left", shared, "right", shared), AuditMetadata.from(source).toPlain());
    }

    @Test
    @DisplayName("should return null for a null source")
    void shouldReturnNullForNull() {
        assertNull(AuditMetadata.from(null));
    }
}
