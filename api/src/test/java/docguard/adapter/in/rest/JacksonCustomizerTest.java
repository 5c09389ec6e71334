package docguard.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import docguard.adapter.in.dto.ValidateRequestDto;

@DisplayName("JacksonCustomizer")
class JacksonCustomizerTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        new JacksonCustomizer().customize(mapper);
    }

    @Test
    @DisplayName("should reject a request naming the template twice")
    void shouldRejectDuplicateMembers() {
        var body = """
                {"clientId": "c1", "templatePath": "invoices/standard.docx", "templatePath": "../secret", "requestSize": 1}
                """;

        assertThrows(JsonProcessingException.class, () -> mapper.readValue(body, ValidateRequestDto.class));
    }

    @Test
    @DisplayName("should reject duplicate keys inside field data")
    void shouldRejectNestedDuplicates() {
        var body = """
                {"clientId": "c1", "templatePath": "t.docx", "requestSize": 1, "fieldData": {"a": 1, "a": 2}}
                """;

        assertThrows(JsonProcessingException.class, () -> mapper.readValue(body, ValidateRequestDto.class));
    }

    @Test
    @DisplayName("should not truncate fractional sizes")
    void shouldRejectFractionalSize() {
        var body = """
                {"clientId": "c1", "templatePath": "t.docx", "requestSize": 1.5}
                """;

        assertThrows(JsonProcessingException.class, () -> mapper.readValue(body, ValidateRequestDto.class));
    }

    @Test
    @DisplayName("should ignore unknown members")
    void shouldIgnoreUnknownMembers() throws Exception {
        var body = """
                {"clientId": "c1", "templatePath": "t.docx", "requestSize": 1024, "priority": "high"}
                """;

        var dto = mapper.readValue(body, ValidateRequestDto.class);

        assertEquals("c1", dto.clientId());
        assertEquals(1024L, dto.requestSize());
    }
}
