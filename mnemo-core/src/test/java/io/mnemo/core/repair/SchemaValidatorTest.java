package io.mnemo.core.repair;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mnemo.core.Fixtures;
import io.mnemo.core.model.ExtractionResult;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void shouldRevalidateSerializedResultToSameStructure() throws Exception {
        ExtractionResult first = validator.validate(mapper.readTree(Fixtures.VALID_RESPONSE), Fixtures.SCHEMA).result();

        JsonNode serialized = mapper.readTree(mapper.writeValueAsString(first));
        ValidationResult second = validator.validate(serialized, Fixtures.SCHEMA);

        assertThat(second.valid()).isTrue();
        assertThat(second.result()).isEqualTo(first);
    }

    @Test
    void shouldDropUnknownFields() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree(Fixtures.VALID_RESPONSE);
        ((ObjectNode) root.path("memories").get(0)).put("mood", "sunny");
        root.put("debug", true);

        ValidationResult result = validator.validate(root, Fixtures.SCHEMA);

        assertThat(result.valid()).isTrue();
        assertThat(mapper.writeValueAsString(result.result())).doesNotContain("sunny").doesNotContain("debug");
    }

    @Test
    void shouldRejectOutOfRangeValues() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree(Fixtures.VALID_RESPONSE);
        ObjectNode memory = (ObjectNode) root.path("memories").get(0);
        memory.put("confidence", 1.5);
        ((ObjectNode) memory.path("emotionalContext")).put("valence", -2);
        memory.put("content", "short");

        ValidationResult result = validator.validate(root, Fixtures.SCHEMA);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
            .anyMatch(error -> error.contains("confidence"))
            .anyMatch(error -> error.contains("valence"))
            .anyMatch(error -> error.contains("content length"));
    }

    @Test
    void shouldRejectUnknownSignificanceComponentAndRelationshipKey() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree(Fixtures.VALID_RESPONSE);
        ObjectNode memory = (ObjectNode) root.path("memories").get(0);
        ((ObjectNode) memory.path("significance").path("components")).put("vibes", 3);
        ((ObjectNode) memory.path("relationshipDynamics")).put("favourite_colour", "blue");

        ValidationResult result = validator.validate(root, Fixtures.SCHEMA);

        assertThat(result.errors())
            .anyMatch(error -> error.contains("unknown key vibes"))
            .anyMatch(error -> error.contains("unknown key favourite_colour"));
    }

    @Test
    void shouldRequireBetweenOneAndTenMemories() throws Exception {
        ValidationResult empty = validator.validate(
            mapper.readTree("{\"schemaVersion\": \"" + Fixtures.SCHEMA + "\", \"memories\": []}"),
            Fixtures.SCHEMA
        );

        assertThat(empty.valid()).isFalse();
    }
}
