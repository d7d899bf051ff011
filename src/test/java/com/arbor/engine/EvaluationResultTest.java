package com.arbor.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.arbor.tree.Leaf;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationResultTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Serializes with decision, reason and path_taken only")
    void serializesToJson() throws Exception {
        EvaluationResult result = EvaluationResult.decided(Leaf.parse("Declined - Credit score too low"),
                List.of("Checked credit score: 600 < 640 -> matched"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

        assertEquals("Declined", json.get("decision").asText());
        assertEquals("Credit score too low", json.get("reason").asText());
        assertEquals("Checked credit score: 600 < 640 -> matched", json.get("path_taken").get(0).asText());
        assertEquals(3, json.size());
        assertFalse(json.has("error"));
    }

    @Test
    @DisplayName("Reads back from its JSON form")
    void deserializesFromJson() throws Exception {
        String json = "{\"decision\":\"Error\",\"reason\":\"r\",\"path_taken\":[\"a\",\"b\"]}";

        EvaluationResult result = objectMapper.readValue(json, EvaluationResult.class);

        assertTrue(result.isError());
        assertEquals(List.of("a", "b"), result.pathTaken());
    }

    @Test
    @DisplayName("Path is copied and immutable")
    void pathIsImmutableCopy() {
        List<String> path = new ArrayList<>(List.of("one"));
        EvaluationResult result = EvaluationResult.error("stopped", path);
        path.add("two");

        assertEquals(List.of("one"), result.pathTaken());
        assertThrows(UnsupportedOperationException.class, () -> result.pathTaken().add("three"));
    }

    @Test
    @DisplayName("Null path becomes empty")
    void nullPath() {
        assertTrue(new EvaluationResult("Approved", "ok", null).pathTaken().isEmpty());
        assertFalse(new EvaluationResult("Approved", "ok", null).isError());
    }
}
