package com.arbor.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for creating EvaluationContext from a JSON object of inputs, as supplied by
 * tool-call callers. Field order in the document becomes the context's iteration order.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z").
 */
public class EvaluationContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private EvaluationContextFactory() {
    }

    /**
     * Create an EvaluationContext from a JSON object.
     *
     * @param json JSON object whose fields are the named inputs
     * @return EvaluationContext with parsed inputs (empty for blank input)
     */
    public static EvaluationContext fromJson(String json) {
        EvaluationContext.Builder builder = EvaluationContext.builder();
        if (json != null && !json.isBlank()) {
            Map<String, Object> parsed = parseJson(json);
            builder.inputs(flatten(parsed));
        }
        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            if (parsed == null) {
                throw new IllegalArgumentException("Invalid JSON inputs: expected an object");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON inputs: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else {
                // Lists are kept whole for membership checks
                result.put(key, value);
            }
        }
    }
}
