package com.eainde.admission.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Parses JSON objects out of model responses.
 */
public final class LlmJson {

    private LlmJson() {
    }

    /**
     * Removes markdown fences and any prose around the outermost JSON object.
     */
    public static String clean(String response) {
        if (response == null) {
            return "";
        }
        String json = response.replace("```json", "")
                .replace("```", "")
                .trim();
        int start = json.indexOf('{');
        int end = json.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return json.substring(start, end + 1);
        }
        return json;
    }

    /**
     * @return the parsed object, empty when the response holds no JSON object
     */
    public static Optional<JsonNode> parseObject(ObjectMapper mapper, String response) {
        String json = clean(response);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
