package io.github.drompincen.clarity.runtime.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient reading of the JSON objects models are asked to return.
 */
final class JsonResponses {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Pattern CODE_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private JsonResponses() {}

    static Optional<JsonNode> readObject(String response) {
        if (response == null || response.isBlank()) return Optional.empty();
        try {
            JsonNode node = OBJECT_MAPPER.readTree(extractJson(response));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** Body of the first fenced block if any, otherwise the span from the first '{' to the last '}'. */
    static String extractJson(String response) {
        Matcher fenced = CODE_BLOCK.matcher(response);
        String json = fenced.find() ? fenced.group(1).trim() : response.trim();
        if (!json.startsWith("{")) {
            int start = json.indexOf('{');
            int end = json.lastIndexOf('}');
            if (start != -1 && end > start) {
                json = json.substring(start, end + 1);
            }
        }
        return json;
    }

    static boolean booleanOr(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.booleanValue() : fallback;
    }

    static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }

    static List<String> stringList(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        JsonNode value = node.get(field);
        if (value != null && value.isArray()) {
            for (JsonNode item : value) {
                if (item.isTextual()) out.add(item.asText());
            }
        }
        return out;
    }

    /** Missing or non-numeric confidence reads as 0.5; values in (1, 100] are percentages. */
    static double confidence(JsonNode value) {
        if (value == null || !value.isNumber() || Double.isNaN(value.asDouble())) {
            return 0.5;
        }
        double raw = value.asDouble();
        if (raw > 1 && raw <= 100) {
            raw = raw / 100;
        }
        return Math.min(1, Math.max(0, raw));
    }

    static int depth(JsonNode value) {
        if (value == null || !value.isNumber()) return 1;
        double raw = value.asDouble();
        if (raw <= 1) return 1;
        if (raw >= 3) return 3;
        return 2;
    }

    static String head(String response) {
        return response.length() > 100 ? response.substring(0, 100) + "..." : response;
    }
}
