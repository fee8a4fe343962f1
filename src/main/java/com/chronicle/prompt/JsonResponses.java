package com.chronicle.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient JSON reading for model output: strips markdown fences and leading
 * prose, and tolerates unquoted keys, single quotes and trailing commas.
 */
public final class JsonResponses {

    private static final Logger log = LoggerFactory.getLogger(JsonResponses.class);

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private static final JsonMapper LENIENT = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .build();

    private JsonResponses() {
    }

    /**
     * Reads the first JSON object or array in {@code response}.
     */
    public static Optional<JsonNode> read(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String json = extract(response.trim());
        try {
            return Optional.ofNullable(LENIENT.readTree(json));
        } catch (JsonProcessingException ex) {
            log.debug("Response is not JSON: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Reads the first JSON object; arrays and scalars are empty. */
    public static Optional<JsonNode> readObject(String response) {
        return read(response).filter(JsonNode::isObject);
    }

    static String extract(String text) {
        Matcher fence = FENCE.matcher(text);
        String body = fence.find() ? fence.group(1).trim() : text;

        int object = body.indexOf('{');
        int array = body.indexOf('[');
        if (object < 0 && array < 0) {
            return body;
        }
        boolean objectFirst = array < 0 || (object >= 0 && object < array);
        int start = objectFirst ? object : array;
        int end = body.lastIndexOf(objectFirst ? '}' : ']');
        return end > start ? body.substring(start, end + 1) : body.substring(start);
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    public static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return "true".equalsIgnoreCase(value.asText().trim());
    }

    public static int integer(JsonNode node, String field, int fallback) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.intValue();
        }
        try {
            return Integer.parseInt(value.asText().trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    public static List<String> strings(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        List<String> result = new ArrayList<>();
        if (value == null || !value.isArray()) {
            return result;
        }
        for (JsonNode item : value) {
            if (item.isTextual() && !item.asText().isBlank()) {
                result.add(item.asText().trim());
            }
        }
        return result;
    }

    public static List<JsonNode> objects(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        List<JsonNode> result = new ArrayList<>();
        if (value == null || !value.isArray()) {
            return result;
        }
        for (JsonNode item : value) {
            if (item.isObject()) {
                result.add(item);
            }
        }
        return result;
    }
}
