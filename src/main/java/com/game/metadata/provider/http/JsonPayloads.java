package com.game.metadata.provider.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.game.metadata.provider.MetadataProviderException;

import java.util.ArrayList;
import java.util.List;

/**
 * Null-tolerant reads from untrusted JSON payloads.
 */
public final class JsonPayloads {

    public static final int MAX_RAW_PAYLOAD_LENGTH = 5000;

    private JsonPayloads() {
        // Utility class
    }

    /**
     * Parses a response body.
     *
     * @throws MetadataProviderException if the body is not valid JSON
     */
    public static JsonNode parse(ObjectMapper mapper, String providerId, String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MetadataProviderException(providerId, "Malformed JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T read(ObjectMapper mapper, String providerId, String body, Class<T> type) {
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new MetadataProviderException(providerId, "Malformed JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (isAbsent(value)) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    public static Integer integer(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (isAbsent(value) || !(value.isNumber() || value.isTextual())) {
            return null;
        }
        if (value.isNumber()) {
            return value.intValue();
        }
        try {
            return Integer.parseInt(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double decimal(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return isAbsent(value) || !value.isNumber() ? null : value.doubleValue();
    }

    public static boolean flag(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return !isAbsent(value) && value.asBoolean(false);
    }

    /**
     * Collects the text of {@code field} from each element of an array, or the elements
     * themselves when {@code field} is null.
     */
    public static List<String> texts(JsonNode array, String field) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode element : array) {
            String value = field == null
                    ? (element.isValueNode() ? element.asText() : null)
                    : text(element, field);
            if (value != null && !value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }

    public static String snippet(String body) {
        if (body == null) {
            return null;
        }
        return body.length() <= MAX_RAW_PAYLOAD_LENGTH ? body : body.substring(0, MAX_RAW_PAYLOAD_LENGTH);
    }
}
