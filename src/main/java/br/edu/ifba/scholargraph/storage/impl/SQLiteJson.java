package br.edu.ifba.scholargraph.storage.impl;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import br.edu.ifba.exception.PersistenceException;

/**
 * JSON and timestamp column helpers shared by the SQLite stores.
 */
final class SQLiteJson {

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private SQLiteJson() {
    }

    /**
     * Serializes metadata, dropping null values so they never erase stored keys.
     */
    static String writeMetadata(Map<String, Object> metadata) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (key != null && value != null) {
                    cleaned.put(key, value);
                }
            });
        }
        return write(cleaned);
    }

    static Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt metadata column: " + json, e);
        }
    }

    static String writeList(List<String> values) {
        return write(values == null ? List.of() : values);
    }

    static List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return OBJECT_MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt list column: " + json, e);
        }
    }

    /**
     * Shallow union of two JSON objects. Top-level keys of {@code incoming}
     * overwrite those of {@code stored}; null incoming values are ignored.
     */
    static String mergeMetadata(String stored, String incoming) throws JsonProcessingException {
        ObjectNode merged = asObject(stored);
        ObjectNode patch = asObject(incoming);

        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                merged.set(field.getKey(), field.getValue());
            }
        }
        return OBJECT_MAPPER.writeValueAsString(merged);
    }

    static String timestamp(Instant instant) {
        return instant.toString();
    }

    /**
     * Parses either ISO-8601 instants written by the stores or SQLite
     * {@code datetime('now')} defaults.
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return Instant.parse(value.replace(" ", "T") + "Z");
        }
    }

    private static ObjectNode asObject(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return OBJECT_MAPPER.createObjectNode();
        }
        JsonNode node = OBJECT_MAPPER.readTree(json);
        return node instanceof ObjectNode objectNode ? objectNode : OBJECT_MAPPER.createObjectNode();
    }

    private static String write(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize JSON column", e);
        }
    }
}
