package br.edu.ifba.scholargraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.exception.ExtractionParseException;

/**
 * Turns raw model output into typed extraction candidates.
 *
 * <p>Accepts a bare JSON object or one wrapped in a fenced {@code ```json} block.
 * Anything that does not have the expected shape fails with
 * {@link ExtractionParseException}; values are never coerced from another type.</p>
 */
public final class ExtractionResponseParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");

    private ExtractionResponseParser() {
    }

    public static List<ExtractedEntity> parseEntities(@NotNull String content) {
        JsonNode items = readArray(content, "entities");
        List<ExtractedEntity> entities = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = requireObject(items.get(i), "entities", i);
            String name = requireText(item, "name", "entities", i);
            String kindValue = requireText(item, "type", "entities", i);
            NodeKind kind = NodeKind.fromValue(kindValue)
                .orElseThrow(() -> new ExtractionParseException("Unknown entity type '" + kindValue + "'"));

            entities.add(new ExtractedEntity(
                name,
                kind,
                optionalText(item, "description", "entities", i),
                confidence(item, "entities", i),
                optionalText(item, "context", "entities", i),
                metadata(item, "entities", i)
            ));
        }
        return entities;
    }

    public static List<ExtractedRelationship> parseRelationships(@NotNull String content) {
        JsonNode items = readArray(content, "relationships");
        List<ExtractedRelationship> relationships = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = requireObject(items.get(i), "relationships", i);
            String source = requireText(item, "source", "relationships", i);
            String target = requireText(item, "target", "relationships", i);
            String kindValue = requireText(item, "type", "relationships", i);
            EdgeKind kind = EdgeKind.fromValue(kindValue)
                .orElseThrow(() -> new ExtractionParseException("Unknown relationship type '" + kindValue + "'"));

            relationships.add(new ExtractedRelationship(
                source,
                target,
                kind,
                optionalText(item, "description", "relationships", i),
                optionalText(item, "evidence", "relationships", i),
                confidence(item, "relationships", i),
                metadata(item, "relationships", i)
            ));
        }
        return relationships;
    }

    /**
     * Returns the body of the first fenced code block, or the trimmed content
     * when there is none.
     */
    static String unwrap(String content) {
        Matcher matcher = FENCED_BLOCK.matcher(content);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return content.trim();
    }

    private static JsonNode readArray(String content, String field) {
        if (content == null || content.isBlank()) {
            throw new ExtractionParseException("Empty response, expected an object with '" + field + "'");
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(unwrap(content));
        } catch (JsonProcessingException e) {
            throw new ExtractionParseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new ExtractionParseException("Response must be a JSON object with '" + field + "'");
        }
        JsonNode items = root.get(field);
        if (items == null || !items.isArray()) {
            throw new ExtractionParseException("Missing '" + field + "' array");
        }
        return items;
    }

    private static JsonNode requireObject(JsonNode item, String field, int index) {
        if (!item.isObject()) {
            throw new ExtractionParseException(field + "[" + index + "] is not an object");
        }
        return item;
    }

    private static String requireText(JsonNode item, String name, String field, int index) {
        JsonNode value = item.get(name);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ExtractionParseException(field + "[" + index + "]." + name + " must be a non-empty string");
        }
        return value.asText().trim();
    }

    @Nullable
    private static String optionalText(JsonNode item, String name, String field, int index) {
        JsonNode value = item.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ExtractionParseException(field + "[" + index + "]." + name + " must be a string");
        }
        return value.asText();
    }

    private static double confidence(JsonNode item, String field, int index) {
        JsonNode value = item.get("confidence");
        if (value == null || value.isNull()) {
            return Confidence.DEFAULT;
        }
        if (!value.isNumber()) {
            throw new ExtractionParseException(field + "[" + index + "].confidence must be a number");
        }
        return Confidence.clamp(value.asDouble());
    }

    private static Map<String, Object> metadata(JsonNode item, String field, int index) {
        JsonNode value = item.get("metadata");
        if (value == null || value.isNull()) {
            return Map.of();
        }
        if (!value.isObject()) {
            throw new ExtractionParseException(field + "[" + index + "].metadata must be an object");
        }
        Map<String, Object> metadata = OBJECT_MAPPER.convertValue(value, new TypeReference<Map<String, Object>>() {});
        // Map.copyOf downstream rejects null values
        metadata.values().removeIf(v -> v == null);
        return metadata;
    }
}
