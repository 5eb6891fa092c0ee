package br.edu.ifba.scholargraph.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.exception.ExtractionParseException;

/**
 * Unit tests for {@link ExtractionResponseParser}.
 */
class ExtractionResponseParserTest {

    // ===== Entities =====

    @Nested
    @DisplayName("Entity responses")
    class EntityTests {

        @Test
        @DisplayName("Parses a fenced JSON block")
        void testParsesFencedBlock() {
            String content = """
                Here are the entities:
                ```json
                {"entities": [
                  {"name": "NeRF", "type": "method", "description": "Neural radiance fields",
                   "confidence": 0.9, "context": "we compare with NeRF", "metadata": {"section": "Results", "note": null}}
                ]}
                ```
                """;

            List<ExtractedEntity> entities = ExtractionResponseParser.parseEntities(content);

            assertEquals(1, entities.size());
            ExtractedEntity entity = entities.get(0);
            assertEquals("NeRF", entity.name());
            assertEquals(NodeKind.METHOD, entity.kind());
            assertEquals(0.9, entity.confidence(), 1e-9);
            assertEquals("we compare with NeRF", entity.context());
            assertEquals(Map.of("section", "Results"), entity.metadata());
        }

        @Test
        @DisplayName("Missing confidence defaults to 0.5 and out-of-range values are clamped")
        void testConfidenceDefaultsAndClamping() {
            List<ExtractedEntity> entities = ExtractionResponseParser.parseEntities("""
                {"entities": [
                  {"name": "PSNR", "type": "metric"},
                  {"name": "SSIM", "type": "Metric", "confidence": 1.7},
                  {"name": "LPIPS", "type": "metric", "confidence": -2}
                ]}
                """);

            assertEquals(0.5, entities.get(0).confidence(), 1e-9);
            assertEquals(NodeKind.METRIC, entities.get(1).kind());
            assertEquals(1.0, entities.get(1).confidence(), 1e-9);
            assertEquals(0.0, entities.get(2).confidence(), 1e-9);
            assertNull(entities.get(0).description());
        }

        @Test
        @DisplayName("An empty array is a valid response")
        void testEmptyArray() {
            assertTrue(ExtractionResponseParser.parseEntities("{\"entities\": []}").isEmpty());
        }

        @Test
        @DisplayName("Unknown entity types are rejected")
        void testUnknownType() {
            ExtractionParseException error = assertThrows(ExtractionParseException.class,
                () -> ExtractionResponseParser.parseEntities("{\"entities\": [{\"name\": \"X\", \"type\": \"gadget\"}]}"));

            assertEquals("Unknown entity type 'gadget'", error.getMessage());
        }

        @Test
        @DisplayName("Values of the wrong type are rejected rather than coerced")
        void testWrongTypes() {
            assertThrows(ExtractionParseException.class,
                () -> ExtractionResponseParser.parseEntities("{\"entities\": [{\"name\": 42, \"type\": \"method\"}]}"));
            assertThrows(ExtractionParseException.class,
                () -> ExtractionResponseParser.parseEntities("{\"entities\": [{\"name\": \"X\", \"type\": \"method\", \"confidence\": \"high\"}]}"));
            assertThrows(ExtractionParseException.class,
                () -> ExtractionResponseParser.parseEntities("{\"entities\": [{\"name\": \"X\", \"type\": \"method\", \"metadata\": []}]}"));
            assertThrows(ExtractionParseException.class,
                () -> ExtractionResponseParser.parseEntities("{\"entities\": [\"NeRF\"]}"));
        }
    }

    // ===== Relationships =====

    @Nested
    @DisplayName("Relationship responses")
    class RelationshipTests {

        @Test
        @DisplayName("Parses a bare JSON object")
        void testParsesBareObject() {
            List<ExtractedRelationship> relationships = ExtractionResponseParser.parseRelationships("""
                {"relationships": [
                  {"source": "3D Gaussian Splatting", "target": "NeRF", "type": "outperforms",
                   "evidence": "achieves real-time rendering", "confidence": 0.85}
                ]}
                """);

            ExtractedRelationship relationship = relationships.get(0);
            assertEquals("3D Gaussian Splatting", relationship.source());
            assertEquals("NeRF", relationship.target());
            assertEquals(EdgeKind.OUTPERFORMS, relationship.kind());
            assertEquals("achieves real-time rendering", relationship.evidence());
            assertEquals(0.85, relationship.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Unknown relationship types are rejected")
        void testUnknownType() {
            ExtractionParseException error = assertThrows(ExtractionParseException.class,
                () -> ExtractionResponseParser.parseRelationships(
                    "{\"relationships\": [{\"source\": \"A\", \"target\": \"B\", \"type\": \"likes\"}]}"));

            assertEquals("Unknown relationship type 'likes'", error.getMessage());
        }

        @Test
        @DisplayName("Blank endpoints are rejected")
        void testBlankEndpoint() {
            assertThrows(ExtractionParseException.class,
                () -> ExtractionResponseParser.parseRelationships(
                    "{\"relationships\": [{\"source\": \" \", \"target\": \"B\", \"type\": \"cites\"}]}"));
        }
    }

    // ===== Envelope =====

    @Test
    void testEnvelopeErrors() {
        assertThrows(ExtractionParseException.class, () -> ExtractionResponseParser.parseEntities(""));
        assertThrows(ExtractionParseException.class, () -> ExtractionResponseParser.parseEntities("not json"));
        assertThrows(ExtractionParseException.class, () -> ExtractionResponseParser.parseEntities("[1, 2]"));

        ExtractionParseException error = assertThrows(ExtractionParseException.class,
            () -> ExtractionResponseParser.parseRelationships("{\"entities\": []}"));
        assertEquals("Missing 'relationships' array", error.getMessage());
    }

    @Test
    void testUnwrap() {
        assertEquals("{}", ExtractionResponseParser.unwrap("```\n{}\n```"));
        assertEquals("{\"a\":1}", ExtractionResponseParser.unwrap("  {\"a\":1}  "));
    }
}
