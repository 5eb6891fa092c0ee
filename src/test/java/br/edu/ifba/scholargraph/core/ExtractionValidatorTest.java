package br.edu.ifba.scholargraph.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ExtractionValidator}.
 */
class ExtractionValidatorTest {

    private final Paper paper = TestPapers.paper("p1", "3D Gaussian Splatting for Real-Time Rendering");

    @Test
    void testDuplicatesKeepHighestConfidence() {
        List<ExtractedEntity> entities = List.of(
            entity("NeRF", 0.6, "first"),
            entity("nerf", 0.9, "second"),
            entity("NeRF.", 0.9, "tie loses"),
            entity("PSNR", 0.8, null),
            entity("!!!", 0.8, null));

        ExtractionValidator.Result result = new ExtractionValidator(false).validate(paper, entities, List.of());

        assertEquals(2, result.entities().size());
        assertEquals("second", result.entities().get(0).description());
        assertEquals("PSNR", result.entities().get(1).name());
        assertEquals(3, result.entitiesMerged());
    }

    @Test
    void testLenientModeKeepsRelationshipsWithOneKnownEndpoint() {
        List<ExtractedEntity> entities = List.of(entity("NeRF", 0.9, null));
        List<ExtractedRelationship> relationships = List.of(
            relationship("NeRF", "Instant-NGP"),
            relationship("3D Gaussian Splatting for Real-Time Rendering", "Mip-NeRF 360"),
            relationship("Plenoxels", "Instant-NGP"));

        ExtractionValidator.Result result = new ExtractionValidator(false).validate(paper, entities, relationships);

        assertEquals(2, result.relationships().size());
        assertEquals(1, result.relationshipsDropped());
    }

    @Test
    void testStrictModeRequiresBothEndpoints() {
        List<ExtractedEntity> entities = List.of(entity("NeRF", 0.9, null), entity("PSNR", 0.9, null));
        List<ExtractedRelationship> relationships = List.of(
            relationship("NeRF", "PSNR"),
            relationship("3D Gaussian Splatting for Real-Time Rendering", "nerf"),
            relationship("NeRF", "Instant-NGP"));

        ExtractionValidator.Result result = new ExtractionValidator(true).validate(paper, entities, relationships);

        assertEquals(2, result.relationships().size());
        assertEquals(1, result.relationshipsDropped());
    }

    @Test
    void testEmptyInputs() {
        ExtractionValidator.Result result = new ExtractionValidator(false).validate(paper, List.of(), List.of());

        assertEquals(0, result.entities().size());
        assertEquals(0, result.relationships().size());
        assertEquals(0, result.entitiesMerged());
    }

    private static ExtractedEntity entity(String name, double confidence, String description) {
        return new ExtractedEntity(name, NodeKind.METHOD, description, confidence, null, Map.of());
    }

    private static ExtractedRelationship relationship(String source, String target) {
        return new ExtractedRelationship(source, target, EdgeKind.RELATED_TO, null, null, 0.7, Map.of());
    }
}
