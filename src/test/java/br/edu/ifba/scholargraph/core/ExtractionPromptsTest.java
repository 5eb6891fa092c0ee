package br.edu.ifba.scholargraph.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import br.edu.ifba.scholargraph.storage.PaperStorage.PaperReference;

/**
 * Unit tests for {@link ExtractionPrompts}.
 */
class ExtractionPromptsTest {

    private final Paper paper = TestPapers.paper("p1", "3D Gaussian Splatting", null, "We introduce ...");

    @Test
    void testShortTextIsNotTruncated() {
        assertEquals("abc", ExtractionPrompts.truncate("abc", 3));
        assertEquals("", ExtractionPrompts.truncate(null, 10));
    }

    @Test
    void testLongTextIsCutAndMarked() {
        String truncated = ExtractionPrompts.truncate("a".repeat(20), 15);

        assertEquals("a".repeat(15) + "\n\n[Text truncated...]", truncated);
        assertTrue(truncated.endsWith(ExtractionPrompts.TRUNCATION_MARKER));
    }

    @Test
    void testEntityPromptUsesPlaceholderForMissingAbstract() {
        String prompt = ExtractionPrompts.entityUserPrompt(paper, "We introduce ...");

        assertTrue(prompt.contains("PAPER TITLE: 3D Gaussian Splatting"));
        assertTrue(prompt.contains("PAPER ABSTRACT:\nNot available"));
        assertTrue(prompt.contains("We introduce ..."));
        assertTrue(prompt.contains("\"type\": \"concept|method|dataset|metric|technique|application|challenge|result\""));
        assertFalse(prompt.contains("author|"), "Authors come from bibliographic data");
    }

    @Test
    void testRelationshipPromptListsEntitiesAndKnownPapers() {
        List<ExtractedEntity> entities = List.of(
            new ExtractedEntity("NeRF", NodeKind.METHOD, null, 0.9, null, Map.of()),
            new ExtractedEntity("PSNR", NodeKind.METRIC, null, 0.8, null, Map.of()));
        List<PaperReference> known = List.of(new PaperReference("p0", "Mip-NeRF 360", "2111.12077"));

        String prompt = ExtractionPrompts.relationshipUserPrompt(paper, entities, known, "text");

        assertTrue(prompt.contains("PAPER: 3D Gaussian Splatting"));
        assertTrue(prompt.contains("- NeRF (method)\n- PSNR (metric)"));
        assertTrue(prompt.contains("KNOWN PAPERS IN KNOWLEDGE GRAPH:\n- Mip-NeRF 360"));
    }

    @Test
    void testRelationshipPromptOmitsEmptyKnownPapers() {
        String prompt = ExtractionPrompts.relationshipUserPrompt(paper, List.of(), List.of(), "text");

        assertFalse(prompt.contains("KNOWN PAPERS"));
    }
}
