package br.edu.ifba.scholargraph.core;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.scholargraph.storage.PaperStorage.PaperReference;

/**
 * Prompt templates for the two extraction stages.
 *
 * <p>The system prompts are fixed instruction sets; the user prompts carry the
 * paper. Both ask for a single JSON object so the response can be parsed by
 * {@link ExtractionResponseParser}.</p>
 */
public final class ExtractionPrompts {

    public static final String TRUNCATION_MARKER = "\n\n[Text truncated...]";

    static final String ABSTRACT_PLACEHOLDER = "Not available";

    // paper and author nodes come from bibliographic data, not from the text
    static final Set<NodeKind> EXTRACTED_KINDS = EnumSet.complementOf(EnumSet.of(NodeKind.PAPER, NodeKind.AUTHOR));

    public static final String ENTITY_SYSTEM_PROMPT = """
        You are a research analyst building a knowledge graph from scholarly papers in \
        computer graphics, 3D reconstruction and neural rendering. Extract the structured \
        entities a paper contributes to or depends on.

        ENTITY TYPES:
        - concept: high-level ideas, theories or paradigms
        - method: specific algorithms or approaches
        - technique: implementation strategies or technical tricks
        - dataset: benchmark datasets or data sources
        - metric: evaluation measures
        - challenge: problems or limitations being addressed
        - application: use cases or domains
        - result: quantitative outcomes or achievements

        GUIDELINES:
        - Prefer entities central to the paper's contribution
        - Use the paper's own terminology for names
        - Describe the role each entity plays in the paper
        - Support each entity with a short quote or paraphrase as context
        - Score confidence between 0.0 and 1.0
        - Skip generic terms such as "algorithm" or "method" without specifics

        Respond with valid JSON only.""";

    public static final String RELATIONSHIP_SYSTEM_PROMPT = """
        You identify semantic relationships in scholarly papers about neural rendering \
        and 3D reconstruction. Relationships connect the paper, the entities extracted \
        from it and other papers already in the knowledge graph.

        RELATIONSHIP TYPES:
        Paper to paper: cites, improves_on, extends, compares_with, builds_upon, contradicts, inspired_by
        Paper to concept: introduces, applies, evaluates, addresses
        Concept to concept: related_to, enables, requires, alternative_to, generalizes, specializes
        Method to method: outperforms, combines_with, replaces
        Other: authored_by, uses_dataset, measures_with, solves

        GUIDELINES:
        - Only report relationships the text supports
        - Quote or paraphrase the supporting passage as evidence
        - Base confidence on the strength of the evidence
        - Refer to entities and papers by the exact names given

        Respond with valid JSON only, without markdown.""";

    private ExtractionPrompts() {
    }

    /**
     * Cuts {@code text} to {@code maxLength} characters and appends
     * {@link #TRUNCATION_MARKER} when anything was removed.
     */
    public static String truncate(@Nullable String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }

    public static String entityUserPrompt(@NotNull Paper paper, @NotNull String text) {
        String abstractText = paper.abstractText() == null || paper.abstractText().isBlank()
            ? ABSTRACT_PLACEHOLDER
            : paper.abstractText();
        String kinds = EXTRACTED_KINDS.stream().map(NodeKind::value).collect(Collectors.joining("|"));

        return """
            Extract entities from this paper:

            PAPER TITLE: %s

            PAPER ABSTRACT:
            %s

            PAPER TEXT:
            %s

            Return the entities in this JSON format:

            {
              "entities": [
                {
                  "name": "Entity Name",
                  "type": "%s",
                  "description": "What this entity is and its role in the paper",
                  "confidence": 0.9,
                  "context": "Supporting quote or context from the paper",
                  "metadata": {
                    "section": "Introduction|Methods|Results|etc"
                  }
                }
              ]
            }

            Extract 10-30 of the most important entities. Quality over quantity.""".formatted(
                paper.title(), abstractText, text, kinds);
    }

    public static String relationshipUserPrompt(@NotNull Paper paper, @NotNull List<ExtractedEntity> entities,
            @NotNull List<PaperReference> knownPapers, @NotNull String text) {
        String entityList = entities.stream()
            .map(entity -> "- " + entity.name() + " (" + entity.kind().value() + ")")
            .collect(Collectors.joining("\n"));

        String knownPaperList = knownPapers.isEmpty()
            ? ""
            : "\n\nKNOWN PAPERS IN KNOWLEDGE GRAPH:\n" + knownPapers.stream()
                .map(known -> "- " + known.title())
                .collect(Collectors.joining("\n"));

        return """
            Extract semantic relationships from this paper:

            PAPER: %s

            EXTRACTED ENTITIES:
            %s%s

            PAPER TEXT:
            %s

            Return the relationships in this JSON format:

            {
              "relationships": [
                {
                  "source": "Entity or Paper Name",
                  "target": "Entity or Paper Name",
                  "type": "improves_on|extends|introduces|applies|related_to|outperforms|etc",
                  "description": "Brief description of the relationship",
                  "evidence": "Quote or paraphrase from the paper supporting it",
                  "confidence": 0.9,
                  "metadata": {
                    "section": "Results"
                  }
                }
              ]
            }

            Extract 15-40 relationships, favouring paper-to-paper comparisons, newly \
            introduced concepts and performance claims backed by evidence.""".formatted(
                paper.title(), entityList, knownPaperList, text);
    }
}
