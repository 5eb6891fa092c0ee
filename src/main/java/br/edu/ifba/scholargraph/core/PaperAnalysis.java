package br.edu.ifba.scholargraph.core;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Outcome of one successful extraction run over a paper.
 *
 * @param entities validated entities, one per canonical name
 * @param relationships validated relationships handed to edge persistence
 * @param nodesUpserted distinct nodes created or merged for the entities
 * @param edgesCreated relationships that became (or merged into) an edge
 * @param unresolvedRelationships relationships skipped because an endpoint matched no node
 * @param failedRelationships relationships skipped because the edge write failed
 * @param durationMs wall time of the whole run
 */
public record PaperAnalysis(
        @NotNull List<ExtractedEntity> entities,
        @NotNull List<ExtractedRelationship> relationships,
        int nodesUpserted,
        int edgesCreated,
        int unresolvedRelationships,
        int failedRelationships,
        long durationMs) {

    public PaperAnalysis {
        entities = List.copyOf(entities);
        relationships = List.copyOf(relationships);
    }
}
