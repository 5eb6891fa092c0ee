package br.edu.ifba.scholargraph.core;

import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Relationship candidate returned by the relationship extraction stage.
 * Endpoints are free-text names, resolved to node ids at persistence time.
 */
public record ExtractedRelationship(
        @NotNull String source,
        @NotNull String target,
        @NotNull EdgeKind kind,
        @Nullable String description,
        @Nullable String evidence,
        double confidence,
        @NotNull Map<String, Object> metadata) {

    public ExtractedRelationship {
        confidence = Confidence.clamp(confidence);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
