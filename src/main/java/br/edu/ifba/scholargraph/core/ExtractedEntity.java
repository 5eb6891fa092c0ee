package br.edu.ifba.scholargraph.core;

import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entity candidate returned by the entity extraction stage.
 */
public record ExtractedEntity(
        @NotNull String name,
        @NotNull NodeKind kind,
        @Nullable String description,
        double confidence,
        @Nullable String context,
        @NotNull Map<String, Object> metadata) {

    public ExtractedEntity {
        confidence = Confidence.clamp(confidence);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String canonicalName() {
        return Canonicalizer.normalize(name);
    }
}
