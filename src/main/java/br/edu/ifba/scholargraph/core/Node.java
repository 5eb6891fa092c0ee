package br.edu.ifba.scholargraph.core;

import java.time.Instant;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A graph vertex. Identity is {@code (kind, canonicalName)}.
 */
public record Node(
        @NotNull String id,
        @NotNull NodeKind kind,
        @NotNull String name,
        @NotNull String canonicalName,
        @Nullable String description,
        @NotNull Map<String, Object> metadata,
        double confidence,
        @Nullable String source,
        @NotNull Instant createdAt,
        @NotNull Instant updatedAt) {

    public Node {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
