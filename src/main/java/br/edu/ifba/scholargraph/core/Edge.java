package br.edu.ifba.scholargraph.core;

import java.time.Instant;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A directed, typed relationship. Identity is {@code (kind, sourceId, targetId)}.
 */
public record Edge(
        @NotNull String id,
        @NotNull EdgeKind kind,
        @NotNull String sourceId,
        @NotNull String targetId,
        @Nullable String description,
        @Nullable String evidence,
        double confidence,
        @NotNull Map<String, Object> metadata,
        @Nullable String source,
        @NotNull Instant createdAt,
        @NotNull Instant updatedAt) {

    public Edge {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
