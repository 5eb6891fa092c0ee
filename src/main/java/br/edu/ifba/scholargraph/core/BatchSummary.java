package br.edu.ifba.scholargraph.core;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Result of a batch ingestion. Only papers that were actually attempted are counted.
 *
 * @param cancelled whether the batch stopped before its last chunk
 */
public record BatchSummary(
        int successCount,
        int failureCount,
        @NotNull List<Failure> failures,
        boolean cancelled,
        long durationMs) {

    public BatchSummary {
        failures = List.copyOf(failures);
    }

    public int attempted() {
        return successCount + failureCount;
    }

    /**
     * One paper whose ingestion failed.
     */
    public record Failure(@NotNull String title, @Nullable String externalId, @NotNull String error) {
    }
}
