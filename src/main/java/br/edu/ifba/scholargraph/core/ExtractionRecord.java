package br.edu.ifba.scholargraph.core;

import java.time.Instant;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Append-only audit entry for one stage attempt.
 *
 * @param input  JSON snapshot of what the stage received
 * @param output JSON snapshot of what the stage produced, null on failure
 */
public record ExtractionRecord(
        @NotNull String paperId,
        @NotNull ExtractionStage stage,
        @Nullable String input,
        @Nullable String output,
        boolean success,
        @Nullable String error,
        long durationMs,
        @NotNull Instant timestamp) {

    public static ExtractionRecord success(String paperId, ExtractionStage stage, String input, String output, long durationMs) {
        return new ExtractionRecord(paperId, stage, input, output, true, null, durationMs, Instant.now());
    }

    public static ExtractionRecord failure(String paperId, ExtractionStage stage, String input, String error, long durationMs) {
        return new ExtractionRecord(paperId, stage, input, null, false, error, durationMs, Instant.now());
    }
}
