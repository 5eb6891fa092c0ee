package br.edu.ifba.scholargraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * @param paper the stored paper after ingestion
 * @param analysis extraction outcome, null when the paper had no full text and was left pending
 */
public record IngestionResult(@NotNull Paper paper, @Nullable PaperAnalysis analysis) {

    public boolean extracted() {
        return analysis != null;
    }
}
