package br.edu.ifba.scholargraph.storage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.scholargraph.core.ExtractionRecord;

/**
 * Append-only audit log of extraction stage attempts.
 */
public interface ExtractionLogStorage {

    CompletableFuture<Void> append(@NotNull ExtractionRecord record);

    /**
     * @return records of one paper in insertion order
     */
    CompletableFuture<List<ExtractionRecord>> findByPaper(@NotNull String paperId);
}
