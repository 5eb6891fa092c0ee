package br.edu.ifba.scholargraph.core;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.scholargraph.storage.PaperStorage.ProcessingStatus;

/**
 * A paper node together with its bibliographic data and processing state.
 * The {@code id} is the id of the backing {@link NodeKind#PAPER} node.
 */
public record Paper(
        @NotNull String id,
        @NotNull String title,
        @Nullable String abstractText,
        @Nullable String fullText,
        @NotNull List<String> authors,
        @Nullable String externalId,
        @Nullable String doi,
        @Nullable LocalDate publicationDate,
        @Nullable String venue,
        @NotNull ProcessingStatus processingStatus,
        @Nullable String lastError,
        @Nullable Instant processedAt,
        @NotNull Instant createdAt,
        @NotNull Instant updatedAt) {

    public Paper {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public boolean hasFullText() {
        return fullText != null && !fullText.isBlank();
    }
}
