package br.edu.ifba.scholargraph.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonValue;

import br.edu.ifba.scholargraph.core.Paper;
import br.edu.ifba.scholargraph.core.PaperInput;

/**
 * Storage for papers. Every paper is backed by a node of kind paper sharing
 * its id.
 */
public interface PaperStorage {

    /**
     * Creates a paper, or updates it in place when the external id (or the
     * backing paper node) already exists. New papers start as
     * {@link ProcessingStatus#PENDING}; existing papers keep their status.
     *
     * @throws br.edu.ifba.exception.ValidationException (through the future) when the title is blank
     */
    CompletableFuture<Paper> create(@NotNull PaperInput input);

    /**
     * @return the paper, or null if not found
     */
    CompletableFuture<Paper> findById(@NotNull String id);

    /**
     * @return the paper, or null if not found
     */
    CompletableFuture<Paper> findByExternalId(@NotNull String externalId);

    CompletableFuture<List<Paper>> findByStatus(@NotNull ProcessingStatus status);

    /**
     * Lists recently completed papers, newest publication first.
     *
     * @param limit maximum number of papers
     * @param excludeId paper to leave out, usually the one being processed
     */
    CompletableFuture<List<PaperReference>> findRecentCompleted(int limit, @Nullable String excludeId);

    /**
     * Moves a paper to a new processing status. {@code processedAt} is set when
     * the paper completes and cleared when it starts processing again.
     *
     * @param error failure detail kept for failed papers, null otherwise
     */
    CompletableFuture<Void> updateStatus(@NotNull String id, @NotNull ProcessingStatus status, @Nullable String error);

    CompletableFuture<Map<ProcessingStatus, Long>> countByStatus();

    /**
     * Processing state of a paper.
     */
    enum ProcessingStatus {
        PENDING("pending"),
        PROCESSING("processing"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String value;

        ProcessingStatus(String value) {
            this.value = value;
        }

        @JsonValue
    public String value() {
            return value;
        }

        public static Optional<ProcessingStatus> fromValue(String value) {
            for (ProcessingStatus status : values()) {
                if (status.value.equalsIgnoreCase(value)) {
                    return Optional.of(status);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Lightweight view of a paper used as cross-paper context.
     */
    record PaperReference(@NotNull String id, @NotNull String title, @Nullable String externalId) {
    }
}
