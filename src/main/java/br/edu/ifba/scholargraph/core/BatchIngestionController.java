package br.edu.ifba.scholargraph.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.exception.ValidationException;

/**
 * Ingests many papers in fixed-size chunks.
 *
 * <p>Papers of one chunk run concurrently; the next chunk starts only after every
 * paper of the current one has settled, after a configurable delay. A failing paper
 * is counted and never aborts its chunk or the batch.</p>
 *
 * <p>Cancellation is checked at chunk boundaries, either by cancelling the
 * returned future or through the {@code cancelRequested} flag. Papers already
 * running finish normally.</p>
 *
 * <p>{@link #abortPending(String)} fails every unfinished batch, so a caller
 * shutting down the executor never leaves a summary future hanging.</p>
 */
public class BatchIngestionController {

    private static final Logger logger = LoggerFactory.getLogger(BatchIngestionController.class);

    private final Function<PaperInput, ? extends CompletionStage<?>> ingestor;
    private final Executor executor;
    private final long chunkDelayMs;
    private final Set<CompletableFuture<BatchSummary>> pending = ConcurrentHashMap.newKeySet();

    /**
     * @param ingestor ingests one paper; a failed stage counts the paper as failed
     * @param executor runs the chunks and the delay between them
     * @param chunkDelayMs pause between chunks, 0 to disable
     */
    public BatchIngestionController(@NotNull Function<PaperInput, ? extends CompletionStage<?>> ingestor,
            @NotNull Executor executor, long chunkDelayMs) {
        if (chunkDelayMs < 0) {
            throw new IllegalArgumentException("chunkDelayMs cannot be negative");
        }
        this.ingestor = ingestor;
        this.executor = executor;
        this.chunkDelayMs = chunkDelayMs;
    }

    public CompletableFuture<BatchSummary> ingestMany(@NotNull List<PaperInput> papers, int concurrency) {
        return ingestMany(papers, concurrency, () -> false);
    }

    /**
     * @param concurrency chunk size, at least 1
     * @param cancelRequested polled before each chunk; when true the summary completes with {@code cancelled=true}
     * @throws ValidationException if {@code concurrency < 1}
     */
    public CompletableFuture<BatchSummary> ingestMany(@NotNull List<PaperInput> papers, int concurrency,
            @NotNull BooleanSupplier cancelRequested) {
        if (concurrency < 1) {
            throw new ValidationException("Batch concurrency must be at least 1, got " + concurrency);
        }

        List<List<PaperInput>> chunks = new ArrayList<>();
        for (int i = 0; i < papers.size(); i += concurrency) {
            chunks.add(List.copyOf(papers.subList(i, Math.min(i + concurrency, papers.size()))));
        }
        logger.info("Starting batch ingestion of {} papers in {} chunks (concurrency: {})",
            papers.size(), chunks.size(), concurrency);

        BatchProgress progress = new BatchProgress(System.currentTimeMillis());
        CompletableFuture<BatchSummary> result = new CompletableFuture<>();
        pending.add(result);
        result.whenComplete((summary, error) -> pending.remove(result));
        schedule(executor, () -> runChunk(chunks, 0, progress, cancelRequested, result), result);
        return result;
    }

    /**
     * Completes every unfinished batch exceptionally. Papers already running are not interrupted.
     *
     * @return number of batches aborted
     */
    public int abortPending(String reason) {
        int aborted = 0;
        for (CompletableFuture<BatchSummary> result : List.copyOf(pending)) {
            if (result.completeExceptionally(new IllegalStateException(reason))) {
                aborted++;
            }
        }
        if (aborted > 0) {
            logger.warn("Aborted {} unfinished batch(es): {}", aborted, reason);
        }
        return aborted;
    }

    private void runChunk(List<List<PaperInput>> chunks, int index, BatchProgress progress,
            BooleanSupplier cancelRequested, CompletableFuture<BatchSummary> result) {
        if (result.isDone()) {
            logger.info("Batch cancelled by caller before chunk {}/{}", index + 1, chunks.size());
            return;
        }
        if (index >= chunks.size()) {
            BatchSummary summary = progress.summary(false);
            logger.info("Batch ingestion complete - success: {}, failed: {}, duration: {} ms",
                summary.successCount(), summary.failureCount(), summary.durationMs());
            result.complete(summary);
            return;
        }
        if (cancelRequested.getAsBoolean()) {
            BatchSummary summary = progress.summary(true);
            logger.info("Batch cancelled before chunk {}/{} - success: {}, failed: {}",
                index + 1, chunks.size(), summary.successCount(), summary.failureCount());
            result.complete(summary);
            return;
        }

        List<PaperInput> chunk = chunks.get(index);
        logger.info("Processing chunk {}/{} ({} papers)", index + 1, chunks.size(), chunk.size());

        CompletableFuture<?>[] tasks = chunk.stream()
            .map(paper -> ingestSafely(paper).handle((ignored, error) -> {
                progress.settle(paper, error);
                return null;
            }))
            .toArray(CompletableFuture[]::new);

        CompletableFuture.allOf(tasks).whenComplete((ignored, error) -> {
            logger.info("Chunk {}/{} settled - cumulative success: {}, failed: {}",
                index + 1, chunks.size(), progress.successes.get(), progress.failureCount());

            boolean hasNext = index + 1 < chunks.size();
            Runnable nextChunk = () -> runChunk(chunks, index + 1, progress, cancelRequested, result);
            if (hasNext && chunkDelayMs > 0) {
                logger.debug("Waiting {} ms before chunk {}/{}", chunkDelayMs, index + 2, chunks.size());
                // The timer thread hands off to the batch executor, which may have been shut down meanwhile
                CompletableFuture.delayedExecutor(chunkDelayMs, TimeUnit.MILLISECONDS)
                    .execute(() -> schedule(executor, nextChunk, result));
            } else {
                schedule(executor, nextChunk, result);
            }
        });
    }

    private static void schedule(Executor target, Runnable task, CompletableFuture<BatchSummary> result) {
        try {
            target.execute(task);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Batch executor is shut down", e));
        }
    }

    private CompletableFuture<?> ingestSafely(PaperInput paper) {
        try {
            return ingestor.apply(paper).toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static final class BatchProgress {
        private final long startedAt;
        private final AtomicInteger successes = new AtomicInteger();
        private final List<BatchSummary.Failure> failures = Collections.synchronizedList(new ArrayList<>());

        private BatchProgress(long startedAt) {
            this.startedAt = startedAt;
        }

        void settle(PaperInput paper, Throwable error) {
            if (error == null) {
                successes.incrementAndGet();
                return;
            }
            Throwable cause = ExtractionOrchestrator.unwrap(error);
            String title = paper.title() != null ? paper.title() : "(untitled)";
            logger.warn("Paper failed in batch: {} - {}", title, ExtractionOrchestrator.describe(cause));
            failures.add(new BatchSummary.Failure(title, paper.externalId(), ExtractionOrchestrator.describe(cause)));
        }

        int failureCount() {
            return failures.size();
        }

        BatchSummary summary(boolean cancelled) {
            List<BatchSummary.Failure> snapshot;
            synchronized (failures) {
                snapshot = List.copyOf(failures);
            }
            return new BatchSummary(successes.get(), snapshot.size(), snapshot, cancelled,
                System.currentTimeMillis() - startedAt);
        }
    }
}
