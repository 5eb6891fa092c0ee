package br.edu.ifba.scholargraph.core;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.exception.ConfigurationException;
import br.edu.ifba.exception.ValidationException;
import br.edu.ifba.scholargraph.llm.LLMFunction;
import br.edu.ifba.scholargraph.storage.EdgeStorage;
import br.edu.ifba.scholargraph.storage.ExtractionLogStorage;
import br.edu.ifba.scholargraph.storage.NodeStorage;
import br.edu.ifba.scholargraph.storage.PaperStorage;
import br.edu.ifba.scholargraph.storage.PaperStorage.ProcessingStatus;

/**
 * Ingestion pipeline over the scholarly knowledge graph.
 *
 * <p>Creates paper records, runs extraction through {@link ExtractionOrchestrator}
 * and drives batches through {@link BatchIngestionController}. Instances are
 * assembled with {@link #builder()}.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * ScholarGraph graph = ScholarGraph.builder()
 *     .nodeStorage(nodes)
 *     .edgeStorage(edges)
 *     .paperStorage(papers)
 *     .extractionLogStorage(records)
 *     .llmFunction(llm)
 *     .build();
 *
 * IngestionResult result = graph.ingestPaper(input).join();
 * }</pre>
 */
public class ScholarGraph implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScholarGraph.class);

    private final ScholarGraphConfig config;
    private final NodeStorage nodeStorage;
    private final EdgeStorage edgeStorage;
    private final PaperStorage paperStorage;
    private final ExtractionOrchestrator orchestrator;
    private final ExecutorService batchExecutor;
    private final BatchIngestionController batchController;

    /**
     * Creates a new Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ScholarGraph instances.
     */
    public static class Builder {
        private ScholarGraphConfig config = ScholarGraphConfig.defaults();
        private NodeStorage nodeStorage;
        private EdgeStorage edgeStorage;
        private PaperStorage paperStorage;
        private ExtractionLogStorage extractionLogStorage;
        private LLMFunction llmFunction;

        public Builder config(@NotNull ScholarGraphConfig config) {
            this.config = config;
            return this;
        }

        public Builder nodeStorage(@NotNull NodeStorage nodeStorage) {
            this.nodeStorage = nodeStorage;
            return this;
        }

        public Builder edgeStorage(@NotNull EdgeStorage edgeStorage) {
            this.edgeStorage = edgeStorage;
            return this;
        }

        public Builder paperStorage(@NotNull PaperStorage paperStorage) {
            this.paperStorage = paperStorage;
            return this;
        }

        public Builder extractionLogStorage(@NotNull ExtractionLogStorage extractionLogStorage) {
            this.extractionLogStorage = extractionLogStorage;
            return this;
        }

        public Builder llmFunction(@NotNull LLMFunction llmFunction) {
            this.llmFunction = llmFunction;
            return this;
        }

        public ScholarGraph build() {
            if (nodeStorage == null) {
                throw new IllegalStateException("nodeStorage is required");
            }
            if (edgeStorage == null) {
                throw new IllegalStateException("edgeStorage is required");
            }
            if (paperStorage == null) {
                throw new IllegalStateException("paperStorage is required");
            }
            if (extractionLogStorage == null) {
                throw new IllegalStateException("extractionLogStorage is required");
            }
            if (llmFunction == null) {
                throw new IllegalStateException("llmFunction is required");
            }
            config.validate();

            return new ScholarGraph(config, nodeStorage, edgeStorage, paperStorage, extractionLogStorage, llmFunction);
        }
    }

    private ScholarGraph(
            ScholarGraphConfig config,
            NodeStorage nodeStorage,
            EdgeStorage edgeStorage,
            PaperStorage paperStorage,
            ExtractionLogStorage extractionLogStorage,
            LLMFunction llmFunction) {
        this.config = config;
        this.nodeStorage = nodeStorage;
        this.edgeStorage = edgeStorage;
        this.paperStorage = paperStorage;
        this.orchestrator = new ExtractionOrchestrator(nodeStorage, edgeStorage, paperStorage,
            extractionLogStorage, llmFunction, config);
        this.batchExecutor = Executors.newFixedThreadPool(config.batchConcurrency(), batchThreadFactory());
        this.batchController = new BatchIngestionController(this::ingestPaper, batchExecutor, config.chunkDelayMs());
        logger.info("ScholarGraph initialized (batch concurrency: {}, chunk delay: {} ms, strict endpoints: {})",
            config.batchConcurrency(), config.chunkDelayMs(), config.strictEndpoints());
    }

    /**
     * Stores the paper and, when it has full text, extracts its knowledge into the graph.
     *
     * <p>The paper record is committed before extraction starts. When extraction
     * fails the paper stays {@code failed} and the returned future fails with the cause.</p>
     */
    public CompletableFuture<IngestionResult> ingestPaper(@NotNull PaperInput input) {
        logger.info("Ingesting paper: {}", input.title());
        return paperStorage.create(input).thenCompose(paper -> {
            if (!paper.hasFullText()) {
                logger.info("Paper {} has no full text, leaving it {}", paper.id(), paper.processingStatus().value());
                return CompletableFuture.completedFuture(new IngestionResult(paper, null));
            }
            return orchestrator.process(paper)
                .thenCompose(analysis -> paperStorage.findById(paper.id())
                    .thenApply(stored -> new IngestionResult(stored != null ? stored : paper, analysis)));
        });
    }

    /**
     * Ingests {@code inputs} in chunks of {@code concurrency} papers using the configured chunk delay.
     * Cancelling the returned future stops scheduling further chunks.
     */
    public CompletableFuture<BatchSummary> ingestBatch(@NotNull List<PaperInput> inputs, int concurrency) {
        return batchController.ingestMany(inputs, concurrency);
    }

    public CompletableFuture<BatchSummary> ingestBatch(@NotNull List<PaperInput> inputs) {
        return batchController.ingestMany(inputs, config.batchConcurrency());
    }

    public CompletableFuture<BatchSummary> ingestBatch(@NotNull List<PaperInput> inputs, int concurrency,
            @NotNull BooleanSupplier cancelRequested) {
        return batchController.ingestMany(inputs, concurrency, cancelRequested);
    }

    /**
     * Runs extraction again for a stored paper. Nodes and edges converge through
     * their upserts, so repeated runs do not duplicate the graph.
     *
     * @throws ValidationException (through the future) if the paper is unknown or has no full text
     */
    public CompletableFuture<PaperAnalysis> reprocessPaper(@NotNull String paperId) {
        return paperStorage.findById(paperId).thenCompose(paper -> {
            if (paper == null) {
                throw new ValidationException("Paper not found: " + paperId);
            }
            if (!paper.hasFullText()) {
                throw new ValidationException("Paper has no full text: " + paperId);
            }
            logger.info("Reprocessing paper: {}", paper.title());
            return orchestrator.process(paper);
        });
    }

    public CompletableFuture<IngestionStats> getStats() {
        CompletableFuture<Map<ProcessingStatus, Long>> papers = paperStorage.countByStatus();
        CompletableFuture<Map<NodeKind, Long>> nodes = nodeStorage.countByKind();
        CompletableFuture<Map<EdgeKind, Long>> edges = edgeStorage.countByKind();

        return CompletableFuture.allOf(papers, nodes, edges).thenApply(ignored -> {
            Map<ProcessingStatus, Long> byStatus = papers.join();
            long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
            return new IngestionStats(total, byStatus, nodes.join(), edges.join());
        });
    }

    public CompletableFuture<List<Paper>> findPapersByStatus(@NotNull ProcessingStatus status) {
        return paperStorage.findByStatus(status);
    }

    public ScholarGraphConfig getConfig() {
        return config;
    }

    /**
     * Stops the batch executor. Batches that have not finished fail with
     * {@link IllegalStateException}; papers already running are not interrupted.
     */
    @Override
    public void close() {
        batchController.abortPending("Ingestion pipeline closed");
        batchExecutor.shutdown();
    }

    private static ThreadFactory batchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, "batch-ingest-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Pipeline settings.
     *
     * @param maxTextLength characters of full text sent to each extraction stage
     * @param knownPapersFetchLimit completed papers fetched per relationship stage
     * @param knownPapersPromptLimit completed papers listed in the relationship prompt
     * @param strictEndpoints keep only relationships whose endpoints are both known to the paper
     * @param fuzzyCandidates matches fetched by the fuzzy resolution tier
     * @param minSimilarity lowest fuzzy score accepted as a match
     * @param batchConcurrency papers per batch chunk and size of the batch executor
     * @param chunkDelayMs pause between batch chunks, 0 to disable
     */
    public record ScholarGraphConfig(
        int maxTextLength,
        int knownPapersFetchLimit,
        int knownPapersPromptLimit,
        double entityTemperature,
        int entityMaxTokens,
        double relationshipTemperature,
        int relationshipMaxTokens,
        boolean strictEndpoints,
        int fuzzyCandidates,
        double minSimilarity,
        int batchConcurrency,
        long chunkDelayMs
    ) {
        public static ScholarGraphConfig defaults() {
            return new ScholarGraphConfig(
                15000, // maxTextLength
                100,   // knownPapersFetchLimit
                50,    // knownPapersPromptLimit
                0.3,   // entityTemperature
                4000,  // entityMaxTokens
                0.2,   // relationshipTemperature
                4000,  // relationshipMaxTokens
                false, // strictEndpoints
                5,     // fuzzyCandidates
                0.0,   // minSimilarity
                5,     // batchConcurrency
                2000   // chunkDelayMs
            );
        }

        /**
         * @throws ConfigurationException on the first invalid setting
         */
        public void validate() {
            if (maxTextLength < 1) {
                throw new ConfigurationException("maxTextLength must be positive");
            }
            if (knownPapersFetchLimit < 0 || knownPapersPromptLimit < 0) {
                throw new ConfigurationException("known paper limits cannot be negative");
            }
            if (entityMaxTokens < 1 || relationshipMaxTokens < 1) {
                throw new ConfigurationException("stage max tokens must be positive");
            }
            if (fuzzyCandidates < 1) {
                throw new ConfigurationException("fuzzyCandidates must be at least 1");
            }
            if (minSimilarity < 0.0 || minSimilarity > 1.0) {
                throw new ConfigurationException("minSimilarity must be within [0, 1]");
            }
            if (batchConcurrency < 1) {
                throw new ConfigurationException("batchConcurrency must be at least 1");
            }
            if (chunkDelayMs < 0) {
                throw new ConfigurationException("chunkDelayMs cannot be negative");
            }
        }

        public ScholarGraphConfig withStrictEndpoints(boolean enabled) {
            return new ScholarGraphConfig(maxTextLength, knownPapersFetchLimit, knownPapersPromptLimit,
                entityTemperature, entityMaxTokens, relationshipTemperature, relationshipMaxTokens,
                enabled, fuzzyCandidates, minSimilarity, batchConcurrency, chunkDelayMs);
        }

        public ScholarGraphConfig withMinSimilarity(double threshold) {
            return new ScholarGraphConfig(maxTextLength, knownPapersFetchLimit, knownPapersPromptLimit,
                entityTemperature, entityMaxTokens, relationshipTemperature, relationshipMaxTokens,
                strictEndpoints, fuzzyCandidates, threshold, batchConcurrency, chunkDelayMs);
        }

        public ScholarGraphConfig withBatch(int concurrency, long delayMs) {
            return new ScholarGraphConfig(maxTextLength, knownPapersFetchLimit, knownPapersPromptLimit,
                entityTemperature, entityMaxTokens, relationshipTemperature, relationshipMaxTokens,
                strictEndpoints, fuzzyCandidates, minSimilarity, concurrency, delayMs);
        }
    }
}
