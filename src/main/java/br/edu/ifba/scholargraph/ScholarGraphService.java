package br.edu.ifba.scholargraph;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

import org.jboss.logging.Logger;

import br.edu.ifba.scholargraph.core.BatchIngestionConfig;
import br.edu.ifba.scholargraph.core.BatchSummary;
import br.edu.ifba.scholargraph.core.IngestionResult;
import br.edu.ifba.scholargraph.core.IngestionStats;
import br.edu.ifba.scholargraph.core.Paper;
import br.edu.ifba.scholargraph.core.PaperAnalysis;
import br.edu.ifba.scholargraph.core.PaperInput;
import br.edu.ifba.scholargraph.core.ScholarGraph;
import br.edu.ifba.scholargraph.core.ScholarGraph.ScholarGraphConfig;
import br.edu.ifba.scholargraph.core.ScholarGraphExtractionConfig;
import br.edu.ifba.scholargraph.llm.LLMFunction;
import br.edu.ifba.scholargraph.storage.EdgeStorage;
import br.edu.ifba.scholargraph.storage.ExtractionLogStorage;
import br.edu.ifba.scholargraph.storage.NodeStorage;
import br.edu.ifba.scholargraph.storage.PaperStorage;
import br.edu.ifba.scholargraph.storage.PaperStorage.ProcessingStatus;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Application-scoped entry point to the ingestion pipeline. Wires a
 * {@link ScholarGraph} from the configured storage, text-analysis adapter and
 * extraction settings.
 */
@ApplicationScoped
@Startup
public class ScholarGraphService {

    private static final Logger LOG = Logger.getLogger(ScholarGraphService.class);

    @Inject
    LLMFunction llmFunction;

    @Inject
    NodeStorage nodeStorage;

    @Inject
    EdgeStorage edgeStorage;

    @Inject
    PaperStorage paperStorage;

    @Inject
    ExtractionLogStorage extractionLogStorage;

    @Inject
    ScholarGraphExtractionConfig extractionConfig;

    @Inject
    BatchIngestionConfig batchConfig;

    private ScholarGraph scholarGraph;

    @PostConstruct
    void initialize() {
        ScholarGraphConfig config = new ScholarGraphConfig(
            extractionConfig.maxTextLength(),
            extractionConfig.knownPapers().fetchLimit(),
            extractionConfig.knownPapers().promptLimit(),
            extractionConfig.entity().temperature(),
            extractionConfig.entity().maxTokens(),
            extractionConfig.relationship().temperature(),
            extractionConfig.relationship().maxTokens(),
            extractionConfig.validation().strictEndpoints(),
            extractionConfig.resolution().fuzzyCandidates(),
            extractionConfig.resolution().minSimilarity(),
            batchConfig.concurrency(),
            batchConfig.chunkDelayMs());

        scholarGraph = ScholarGraph.builder()
            .config(config)
            .nodeStorage(nodeStorage)
            .edgeStorage(edgeStorage)
            .paperStorage(paperStorage)
            .extractionLogStorage(extractionLogStorage)
            .llmFunction(llmFunction)
            .build();

        LOG.infof("ScholarGraphService ready (max text length: %d, strict endpoints: %s)",
            config.maxTextLength(), config.strictEndpoints());
    }

    @PreDestroy
    void destroy() {
        if (scholarGraph != null) {
            scholarGraph.close();
        }
    }

    public CompletableFuture<IngestionResult> ingestPaper(PaperInput input) {
        return scholarGraph.ingestPaper(input);
    }

    public CompletableFuture<BatchSummary> ingestBatch(List<PaperInput> inputs) {
        return scholarGraph.ingestBatch(inputs);
    }

    public CompletableFuture<BatchSummary> ingestBatch(List<PaperInput> inputs, int concurrency) {
        return scholarGraph.ingestBatch(inputs, concurrency);
    }

    /**
     * @param cancelRequested polled between chunks; papers already running finish normally
     */
    public CompletableFuture<BatchSummary> ingestBatch(List<PaperInput> inputs, int concurrency,
            BooleanSupplier cancelRequested) {
        return scholarGraph.ingestBatch(inputs, concurrency, cancelRequested);
    }

    public CompletableFuture<PaperAnalysis> reprocessPaper(String paperId) {
        return scholarGraph.reprocessPaper(paperId);
    }

    public CompletableFuture<IngestionStats> getStats() {
        return scholarGraph.getStats();
    }

    public CompletableFuture<List<Paper>> findPapersByStatus(ProcessingStatus status) {
        return scholarGraph.findPapersByStatus(status);
    }
}
