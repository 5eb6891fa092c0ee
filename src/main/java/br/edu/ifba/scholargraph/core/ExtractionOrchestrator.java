package br.edu.ifba.scholargraph.core;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.exception.ValidationException;
import br.edu.ifba.scholargraph.core.EntityResolver.ResolutionContext;
import br.edu.ifba.scholargraph.core.ScholarGraph.ScholarGraphConfig;
import br.edu.ifba.scholargraph.llm.LLMFunction;
import br.edu.ifba.scholargraph.storage.EdgeStorage;
import br.edu.ifba.scholargraph.storage.ExtractionLogStorage;
import br.edu.ifba.scholargraph.storage.NodeStorage;
import br.edu.ifba.scholargraph.storage.NodeStorage.NodeUpsert;
import br.edu.ifba.scholargraph.storage.PaperStorage;
import br.edu.ifba.scholargraph.storage.PaperStorage.PaperReference;
import br.edu.ifba.scholargraph.storage.PaperStorage.ProcessingStatus;
import br.edu.ifba.scholargraph.utils.ExtractionEventLogger;

/**
 * Runs the extraction state machine for one paper.
 *
 * <p>Flow: {@code processing -> entity -> relationship -> validation -> persist -> completed}.
 * Any failure moves the paper to {@code failed} with the error message and is rethrown.
 * Every stage attempt leaves an {@link ExtractionRecord}; a failed run additionally
 * leaves a {@code pipeline} record.</p>
 */
public class ExtractionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    static final String ENTITY_SOURCE = "EntityExtractor";
    static final String RELATIONSHIP_SOURCE = "RelationshipExtractor";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final NodeStorage nodeStorage;
    private final EdgeStorage edgeStorage;
    private final PaperStorage paperStorage;
    private final ExtractionLogStorage extractionLogStorage;
    private final LLMFunction llmFunction;
    private final EntityResolver entityResolver;
    private final ExtractionValidator validator;
    private final ScholarGraphConfig config;
    private final ExtractionEventLogger eventLogger;

    public ExtractionOrchestrator(
            @NotNull NodeStorage nodeStorage,
            @NotNull EdgeStorage edgeStorage,
            @NotNull PaperStorage paperStorage,
            @NotNull ExtractionLogStorage extractionLogStorage,
            @NotNull LLMFunction llmFunction,
            @NotNull ScholarGraphConfig config) {
        this.nodeStorage = nodeStorage;
        this.edgeStorage = edgeStorage;
        this.paperStorage = paperStorage;
        this.extractionLogStorage = extractionLogStorage;
        this.llmFunction = llmFunction;
        this.config = config;
        this.entityResolver = new EntityResolver(nodeStorage, config.fuzzyCandidates(), config.minSimilarity());
        this.validator = new ExtractionValidator(config.strictEndpoints());
        this.eventLogger = new ExtractionEventLogger();
    }

    /**
     * Extracts, validates and persists the knowledge contained in {@code paper}.
     *
     * @param paper a stored paper with full text
     * @return analysis of the run; fails with the cause of the first failing step
     */
    public CompletableFuture<PaperAnalysis> process(@NotNull Paper paper) {
        if (!paper.hasFullText()) {
            return CompletableFuture.failedFuture(new ValidationException("Paper has no full text: " + paper.id()));
        }

        long start = System.currentTimeMillis();
        String text = ExtractionPrompts.truncate(paper.fullText(), config.maxTextLength());
        logger.info("Processing paper {} ({}), {} characters", paper.id(), paper.title(), paper.fullText().length());

        CompletableFuture<PaperAnalysis> run = paperStorage.updateStatus(paper.id(), ProcessingStatus.PROCESSING, null)
            .thenCompose(ignored -> extractEntities(paper, text))
            .thenCompose(entities -> extractRelationships(paper, entities, text)
                .thenCompose(relationships -> validate(paper, entities, relationships)))
            .thenCompose(validated -> persist(paper, validated, start))
            .thenCompose(analysis -> paperStorage.updateStatus(paper.id(), ProcessingStatus.COMPLETED, null)
                .thenCompose(ignored -> record(ExtractionRecord.success(paper.id(), ExtractionStage.PIPELINE,
                    snapshot(pipelineInput(paper)), snapshot(summary(analysis)), analysis.durationMs())))
                .thenApply(ignored -> analysis));

        return run.handle((analysis, error) -> {
            if (error == null) {
                logger.info("Completed paper {}: {} nodes, {} edges ({} unresolved, {} failed) in {} ms",
                    paper.id(), analysis.nodesUpserted(), analysis.edgesCreated(),
                    analysis.unresolvedRelationships(), analysis.failedRelationships(), analysis.durationMs());
                return CompletableFuture.completedFuture(analysis);
            }
            Throwable cause = unwrap(error);
            return markFailed(paper, cause, start)
                .thenCompose(ignored -> CompletableFuture.<PaperAnalysis>failedFuture(cause));
        }).thenCompose(Function.identity());
    }

    // ===== Stages =====

    private CompletableFuture<List<ExtractedEntity>> extractEntities(Paper paper, String text) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("title", paper.title());
        input.put("hasAbstract", paper.abstractText() != null && !paper.abstractText().isBlank());
        input.put("textLength", paper.fullText().length());
        input.put("truncated", paper.fullText().length() > config.maxTextLength());

        LLMFunction.Request request = new LLMFunction.Request(
            ExtractionPrompts.ENTITY_SYSTEM_PROMPT,
            ExtractionPrompts.entityUserPrompt(paper, text),
            config.entityTemperature(),
            config.entityMaxTokens(),
            true);

        return runStage(paper, ExtractionStage.ENTITY, input,
            () -> llmFunction.apply(request)
                .thenApply(response -> ExtractionResponseParser.parseEntities(response.content())),
            entities -> Map.of("entities", entities),
            entities -> entities.size() + " entities");
    }

    private CompletableFuture<List<ExtractedRelationship>> extractRelationships(Paper paper,
            List<ExtractedEntity> entities, String text) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("title", paper.title());
        input.put("entityCount", entities.size());
        input.put("entities", entities.stream().map(ExtractedEntity::name).collect(Collectors.toList()));

        return runStage(paper, ExtractionStage.RELATIONSHIP, input,
            () -> paperStorage.findRecentCompleted(config.knownPapersFetchLimit(), paper.id())
                .thenCompose(recent -> {
                    List<PaperReference> known = recent.size() > config.knownPapersPromptLimit()
                        ? recent.subList(0, config.knownPapersPromptLimit())
                        : recent;
                    logger.debug("Paper {}: {} known papers offered for cross-paper relationships",
                        paper.id(), known.size());
                    LLMFunction.Request request = new LLMFunction.Request(
                        ExtractionPrompts.RELATIONSHIP_SYSTEM_PROMPT,
                        ExtractionPrompts.relationshipUserPrompt(paper, entities, known, text),
                        config.relationshipTemperature(),
                        config.relationshipMaxTokens(),
                        true);
                    return llmFunction.apply(request);
                })
                .thenApply(response -> ExtractionResponseParser.parseRelationships(response.content())),
            relationships -> Map.of("relationships", relationships),
            relationships -> relationships.size() + " relationships");
    }

    private CompletableFuture<ExtractionValidator.Result> validate(Paper paper, List<ExtractedEntity> entities,
            List<ExtractedRelationship> relationships) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("entityCount", entities.size());
        input.put("relationshipCount", relationships.size());
        input.put("strictEndpoints", config.strictEndpoints());

        return runStage(paper, ExtractionStage.VALIDATION, input,
            () -> CompletableFuture.completedFuture(validator.validate(paper, entities, relationships)),
            result -> result,
            result -> result.entities().size() + " entities, " + result.relationships().size() + " relationships kept");
    }

    private CompletableFuture<PaperAnalysis> persist(Paper paper, ExtractionValidator.Result validated, long start) {
        List<NodeUpsert> upserts = validated.entities().stream()
            .map(ExtractionOrchestrator::toUpsert)
            .collect(Collectors.toList());

        return nodeStorage.batchUpsert(upserts)
            .thenCompose(localIds -> {
                ResolutionContext context = ResolutionContext.of(paper, localIds);
                return edgeStorage.batchCreateFromExtraction(validated.relationships(),
                        entityResolver.forPaper(context), RELATIONSHIP_SOURCE)
                    .thenApply(edges -> new PaperAnalysis(
                        validated.entities(),
                        validated.relationships(),
                        new HashSet<>(localIds.values()).size(),
                        edges.created(),
                        edges.unresolved(),
                        edges.failed(),
                        System.currentTimeMillis() - start));
            });
    }

    static NodeUpsert toUpsert(ExtractedEntity entity) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (entity.context() != null && !entity.context().isBlank()) {
            metadata.put("context", entity.context());
        }
        metadata.putAll(entity.metadata());
        return new NodeUpsert(entity.kind(), entity.name(), entity.description(), metadata, ENTITY_SOURCE,
            entity.confidence());
    }

    // ===== Records =====

    /**
     * Runs one stage and writes its record, success or failure. The record
     * write never changes the stage outcome.
     */
    private <T> CompletableFuture<T> runStage(Paper paper, ExtractionStage stage, Object input,
            Supplier<CompletableFuture<T>> work, Function<T, Object> output, Function<T, String> summary) {
        long started = System.currentTimeMillis();
        String inputSnapshot = snapshot(input);

        CompletableFuture<T> attempt;
        try {
            attempt = work.get();
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        return attempt.handle((result, error) -> {
            long duration = System.currentTimeMillis() - started;
            if (error != null) {
                Throwable cause = unwrap(error);
                eventLogger.logStageFailed(paper.id(), stage, duration, cause);
                return record(ExtractionRecord.failure(paper.id(), stage, inputSnapshot, describe(cause), duration))
                    .thenCompose(ignored -> CompletableFuture.<T>failedFuture(cause));
            }
            eventLogger.logStageCompleted(paper.id(), stage, duration, summary.apply(result));
            return record(ExtractionRecord.success(paper.id(), stage, inputSnapshot,
                    snapshot(output.apply(result)), duration))
                .thenApply(ignored -> result);
        }).thenCompose(Function.identity());
    }

    private CompletableFuture<Void> markFailed(Paper paper, Throwable cause, long start) {
        long duration = System.currentTimeMillis() - start;
        String message = describe(cause);
        logger.error("Processing failed for paper {} ({}): {}", paper.id(), paper.title(), message);

        return CompletableFuture.completedFuture((Void) null)
            .thenCompose(ignored -> paperStorage.updateStatus(paper.id(), ProcessingStatus.FAILED, message))
            .exceptionally(error -> {
                logger.error("Could not mark paper {} as failed: {}", paper.id(), describe(unwrap(error)));
                return null;
            })
            .thenCompose(ignored -> record(ExtractionRecord.failure(paper.id(), ExtractionStage.PIPELINE,
                snapshot(pipelineInput(paper)), message, duration)));
    }

    private CompletableFuture<Void> record(ExtractionRecord record) {
        return CompletableFuture.completedFuture(record)
            .thenCompose(extractionLogStorage::append)
            .exceptionally(error -> {
                eventLogger.logRecordWriteFailed(record.paperId(), record.stage(), unwrap(error));
                return null;
            });
    }

    private static Map<String, Object> pipelineInput(Paper paper) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("paperId", paper.id());
        input.put("title", paper.title());
        input.put("externalId", paper.externalId());
        return input;
    }

    private static Map<String, Object> summary(PaperAnalysis analysis) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("entities", analysis.entities().size());
        output.put("relationships", analysis.relationships().size());
        output.put("nodesUpserted", analysis.nodesUpserted());
        output.put("edgesCreated", analysis.edgesCreated());
        output.put("unresolvedRelationships", analysis.unresolvedRelationships());
        output.put("failedRelationships", analysis.failedRelationships());
        return output;
    }

    private static String snapshot(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize extraction snapshot: {}", e.getOriginalMessage());
            return null;
        }
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
