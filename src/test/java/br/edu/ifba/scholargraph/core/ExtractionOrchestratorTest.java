package br.edu.ifba.scholargraph.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.exception.ExternalServiceException;
import br.edu.ifba.exception.ExtractionParseException;
import br.edu.ifba.exception.PersistenceException;
import br.edu.ifba.exception.ValidationException;
import br.edu.ifba.scholargraph.core.ScholarGraph.ScholarGraphConfig;
import br.edu.ifba.scholargraph.llm.LLMFunction;
import br.edu.ifba.scholargraph.storage.EdgeStorage;
import br.edu.ifba.scholargraph.storage.ExtractionLogStorage;
import br.edu.ifba.scholargraph.storage.PaperStorage.ProcessingStatus;
import br.edu.ifba.scholargraph.storage.impl.SQLiteConnectionManager;
import br.edu.ifba.scholargraph.storage.impl.SQLiteEdgeStorage;
import br.edu.ifba.scholargraph.storage.impl.SQLiteExtractionLogStorage;
import br.edu.ifba.scholargraph.storage.impl.SQLiteNodeStorage;
import br.edu.ifba.scholargraph.storage.impl.SQLitePaperStorage;
import br.edu.ifba.scholargraph.storage.impl.TestDatabase;

/**
 * Tests for {@link ExtractionOrchestrator} against a real SQLite database and a scripted model.
 */
class ExtractionOrchestratorTest {

    static final String TITLE = "3D Gaussian Splatting for Real-Time Radiance Field Rendering";

    static final String ENTITIES = """
        {"entities": [
          {"name": "NeRF", "type": "method", "description": "Neural radiance fields", "confidence": 0.9,
           "context": "compared against NeRF baselines"},
          {"name": "PSNR", "type": "metric", "confidence": 0.8},
          {"name": "Tile-based Rasterizer", "type": "technique", "confidence": 0.7, "metadata": {"section": "Method"}}
        ]}
        """;

    static final String RELATIONSHIPS = """
        {"relationships": [
          {"source": "%s", "target": "NeRF", "type": "outperforms", "evidence": "real-time at 1080p", "confidence": 0.9},
          {"source": "NeRF", "target": "PSNR", "type": "measures_with", "confidence": 0.6},
          {"source": "Tile-based Rasterizer", "target": "Differentiable Splats", "type": "enables", "confidence": 0.5}
        ]}
        """.formatted(TITLE);

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteNodeStorage nodeStorage;
    private SQLiteEdgeStorage edgeStorage;
    private SQLitePaperStorage paperStorage;
    private SQLiteExtractionLogStorage logStorage;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = TestDatabase.open(tempDir);
        nodeStorage = new SQLiteNodeStorage(connectionManager);
        edgeStorage = new SQLiteEdgeStorage(connectionManager);
        paperStorage = new SQLitePaperStorage(connectionManager, nodeStorage);
        logStorage = new SQLiteExtractionLogStorage(connectionManager);
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    private ExtractionOrchestrator orchestrator(LLMFunction llm, ScholarGraphConfig config) {
        return new ExtractionOrchestrator(nodeStorage, edgeStorage, paperStorage, logStorage, llm, config);
    }

    private Paper storedPaper() {
        return paperStorage.create(PaperInput.builder()
            .title(TITLE)
            .externalId("2308.04079")
            .fullText("Radiance Field methods have recently revolutionized novel-view synthesis ...")
            .build()).join();
    }

    private List<ExtractionStage> stages(String paperId) {
        return logStorage.findByPaper(paperId).join().stream().map(ExtractionRecord::stage).toList();
    }

    // ===== Successful runs =====

    @Nested
    @DisplayName("Successful extraction")
    class SuccessTests {

        @Test
        @DisplayName("A paper moves to completed with one record per stage")
        void testCompletedRun() {
            Paper paper = storedPaper();
            ScriptedLlm llm = ScriptedLlm.answering(ENTITIES, RELATIONSHIPS);

            PaperAnalysis analysis = orchestrator(llm, ScholarGraphConfig.defaults()).process(paper).join();

            assertEquals(3, analysis.entities().size());
            assertEquals(3, analysis.nodesUpserted());
            assertEquals(2, analysis.edgesCreated());
            assertEquals(1, analysis.unresolvedRelationships());
            assertEquals(0, analysis.failedRelationships());

            Paper stored = paperStorage.findById(paper.id()).join();
            assertEquals(ProcessingStatus.COMPLETED, stored.processingStatus());
            assertNotNull(stored.processedAt());
            assertNull(stored.lastError());

            assertEquals(List.of(ExtractionStage.ENTITY, ExtractionStage.RELATIONSHIP,
                ExtractionStage.VALIDATION, ExtractionStage.PIPELINE), stages(paper.id()));
            assertTrue(logStorage.findByPaper(paper.id()).join().stream().allMatch(ExtractionRecord::success));
        }

        @Test
        @DisplayName("Nodes and edges carry their extractor as source")
        void testPersistedProvenance() {
            Paper paper = storedPaper();

            orchestrator(ScriptedLlm.answering(ENTITIES, RELATIONSHIPS), ScholarGraphConfig.defaults()).process(paper).join();

            Node nerf = nodeStorage.findByKindAndName(NodeKind.METHOD, "nerf").join();
            assertEquals("EntityExtractor", nerf.source());
            assertEquals("compared against NeRF baselines", nerf.metadata().get("context"));

            Node rasterizer = nodeStorage.findByKindAndName(NodeKind.TECHNIQUE, "Tile-based Rasterizer").join();
            assertEquals("Method", rasterizer.metadata().get("section"));

            List<Edge> outgoing = edgeStorage.findByEndpoint(paper.id(), EdgeDirection.OUTGOING, EdgeKind.OUTPERFORMS).join();
            assertEquals(1, outgoing.size());
            assertEquals(nerf.id(), outgoing.get(0).targetId());
            assertEquals("RelationshipExtractor", outgoing.get(0).source());
            assertEquals("real-time at 1080p", outgoing.get(0).evidence());
        }

        @Test
        @DisplayName("Stage requests use the configured sampling settings")
        void testRequestSettings() {
            ScriptedLlm llm = ScriptedLlm.answering(ENTITIES, RELATIONSHIPS);

            orchestrator(llm, ScholarGraphConfig.defaults()).process(storedPaper()).join();

            LLMFunction.Request entityRequest = llm.requests().get(0);
            assertEquals(0.3, entityRequest.temperature(), 1e-9);
            assertEquals(4000, entityRequest.maxOutputTokens());
            assertTrue(entityRequest.structuredOutputRequired());
            assertEquals(0.2, llm.lastRelationshipRequest().temperature(), 1e-9);
        }

        @Test
        @DisplayName("Strict endpoints drop relationships with an unknown endpoint")
        void testStrictEndpoints() {
            Paper paper = storedPaper();

            PaperAnalysis analysis = orchestrator(ScriptedLlm.answering(ENTITIES, RELATIONSHIPS),
                ScholarGraphConfig.defaults().withStrictEndpoints(true)).process(paper).join();

            assertEquals(2, analysis.relationships().size());
            assertEquals(2, analysis.edgesCreated());
            assertEquals(0, analysis.unresolvedRelationships());
        }

        @Test
        @DisplayName("Completed papers are offered as known papers, up to the prompt limit")
        void testKnownPapersInPrompt() {
            for (String title : List.of("NeRF: Representing Scenes as Neural Radiance Fields", "Mip-NeRF 360")) {
                Paper other = paperStorage.create(PaperInput.builder().title(title).build()).join();
                paperStorage.updateStatus(other.id(), ProcessingStatus.COMPLETED, null).join();
            }
            ScriptedLlm llm = ScriptedLlm.answering(ENTITIES, RELATIONSHIPS);
            ScholarGraphConfig config = new ScholarGraphConfig(15000, 100, 1, 0.3, 4000, 0.2, 4000,
                false, 5, 0.0, 5, 0);

            orchestrator(llm, config).process(storedPaper()).join();

            String prompt = llm.lastRelationshipRequest().content();
            assertTrue(prompt.contains("KNOWN PAPERS IN KNOWLEDGE GRAPH:"));
            long listed = prompt.lines().filter(line -> line.equals("- Mip-NeRF 360")
                || line.equals("- NeRF: Representing Scenes as Neural Radiance Fields")).count();
            assertEquals(1, listed);
        }

        @Test
        @DisplayName("Full text beyond the limit is truncated in the prompts")
        void testTextTruncation() {
            ScriptedLlm llm = ScriptedLlm.answering(ENTITIES, RELATIONSHIPS);
            ScholarGraphConfig config = new ScholarGraphConfig(20, 100, 50, 0.3, 4000, 0.2, 4000,
                false, 5, 0.0, 5, 0);

            orchestrator(llm, config).process(storedPaper()).join();

            assertTrue(llm.requests().get(0).content().contains(ExtractionPrompts.TRUNCATION_MARKER));
        }
    }

    // ===== Failures =====

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("A failing relationship stage marks the paper failed and records the failure")
        void testRelationshipStageFailure() {
            Paper paper = storedPaper();
            ScriptedLlm llm = ScriptedLlm.failingRelationships(ENTITIES,
                new ExternalServiceException("rate limited", 429, true));

            CompletionException error = assertThrows(CompletionException.class,
                () -> orchestrator(llm, ScholarGraphConfig.defaults()).process(paper).join());
            assertInstanceOf(ExternalServiceException.class, error.getCause());

            Paper stored = paperStorage.findById(paper.id()).join();
            assertEquals(ProcessingStatus.FAILED, stored.processingStatus());
            assertEquals("rate limited", stored.lastError());

            List<ExtractionRecord> records = logStorage.findByPaper(paper.id()).join();
            assertEquals(List.of(ExtractionStage.ENTITY, ExtractionStage.RELATIONSHIP, ExtractionStage.PIPELINE),
                records.stream().map(ExtractionRecord::stage).toList());
            assertTrue(records.get(0).success());
            assertFalse(records.get(1).success());
            assertEquals("rate limited", records.get(1).error());
            assertFalse(records.get(2).success());

            assertEquals(1L, nodeStorage.countByKind().join().values().stream().mapToLong(Long::longValue).sum(),
                "Only the paper node exists; entities are persisted after validation");
        }

        @Test
        @DisplayName("Malformed entity output fails the entity stage")
        void testMalformedEntityOutput() {
            Paper paper = storedPaper();

            CompletionException error = assertThrows(CompletionException.class,
                () -> orchestrator(ScriptedLlm.answering("I could not find any entities.", RELATIONSHIPS),
                    ScholarGraphConfig.defaults()).process(paper).join());

            assertInstanceOf(ExtractionParseException.class, error.getCause());
            assertEquals(List.of(ExtractionStage.ENTITY, ExtractionStage.PIPELINE), stages(paper.id()));
            assertEquals(ProcessingStatus.FAILED, paperStorage.findById(paper.id()).join().processingStatus());
        }

        @Test
        @DisplayName("A paper without full text is rejected without changing its status")
        void testMissingFullText() {
            Paper paper = paperStorage.create(PaperInput.builder().title("Plenoxels").build()).join();

            CompletionException error = assertThrows(CompletionException.class,
                () -> orchestrator(ScriptedLlm.answering(ENTITIES, RELATIONSHIPS), ScholarGraphConfig.defaults())
                    .process(paper).join());

            assertInstanceOf(ValidationException.class, error.getCause());
            assertEquals(ProcessingStatus.PENDING, paperStorage.findById(paper.id()).join().processingStatus());
            assertTrue(stages(paper.id()).isEmpty());
        }

        @Test
        @DisplayName("Lost record writes never fail the paper")
        void testRecordWriteFailureIsIgnored() {
            ExtractionLogStorage brokenLog = mock(ExtractionLogStorage.class);
            when(brokenLog.append(any())).thenReturn(CompletableFuture.failedFuture(new PersistenceException("disk full")));
            Paper paper = storedPaper();

            PaperAnalysis analysis = new ExtractionOrchestrator(nodeStorage, edgeStorage, paperStorage, brokenLog,
                ScriptedLlm.answering(ENTITIES, RELATIONSHIPS), ScholarGraphConfig.defaults()).process(paper).join();

            assertEquals(2, analysis.edgesCreated());
            assertEquals(ProcessingStatus.COMPLETED, paperStorage.findById(paper.id()).join().processingStatus());
            verify(brokenLog, atLeastOnce()).append(any());
        }

        @Test
        @DisplayName("An edge store failure during persistence fails the paper")
        void testPersistenceFailure() {
            EdgeStorage brokenEdges = mock(EdgeStorage.class);
            when(brokenEdges.batchCreateFromExtraction(any(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new PersistenceException("database is locked")));
            Paper paper = storedPaper();

            CompletionException error = assertThrows(CompletionException.class,
                () -> new ExtractionOrchestrator(nodeStorage, brokenEdges, paperStorage, logStorage,
                    ScriptedLlm.answering(ENTITIES, RELATIONSHIPS), ScholarGraphConfig.defaults()).process(paper).join());

            assertInstanceOf(PersistenceException.class, error.getCause());
            Paper stored = paperStorage.findById(paper.id()).join();
            assertEquals(ProcessingStatus.FAILED, stored.processingStatus());
            assertEquals("database is locked", stored.lastError());
        }
    }
}
