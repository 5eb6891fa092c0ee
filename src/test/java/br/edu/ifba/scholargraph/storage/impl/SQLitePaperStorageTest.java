package br.edu.ifba.scholargraph.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.exception.ValidationException;
import br.edu.ifba.scholargraph.core.Node;
import br.edu.ifba.scholargraph.core.NodeKind;
import br.edu.ifba.scholargraph.core.Paper;
import br.edu.ifba.scholargraph.core.PaperInput;
import br.edu.ifba.scholargraph.storage.PaperStorage.PaperReference;
import br.edu.ifba.scholargraph.storage.PaperStorage.ProcessingStatus;

/**
 * Unit tests for SQLitePaperStorage.
 */
class SQLitePaperStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteNodeStorage nodeStorage;
    private SQLitePaperStorage paperStorage;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = TestDatabase.open(tempDir);
        nodeStorage = new SQLiteNodeStorage(connectionManager);
        paperStorage = new SQLitePaperStorage(connectionManager, nodeStorage);
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    private static PaperInput.Builder gaussianSplattingPaper() {
        return PaperInput.builder()
            .title("3D Gaussian Splatting for Real-Time Radiance Field Rendering")
            .abstractText("Radiance field methods have recently revolutionized novel-view synthesis.")
            .fullText("We introduce three key elements ...")
            .author("Bernhard Kerbl")
            .author("Georgios Kopanas")
            .externalId("2308.04079")
            .publicationDate(LocalDate.of(2023, 8, 8))
            .venue("SIGGRAPH");
    }

    // ===== Create =====

    @Nested
    @DisplayName("Paper creation")
    class CreateTests {

        @Test
        @DisplayName("A new paper is pending and backed by a paper node")
        void testCreateNewPaper() {
            Paper paper = paperStorage.create(gaussianSplattingPaper().build()).join();

            assertEquals(ProcessingStatus.PENDING, paper.processingStatus());
            assertEquals(List.of("Bernhard Kerbl", "Georgios Kopanas"), paper.authors());
            assertEquals(LocalDate.of(2023, 8, 8), paper.publicationDate());
            assertNull(paper.processedAt());

            Node node = nodeStorage.findById(paper.id()).join();
            assertNotNull(node, "Paper should share its id with a paper node");
            assertEquals(NodeKind.PAPER, node.kind());
            assertEquals(1.0, node.confidence(), 1e-9);
            assertEquals("system", node.source());
            assertEquals("SIGGRAPH", node.metadata().get("venue"));
        }

        @Test
        @DisplayName("Re-ingesting a known external id updates the paper in place")
        void testCreateByExternalIdUpdatesInPlace() {
            Paper original = paperStorage.create(gaussianSplattingPaper().build()).join();
            Paper updated = paperStorage.create(gaussianSplattingPaper()
                .abstractText("Updated abstract")
                .fullText(null)
                .build()).join();

            assertEquals(original.id(), updated.id());
            assertEquals("Updated abstract", updated.abstractText());
            assertEquals("We introduce three key elements ...", updated.fullText(), "Missing full text keeps the stored one");
            assertEquals(1L, paperStorage.countByStatus().join().get(ProcessingStatus.PENDING));
        }

        @Test
        @DisplayName("A paper without external id converges on its title node")
        void testCreateWithoutExternalIdConverges() {
            PaperInput input = PaperInput.builder().title("Mip-NeRF 360").fullText("text").build();

            Paper first = paperStorage.create(input).join();
            Paper second = paperStorage.create(input).join();

            assertEquals(first.id(), second.id());
            assertEquals(1L, nodeStorage.countByKind().join().get(NodeKind.PAPER));
        }

        @Test
        @DisplayName("Same title under another external id is rejected and leaves the stored paper untouched")
        void testSameTitleDifferentExternalIdRejected() {
            Paper first = paperStorage.create(PaperInput.builder().title("A Survey of Gaussian Splatting")
                .externalId("2401.03890").fullText("text of the first survey").build()).join();

            CompletionException error = assertThrows(CompletionException.class,
                () -> paperStorage.create(PaperInput.builder().title("A survey of Gaussian splatting!")
                    .externalId("2403.11134").fullText("text of the second survey").build()).join());

            assertInstanceOf(ValidationException.class, error.getCause());
            Paper stored = paperStorage.findById(first.id()).join();
            assertEquals("2401.03890", stored.externalId());
            assertEquals("A Survey of Gaussian Splatting", stored.title());
            assertEquals("text of the first survey", stored.fullText());
            assertNull(paperStorage.findByExternalId("2403.11134").join());
            assertEquals(1L, nodeStorage.countByKind().join().get(NodeKind.PAPER));
        }

        @Test
        @DisplayName("A paper without external id may adopt one on a later create")
        void testExternalIdAdoptedByTitleMatch() {
            Paper first = paperStorage.create(PaperInput.builder().title("Plenoxels").build()).join();
            Paper second = paperStorage.create(PaperInput.builder().title("Plenoxels").externalId("2112.05131").build()).join();

            assertEquals(first.id(), second.id());
            assertEquals("2112.05131", second.externalId());
        }

        @Test
        @DisplayName("A blank title is rejected")
        void testBlankTitleRejected() {
            CompletionException error = assertThrows(CompletionException.class,
                () -> paperStorage.create(PaperInput.builder().title("  ").build()).join());

            assertInstanceOf(ValidationException.class, error.getCause());
            assertTrue(nodeStorage.countByKind().join().isEmpty());
        }

        @Test
        @DisplayName("Authors default to an empty list")
        void testAuthorsDefaultToEmpty() {
            Paper paper = paperStorage.create(PaperInput.builder().title("Plenoxels").build()).join();

            assertTrue(paper.authors().isEmpty());
            assertFalse(paper.hasFullText());
        }
    }

    // ===== Status =====

    @Nested
    @DisplayName("Processing status")
    class StatusTests {

        @Test
        @DisplayName("processed_at is set on completion and cleared when processing restarts")
        void testProcessedAtLifecycle() {
            Paper paper = paperStorage.create(gaussianSplattingPaper().build()).join();

            paperStorage.updateStatus(paper.id(), ProcessingStatus.PROCESSING, null).join();
            assertNull(paperStorage.findById(paper.id()).join().processedAt());

            paperStorage.updateStatus(paper.id(), ProcessingStatus.COMPLETED, null).join();
            Paper completed = paperStorage.findById(paper.id()).join();
            assertEquals(ProcessingStatus.COMPLETED, completed.processingStatus());
            assertNotNull(completed.processedAt());

            paperStorage.updateStatus(paper.id(), ProcessingStatus.PROCESSING, null).join();
            assertNull(paperStorage.findById(paper.id()).join().processedAt());
        }

        @Test
        @DisplayName("The last error is kept only while the paper is failed")
        void testLastError() {
            Paper paper = paperStorage.create(gaussianSplattingPaper().build()).join();

            paperStorage.updateStatus(paper.id(), ProcessingStatus.FAILED, "rate limited").join();
            assertEquals("rate limited", paperStorage.findById(paper.id()).join().lastError());
            assertEquals(1, paperStorage.findByStatus(ProcessingStatus.FAILED).join().size());

            paperStorage.updateStatus(paper.id(), ProcessingStatus.PROCESSING, null).join();
            assertNull(paperStorage.findById(paper.id()).join().lastError());
        }

        @Test
        @DisplayName("Updating an unknown paper fails")
        void testUpdateUnknownPaper() {
            CompletionException error = assertThrows(CompletionException.class,
                () -> paperStorage.updateStatus("missing", ProcessingStatus.COMPLETED, null).join());

            assertInstanceOf(ValidationException.class, error.getCause());
        }
    }

    // ===== Queries =====

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Recent completed papers are ordered by publication date and exclude the given paper")
        void testFindRecentCompleted() {
            Paper older = complete(PaperInput.builder().title("NeRF").externalId("2003.08934")
                .publicationDate(LocalDate.of(2020, 3, 19)).build());
            Paper newer = complete(gaussianSplattingPaper().build());
            Paper undated = complete(PaperInput.builder().title("Instant-NGP").externalId("2201.05989").build());
            paperStorage.create(PaperInput.builder().title("Pending paper").build()).join();

            List<PaperReference> recent = paperStorage.findRecentCompleted(10, null).join();
            assertEquals(List.of(newer.id(), older.id(), undated.id()), recent.stream().map(PaperReference::id).toList());

            List<PaperReference> excluding = paperStorage.findRecentCompleted(10, newer.id()).join();
            assertEquals(List.of(older.id(), undated.id()), excluding.stream().map(PaperReference::id).toList());

            assertEquals(1, paperStorage.findRecentCompleted(1, null).join().size());
        }

        @Test
        @DisplayName("Papers are found by external id and counted by status")
        void testFindByExternalIdAndCounts() {
            Paper paper = paperStorage.create(gaussianSplattingPaper().build()).join();
            paperStorage.create(PaperInput.builder().title("Zip-NeRF").build()).join();
            paperStorage.updateStatus(paper.id(), ProcessingStatus.COMPLETED, null).join();

            assertEquals(paper.id(), paperStorage.findByExternalId("2308.04079").join().id());
            assertNull(paperStorage.findByExternalId("0000.00000").join());

            Map<ProcessingStatus, Long> counts = paperStorage.countByStatus().join();
            assertEquals(1L, counts.get(ProcessingStatus.COMPLETED));
            assertEquals(1L, counts.get(ProcessingStatus.PENDING));
        }

        private Paper complete(PaperInput input) {
            Paper paper = paperStorage.create(input).join();
            paperStorage.updateStatus(paper.id(), ProcessingStatus.COMPLETED, null).join();
            return paper;
        }
    }
}
