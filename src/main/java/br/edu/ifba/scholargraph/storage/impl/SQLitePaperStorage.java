package br.edu.ifba.scholargraph.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.exception.PersistenceException;
import br.edu.ifba.exception.ValidationException;
import br.edu.ifba.scholargraph.core.Canonicalizer;
import br.edu.ifba.scholargraph.core.NodeKind;
import br.edu.ifba.scholargraph.core.Paper;
import br.edu.ifba.scholargraph.core.PaperInput;
import br.edu.ifba.scholargraph.storage.NodeStorage.NodeUpsert;
import br.edu.ifba.scholargraph.storage.PaperStorage;

/**
 * SQLite implementation of {@link PaperStorage}.
 *
 * <p>Creating a paper upserts its backing node and the paper row in one write
 * transaction.</p>
 */
public final class SQLitePaperStorage implements PaperStorage {

    private static final Logger LOG = Logger.getLogger(SQLitePaperStorage.class);

    static final String PAPER_NODE_SOURCE = "system";

    private static final String SELECT_COLUMNS = """
        SELECT id, title, abstract, full_text, authors, external_id, doi, publication_date, venue,
               processing_status, last_error, processed_at, created_at, updated_at
        FROM papers
        """;

    private static final String INSERT_SQL = """
        INSERT INTO papers (id, title, abstract, full_text, authors, external_id, doi, publication_date, venue,
                            processing_status, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 'pending', ?, ?)
        ON CONFLICT(id) DO UPDATE SET
            title = excluded.title,
            abstract = excluded.abstract,
            full_text = COALESCE(excluded.full_text, papers.full_text),
            external_id = COALESCE(papers.external_id, excluded.external_id),
            doi = COALESCE(excluded.doi, papers.doi),
            publication_date = COALESCE(excluded.publication_date, papers.publication_date),
            venue = COALESCE(excluded.venue, papers.venue),
            updated_at = excluded.updated_at
        """;

    private static final String UPDATE_BY_EXTERNAL_ID_SQL = """
        UPDATE papers SET
            title = ?,
            abstract = ?,
            full_text = COALESCE(?, full_text),
            updated_at = ?
        WHERE id = ?
        """;

    private final SQLiteConnectionManager connectionManager;
    private final SQLiteNodeStorage nodeStorage;

    public SQLitePaperStorage(@NotNull SQLiteConnectionManager connectionManager, @NotNull SQLiteNodeStorage nodeStorage) {
        this.connectionManager = connectionManager;
        this.nodeStorage = nodeStorage;
    }

    @Override
    public CompletableFuture<Paper> create(@NotNull PaperInput input) {
        return CompletableFuture.supplyAsync(() -> {
            validate(input);
            String title = input.title().trim();
            String now = SQLiteJson.timestamp(Instant.now());

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);

                String paperId = input.externalId() != null ? findIdByExternalId(conn, input.externalId()) : null;
                if (paperId != null) {
                    try (PreparedStatement ps = conn.prepareStatement(UPDATE_BY_EXTERNAL_ID_SQL)) {
                        ps.setString(1, title);
                        ps.setString(2, input.abstractText());
                        ps.setString(3, input.fullText());
                        ps.setString(4, now);
                        ps.setString(5, paperId);
                        ps.executeUpdate();
                    }
                    LOG.debugf("Updated existing paper %s for external id %s", paperId, input.externalId());
                } else {
                    paperId = nodeStorage.upsertWithin(conn, paperNode(input, title));
                    String storedExternalId = findExternalIdById(conn, paperId);
                    if (input.externalId() != null && storedExternalId != null
                            && !storedExternalId.equals(input.externalId())) {
                        throw new ValidationException("Paper '" + title + "' already exists with external id "
                            + storedExternalId + "; refusing to merge external id " + input.externalId());
                    }
                    try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                        ps.setString(1, paperId);
                        ps.setString(2, title);
                        ps.setString(3, input.abstractText());
                        ps.setString(4, input.fullText());
                        ps.setString(5, SQLiteJson.writeList(input.authors()));
                        ps.setString(6, input.externalId());
                        ps.setString(7, input.doi());
                        ps.setString(8, input.publicationDate() != null ? input.publicationDate().toString() : null);
                        ps.setString(9, input.venue());
                        ps.setString(10, now);
                        ps.setString(11, now);
                        ps.executeUpdate();
                    }
                    LOG.debugf("Stored paper %s: %s", paperId, title);
                }

                Paper paper = selectById(conn, paperId);
                conn.commit();
                return paper;
            } catch (SQLException e) {
                SQLiteNodeStorage.rollbackQuietly(conn);
                throw new PersistenceException("Failed to create paper: " + title, e);
            } catch (RuntimeException e) {
                SQLiteNodeStorage.rollbackQuietly(conn);
                throw e;
            } finally {
                SQLiteNodeStorage.resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Paper> findById(@NotNull String id) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try {
                return selectById(conn, id);
            } catch (SQLException e) {
                throw new PersistenceException("Failed to get paper: " + id, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Paper> findByExternalId(@NotNull String externalId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE external_id = ?")) {
                ps.setString(1, externalId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapPaper(rs) : null;
                }
            } catch (SQLException e) {
                throw new PersistenceException("Failed to get paper by external id: " + externalId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<Paper>> findByStatus(@NotNull ProcessingStatus status) {
        return CompletableFuture.supplyAsync(() -> {
            List<Paper> papers = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(
                    SELECT_COLUMNS + " WHERE processing_status = ? ORDER BY created_at, id")) {
                ps.setString(1, status.value());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        papers.add(mapPaper(rs));
                    }
                }
                return papers;
            } catch (SQLException e) {
                throw new PersistenceException("Failed to list papers with status " + status.value(), e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<PaperReference>> findRecentCompleted(int limit, @Nullable String excludeId) {
        return CompletableFuture.supplyAsync(() -> {
            List<PaperReference> papers = new ArrayList<>();
            if (limit <= 0) {
                return papers;
            }
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT id, title, external_id FROM papers
                    WHERE processing_status = 'completed' AND id <> ?
                    ORDER BY publication_date IS NULL, publication_date DESC, processed_at DESC, id
                    LIMIT ?
                    """)) {
                ps.setString(1, excludeId != null ? excludeId : "");
                ps.setInt(2, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        papers.add(new PaperReference(rs.getString("id"), rs.getString("title"),
                            rs.getString("external_id")));
                    }
                }
                return papers;
            } catch (SQLException e) {
                throw new PersistenceException("Failed to list completed papers", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> updateStatus(@NotNull String id, @NotNull ProcessingStatus status, @Nullable String error) {
        return CompletableFuture.runAsync(() -> {
            String now = SQLiteJson.timestamp(Instant.now());
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement ps = conn.prepareStatement("""
                    UPDATE papers SET
                        processing_status = ?,
                        last_error = ?,
                        processed_at = CASE ?
                            WHEN 'completed' THEN ?
                            WHEN 'processing' THEN NULL
                            ELSE processed_at
                        END,
                        updated_at = ?
                    WHERE id = ?
                    """)) {
                ps.setString(1, status.value());
                ps.setString(2, status == ProcessingStatus.FAILED ? error : null);
                ps.setString(3, status.value());
                ps.setString(4, now);
                ps.setString(5, now);
                ps.setString(6, id);
                if (ps.executeUpdate() == 0) {
                    throw new ValidationException("Paper not found: " + id);
                }
                LOG.debugf("Paper %s is now %s", id, status.value());
            } catch (SQLException e) {
                throw new PersistenceException("Failed to update status of paper " + id, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Map<ProcessingStatus, Long>> countByStatus() {
        return CompletableFuture.supplyAsync(() -> {
            Map<ProcessingStatus, Long> counts = new EnumMap<>(ProcessingStatus.class);
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT processing_status, COUNT(*) FROM papers GROUP BY processing_status");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String value = rs.getString(1);
                    ProcessingStatus status = ProcessingStatus.fromValue(value)
                        .orElseThrow(() -> new PersistenceException("Unknown processing status: " + value));
                    counts.put(status, rs.getLong(2));
                }
                return counts;
            } catch (SQLException e) {
                throw new PersistenceException("Failed to count papers", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private static void validate(PaperInput input) {
        if (input == null) {
            throw new ValidationException("Paper input cannot be null");
        }
        if (input.title() == null || Canonicalizer.normalize(input.title()).isEmpty()) {
            throw new ValidationException("Paper title is required");
        }
        if (input.externalId() != null && input.externalId().isBlank()) {
            throw new ValidationException("External id cannot be blank when present");
        }
    }

    private static NodeUpsert paperNode(PaperInput input, String title) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("abstract", input.abstractText());
        metadata.put("authors", input.authors());
        metadata.put("venue", input.venue());
        return new NodeUpsert(NodeKind.PAPER, title, null, metadata, PAPER_NODE_SOURCE, 1.0);
    }

    private String findIdByExternalId(Connection conn, String externalId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM papers WHERE external_id = ?")) {
            ps.setString(1, externalId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private String findExternalIdById(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT external_id FROM papers WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private Paper selectById(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapPaper(rs) : null;
            }
        }
    }

    private Paper mapPaper(ResultSet rs) throws SQLException {
        String status = rs.getString("processing_status");
        String publicationDate = rs.getString("publication_date");
        return new Paper(
            rs.getString("id"),
            rs.getString("title"),
            rs.getString("abstract"),
            rs.getString("full_text"),
            SQLiteJson.readList(rs.getString("authors")),
            rs.getString("external_id"),
            rs.getString("doi"),
            publicationDate != null ? LocalDate.parse(publicationDate) : null,
            rs.getString("venue"),
            ProcessingStatus.fromValue(status)
                .orElseThrow(() -> new PersistenceException("Unknown processing status: " + status)),
            rs.getString("last_error"),
            SQLiteJson.parseTimestamp(rs.getString("processed_at")),
            SQLiteJson.parseTimestamp(rs.getString("created_at")),
            SQLiteJson.parseTimestamp(rs.getString("updated_at"))
        );
    }
}
