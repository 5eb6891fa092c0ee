package br.edu.ifba.scholargraph.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.exception.PersistenceException;
import br.edu.ifba.exception.ValidationException;
import br.edu.ifba.scholargraph.core.Canonicalizer;
import br.edu.ifba.scholargraph.core.Confidence;
import br.edu.ifba.scholargraph.core.NameSimilarity;
import br.edu.ifba.scholargraph.core.Node;
import br.edu.ifba.scholargraph.core.NodeKind;
import br.edu.ifba.scholargraph.storage.NodeStorage;

/**
 * SQLite implementation of {@link NodeStorage}.
 *
 * <p>The merge is a single {@code INSERT ... ON CONFLICT(kind, canonical_name) DO UPDATE}
 * statement, so SQLite resolves each conflict atomically per row.</p>
 */
public final class SQLiteNodeStorage implements NodeStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteNodeStorage.class);

    // candidates fetched by the substring filter before similarity ranking
    private static final int FUZZY_CANDIDATE_POOL = 200;

    private static final String UPSERT_SQL = """
        INSERT INTO nodes (id, kind, name, canonical_name, description, metadata, confidence, source, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(kind, canonical_name) DO UPDATE SET
            description = CASE
                WHEN nodes.description IS NULL OR nodes.description = '' THEN excluded.description
                ELSE nodes.description
            END,
            metadata = metadata_merge(nodes.metadata, excluded.metadata),
            confidence = MAX(nodes.confidence, excluded.confidence),
            updated_at = excluded.updated_at
        """;

    private static final String SELECT_COLUMNS = """
        SELECT id, kind, name, canonical_name, description, metadata, confidence, source, created_at, updated_at
        FROM nodes
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteNodeStorage(@NotNull SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<String> upsert(@NotNull NodeUpsert node) {
        return CompletableFuture.supplyAsync(() -> {
            validate(node);
            Connection conn = connectionManager.getWriteConnection();
            try {
                return upsertWithin(conn, node);
            } catch (SQLException e) {
                throw new PersistenceException("Failed to upsert node: " + node.name(), e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Map<String, String>> batchUpsert(@NotNull List<NodeUpsert> nodes) {
        return CompletableFuture.supplyAsync(() -> {
            nodes.forEach(SQLiteNodeStorage::validate);
            Map<String, String> ids = new LinkedHashMap<>();
            if (nodes.isEmpty()) {
                return ids;
            }

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                for (NodeUpsert node : nodes) {
                    ids.put(Canonicalizer.normalize(node.name()), upsertWithin(conn, node));
                }
                conn.commit();
                LOG.debugf("Batch upserted %d nodes", nodes.size());
                return ids;
            } catch (SQLException e) {
                rollbackQuietly(conn);
                throw new PersistenceException("Failed to batch upsert " + nodes.size() + " nodes", e);
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    /**
     * Runs the upsert on a connection the caller already holds, inside the
     * caller's transaction if one is open.
     *
     * @return id of the created or merged node
     */
    String upsertWithin(Connection conn, NodeUpsert node) throws SQLException {
        String canonicalName = Canonicalizer.normalize(node.name());
        String now = SQLiteJson.timestamp(Instant.now());

        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, UUID.randomUUID().toString());
            ps.setString(2, node.kind().value());
            ps.setString(3, node.name().trim());
            ps.setString(4, canonicalName);
            ps.setString(5, blankToNull(node.description()));
            ps.setString(6, SQLiteJson.writeMetadata(node.metadata()));
            ps.setDouble(7, Confidence.clamp(node.confidence()));
            ps.setString(8, node.source());
            ps.setString(9, now);
            ps.setString(10, now);
            ps.executeUpdate();
        }

        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id FROM nodes WHERE kind = ? AND canonical_name = ?")) {
            ps.setString(1, node.kind().value());
            ps.setString(2, canonicalName);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new PersistenceException("Upserted node vanished: " + node.kind().value() + "/" + canonicalName);
                }
                return rs.getString(1);
            }
        }
    }

    @Override
    public CompletableFuture<Node> findById(@NotNull String id) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapNode(rs) : null;
                }
            } catch (SQLException e) {
                throw new PersistenceException("Failed to get node: " + id, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Node> findByKindAndName(@NotNull NodeKind kind, @NotNull String name) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(
                    SELECT_COLUMNS + " WHERE kind = ? AND canonical_name = ?")) {
                ps.setString(1, kind.value());
                ps.setString(2, Canonicalizer.normalize(name));
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapNode(rs) : null;
                }
            } catch (SQLException e) {
                throw new PersistenceException("Failed to get node: " + kind.value() + "/" + name, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<NodeMatch>> fuzzySearch(@NotNull String query, @Nullable NodeKind kind, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            String canonicalQuery = Canonicalizer.normalize(query);
            if (canonicalQuery.isEmpty() || limit <= 0) {
                return List.of();
            }

            String sql = SELECT_COLUMNS
                + " WHERE canonical_name LIKE ? ESCAPE '\\'"
                + (kind != null ? " AND kind = ?" : "")
                + " ORDER BY length(canonical_name), id LIMIT ?";

            List<NodeMatch> matches = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int index = 1;
                ps.setString(index++, "%" + escapeLike(canonicalQuery) + "%");
                if (kind != null) {
                    ps.setString(index++, kind.value());
                }
                ps.setInt(index, FUZZY_CANDIDATE_POOL);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        Node node = mapNode(rs);
                        matches.add(new NodeMatch(node, NameSimilarity.score(canonicalQuery, node.canonicalName())));
                    }
                }
            } catch (SQLException e) {
                throw new PersistenceException("Failed to search nodes for: " + query, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }

            matches.sort(Comparator.comparingDouble(NodeMatch::score).reversed()
                .thenComparing(match -> match.node().canonicalName().length())
                .thenComparing(match -> match.node().id()));
            return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
        });
    }

    @Override
    public CompletableFuture<Map<NodeKind, Long>> countByKind() {
        return CompletableFuture.supplyAsync(() -> {
            Map<NodeKind, Long> counts = new EnumMap<>(NodeKind.class);
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement("SELECT kind, COUNT(*) FROM nodes GROUP BY kind");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(NodeKind.require(rs.getString(1)), rs.getLong(2));
                }
                return counts;
            } catch (SQLException e) {
                throw new PersistenceException("Failed to count nodes", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    static void validate(NodeUpsert node) {
        if (node == null) {
            throw new ValidationException("Node cannot be null");
        }
        if (node.kind() == null) {
            throw new ValidationException("Node kind is required");
        }
        if (node.name() == null || Canonicalizer.normalize(node.name()).isEmpty()) {
            throw new ValidationException("Node name cannot be empty");
        }
    }

    private Node mapNode(ResultSet rs) throws SQLException {
        return new Node(
            rs.getString("id"),
            NodeKind.require(rs.getString("kind")),
            rs.getString("name"),
            rs.getString("canonical_name"),
            rs.getString("description"),
            SQLiteJson.readMetadata(rs.getString("metadata")),
            rs.getDouble("confidence"),
            rs.getString("source"),
            SQLiteJson.parseTimestamp(rs.getString("created_at")),
            SQLiteJson.parseTimestamp(rs.getString("updated_at"))
        );
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed", e);
        }
    }

    static void resetAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Failed to restore auto-commit", e);
        }
    }
}
