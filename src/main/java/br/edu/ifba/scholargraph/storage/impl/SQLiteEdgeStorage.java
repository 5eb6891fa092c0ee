package br.edu.ifba.scholargraph.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.exception.PersistenceException;
import br.edu.ifba.exception.ValidationException;
import br.edu.ifba.scholargraph.core.Confidence;
import br.edu.ifba.scholargraph.core.Edge;
import br.edu.ifba.scholargraph.core.EdgeDirection;
import br.edu.ifba.scholargraph.core.EdgeKind;
import br.edu.ifba.scholargraph.core.EndpointResolver;
import br.edu.ifba.scholargraph.core.ExtractedRelationship;
import br.edu.ifba.scholargraph.storage.EdgeStorage;

/**
 * SQLite implementation of {@link EdgeStorage}.
 */
public final class SQLiteEdgeStorage implements EdgeStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteEdgeStorage.class);

    private static final String UPSERT_SQL = """
        INSERT INTO edges (id, kind, source_id, target_id, description, evidence, confidence, metadata, source, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(kind, source_id, target_id) DO UPDATE SET
            description = CASE
                WHEN (edges.description IS NULL OR edges.description = '') THEN excluded.description
                ELSE edges.description
            END,
            evidence = CASE
                WHEN (edges.evidence IS NULL OR edges.evidence = '') THEN excluded.evidence
                ELSE edges.evidence
            END,
            confidence = MAX(edges.confidence, excluded.confidence),
            metadata = metadata_merge(edges.metadata, excluded.metadata),
            updated_at = excluded.updated_at
        """;

    private static final String SELECT_COLUMNS = """
        SELECT id, kind, source_id, target_id, description, evidence, confidence, metadata, source, created_at, updated_at
        FROM edges
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteEdgeStorage(@NotNull SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<String> create(@NotNull EdgeKind kind, @NotNull String sourceId, @NotNull String targetId,
            @Nullable String description, @Nullable String evidence, double confidence,
            @Nullable Map<String, Object> metadata, @Nullable String source) {
        return CompletableFuture.supplyAsync(() -> {
            if (kind == null) {
                throw new ValidationException("Edge kind is required");
            }
            if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
                throw new ValidationException("Edge endpoints are required");
            }

            Connection conn = connectionManager.getWriteConnection();
            try {
                String now = SQLiteJson.timestamp(Instant.now());
                try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
                    ps.setString(1, UUID.randomUUID().toString());
                    ps.setString(2, kind.value());
                    ps.setString(3, sourceId);
                    ps.setString(4, targetId);
                    // empty incoming text is stored as NULL
                    ps.setString(5, blankToNull(description));
                    ps.setString(6, blankToNull(evidence));
                    ps.setDouble(7, Confidence.clamp(confidence));
                    ps.setString(8, SQLiteJson.writeMetadata(metadata));
                    ps.setString(9, source);
                    ps.setString(10, now);
                    ps.setString(11, now);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT id FROM edges WHERE kind = ? AND source_id = ? AND target_id = ?")) {
                    ps.setString(1, kind.value());
                    ps.setString(2, sourceId);
                    ps.setString(3, targetId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw new PersistenceException("Upserted edge vanished: " + sourceId + " -> " + targetId);
                        }
                        return rs.getString(1);
                    }
                }
            } catch (SQLException e) {
                throw new PersistenceException(
                    "Failed to create edge " + kind.value() + " " + sourceId + " -> " + targetId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<EdgeBatchResult> batchCreateFromExtraction(@NotNull List<ExtractedRelationship> relationships,
            @NotNull EndpointResolver resolver, @Nullable String source) {
        List<String> edgeIds = new ArrayList<>();
        AtomicInteger unresolved = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        // one relationship at a time, in extraction order; no lock is held while resolving
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ExtractedRelationship relationship : relationships) {
            chain = chain.thenCompose(ignored -> createFromExtraction(relationship, resolver, source)
                .<Void>handle((edgeId, error) -> {
                    if (error != null) {
                        failed.incrementAndGet();
                        LOG.warnf("Skipping relationship %s -[%s]-> %s: %s", relationship.source(),
                            relationship.kind().value(), relationship.target(), rootMessage(error));
                    } else if (edgeId.isEmpty()) {
                        unresolved.incrementAndGet();
                        LOG.debugf("Unresolved endpoint for relationship %s -[%s]-> %s", relationship.source(),
                            relationship.kind().value(), relationship.target());
                    } else {
                        edgeIds.add(edgeId.get());
                    }
                    return null;
                }));
        }

        return chain.thenApply(ignored -> {
            EdgeBatchResult result = new EdgeBatchResult(edgeIds, unresolved.get(), failed.get());
            LOG.infof("Persisted %d of %d relationships (%d unresolved, %d failed)",
                result.created(), relationships.size(), result.unresolved(), result.failed());
            return result;
        });
    }

    private CompletableFuture<Optional<String>> createFromExtraction(ExtractedRelationship relationship,
            EndpointResolver resolver, String source) {
        CompletableFuture<Optional<String>> sourceLookup = CompletableFuture.completedFuture(relationship.source())
            .thenCompose(resolver::resolve);
        CompletableFuture<Optional<String>> targetLookup = CompletableFuture.completedFuture(relationship.target())
            .thenCompose(resolver::resolve);
        return sourceLookup
            .thenCombine(targetLookup, (sourceId, targetId) -> {
                if (sourceId.isEmpty() || targetId.isEmpty()) {
                    return Optional.<Endpoints>empty();
                }
                return Optional.of(new Endpoints(sourceId.get(), targetId.get()));
            })
            .<Optional<String>>thenCompose(endpoints -> {
                if (endpoints.isEmpty()) {
                    return CompletableFuture.completedFuture(Optional.<String>empty());
                }
                Endpoints ids = endpoints.get();
                return create(relationship.kind(), ids.sourceId(), ids.targetId(), relationship.description(),
                        relationship.evidence(), relationship.confidence(), relationship.metadata(), source)
                    .thenApply(Optional::of);
            });
    }

    @Override
    public CompletableFuture<Edge> findById(@NotNull String id) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? mapEdge(rs) : null;
                }
            } catch (SQLException e) {
                throw new PersistenceException("Failed to get edge: " + id, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<Edge>> findByEndpoint(@NotNull String nodeId, @NotNull EdgeDirection direction,
            @Nullable EdgeKind kind) {
        return CompletableFuture.supplyAsync(() -> {
            String endpointFilter = switch (direction) {
                case OUTGOING -> "source_id = ?";
                case INCOMING -> "target_id = ?";
                case BOTH -> "(source_id = ? OR target_id = ?)";
            };
            String sql = SELECT_COLUMNS + " WHERE " + endpointFilter
                + (kind != null ? " AND kind = ?" : "")
                + " ORDER BY created_at, id";

            List<Edge> edges = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int index = 1;
                ps.setString(index++, nodeId);
                if (direction == EdgeDirection.BOTH) {
                    ps.setString(index++, nodeId);
                }
                if (kind != null) {
                    ps.setString(index, kind.value());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        edges.add(mapEdge(rs));
                    }
                }
                return edges;
            } catch (SQLException e) {
                throw new PersistenceException("Failed to list edges of node: " + nodeId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Map<EdgeKind, Long>> countByKind() {
        return CompletableFuture.supplyAsync(() -> {
            Map<EdgeKind, Long> counts = new EnumMap<>(EdgeKind.class);
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement("SELECT kind, COUNT(*) FROM edges GROUP BY kind");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(EdgeKind.require(rs.getString(1)), rs.getLong(2));
                }
                return counts;
            } catch (SQLException e) {
                throw new PersistenceException("Failed to count edges", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private Edge mapEdge(ResultSet rs) throws SQLException {
        return new Edge(
            rs.getString("id"),
            EdgeKind.require(rs.getString("kind")),
            rs.getString("source_id"),
            rs.getString("target_id"),
            rs.getString("description"),
            rs.getString("evidence"),
            rs.getDouble("confidence"),
            SQLiteJson.readMetadata(rs.getString("metadata")),
            rs.getString("source"),
            SQLiteJson.parseTimestamp(rs.getString("created_at")),
            SQLiteJson.parseTimestamp(rs.getString("updated_at"))
        );
    }

    private record Endpoints(String sourceId, String targetId) {
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
