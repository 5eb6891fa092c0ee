package br.edu.ifba.scholargraph.storage;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.scholargraph.core.Edge;
import br.edu.ifba.scholargraph.core.EdgeDirection;
import br.edu.ifba.scholargraph.core.EdgeKind;
import br.edu.ifba.scholargraph.core.EndpointResolver;
import br.edu.ifba.scholargraph.core.ExtractedRelationship;

/**
 * Storage for directed, typed relationships between nodes.
 *
 * <p>Edges are identified by {@code (kind, source id, target id)}; direction is
 * part of the identity and self-loops are allowed. Writing an existing identity
 * merges into it: confidence takes the maximum, metadata is a shallow union,
 * and description/evidence are only filled in when the stored value is empty.</p>
 */
public interface EdgeStorage {

    /**
     * Creates or merges an edge. Both endpoints must reference existing nodes.
     *
     * @return id of the created or merged edge
     */
    CompletableFuture<String> create(@NotNull EdgeKind kind, @NotNull String sourceId, @NotNull String targetId,
            @Nullable String description, @Nullable String evidence, double confidence,
            @Nullable Map<String, Object> metadata, @Nullable String source);

    /**
     * Persists extracted relationships, resolving endpoint names through the
     * given resolver. A relationship is written only when both endpoints
     * resolve; unresolved endpoints and per-relationship failures are counted
     * and skipped, they never abort the batch.
     *
     * @param relationships relationships in extraction order
     * @param resolver maps endpoint names to node ids
     * @param source producer identifier stored on every edge
     */
    CompletableFuture<EdgeBatchResult> batchCreateFromExtraction(@NotNull List<ExtractedRelationship> relationships,
            @NotNull EndpointResolver resolver, @Nullable String source);

    /**
     * @return the edge, or null if not found
     */
    CompletableFuture<Edge> findById(@NotNull String id);

    /**
     * Lists edges touching a node.
     *
     * @param nodeId node id
     * @param direction which side of the edge the node must be on
     * @param kind optional kind filter
     */
    CompletableFuture<List<Edge>> findByEndpoint(@NotNull String nodeId, @NotNull EdgeDirection direction,
            @Nullable EdgeKind kind);

    CompletableFuture<Map<EdgeKind, Long>> countByKind();

    /**
     * Outcome of {@link #batchCreateFromExtraction}.
     *
     * @param edgeIds ids of created or merged edges, in input order
     * @param unresolved relationships skipped because an endpoint did not resolve
     * @param failed relationships skipped because the write failed
     */
    record EdgeBatchResult(@NotNull List<String> edgeIds, int unresolved, int failed) {

        public EdgeBatchResult {
            edgeIds = List.copyOf(edgeIds);
        }

        public int created() {
            return edgeIds.size();
        }
    }
}
